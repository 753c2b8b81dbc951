package com.dmarket.arb.config;

import com.dmarket.arb.infra.ApiCredentials;
import com.dmarket.arb.infra.CircuitBreaker;
import com.dmarket.arb.infra.MarketApiClient;
import com.dmarket.arb.infra.RateLimiter;
import com.dmarket.arb.infra.RequestExecutor;
import com.dmarket.arb.infra.RequestSigner;
import com.dmarket.arb.infra.RetryPolicy;
import com.dmarket.arb.infra.Sleeper;
import com.dmarket.arb.infra.TieredCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.ConnectionSpec;
import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Upstream access: HTTP client, signing, rate limiting, circuit breaking and retry, all created
 * once and shared by every scan.
 */
@Configuration
@EnableConfigurationProperties(ScannerProperties.class)
public class ApiClientConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public OkHttpClient okHttpClient(ScannerProperties properties) {
        ScannerProperties.Api api = properties.getApi();
        ConnectionSpec tls = new ConnectionSpec.Builder(ConnectionSpec.MODERN_TLS)
                .allEnabledTlsVersions()
                .allEnabledCipherSuites()
                .build();
        // the executor owns retries; the call timeout is the per-call deadline
        return new OkHttpClient.Builder()
                .connectionSpecs(List.of(tls, ConnectionSpec.CLEARTEXT))
                .connectTimeout(api.getConnectTimeout())
                .readTimeout(api.getCallTimeout())
                .callTimeout(api.getCallTimeout())
                .retryOnConnectionFailure(false)
                .build();
    }

    @Bean
    public RequestSigner requestSigner(ScannerProperties properties) {
        ScannerProperties.Api api = properties.getApi();
        return new RequestSigner(new ApiCredentials(api.getPublicKey(), api.getSecretKey()));
    }

    @Bean
    public RateLimiter rateLimiter(ScannerProperties properties, Clock clock, Sleeper sleeper) {
        ScannerProperties.RateLimit limit = properties.getRateLimit();
        return new RateLimiter(limit.getCapacity(), limit.getPeriod(), clock, sleeper);
    }

    @Bean
    public CircuitBreaker marketApiCircuitBreaker(ScannerProperties properties, Clock clock) {
        ScannerProperties.Breaker breaker = properties.getCircuitBreaker();
        return new CircuitBreaker("dmarket-api", breaker.getFailureThreshold(), breaker.getFailureWindow(),
                breaker.getResetTimeout(), clock);
    }

    @Bean
    public RetryPolicy retryPolicy(ScannerProperties properties) {
        ScannerProperties.Retry retry = properties.getRetry();
        return RetryPolicy.builder()
                .maxAttempts(retry.getMaxAttempts())
                .baseDelay(retry.getBaseDelay())
                .multiplier(retry.getMultiplier())
                .maxDelay(retry.getMaxDelay())
                .jitterRatio(retry.getJitterRatio())
                .maxRetryAfter(retry.getMaxRetryAfter())
                .build();
    }

    @Bean
    public RequestExecutor requestExecutor(OkHttpClient okHttpClient, ScannerProperties properties, RequestSigner signer,
                                           RateLimiter rateLimiter, CircuitBreaker circuitBreaker, RetryPolicy retryPolicy,
                                           Clock clock, Sleeper sleeper) {
        return new RequestExecutor(okHttpClient, properties.getApi().getBaseUrl(), signer, rateLimiter, circuitBreaker,
                retryPolicy, clock, sleeper);
    }

    @Bean
    public MarketApiClient marketApiClient(RequestExecutor requestExecutor, TieredCache tieredCache, ObjectMapper objectMapper) {
        return new MarketApiClient(requestExecutor, tieredCache, objectMapper);
    }
}
