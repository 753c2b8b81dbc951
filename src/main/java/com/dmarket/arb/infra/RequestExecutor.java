package com.dmarket.arb.infra;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Sends signed requests to the marketplace. Every attempt, retries included, takes a rate limiter
 * token and passes the circuit breaker gate first.
 *
 * <p>Classification, applied in this order: 2xx success; 429 rate limited (retried, honours
 * Retry-After, does not count against the breaker); 5xx and I/O failures unavailable (retried,
 * counted by the breaker); any other status a client error (returned at once).
 */
@Slf4j
public class RequestExecutor {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String USER_AGENT = "dmarket-arb/0.1";

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final RequestSigner signer;
    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RequestExecutor(OkHttpClient httpClient, String baseUrl, RequestSigner signer, RateLimiter rateLimiter,
                           CircuitBreaker circuitBreaker, RetryPolicy retryPolicy, Clock clock, Sleeper sleeper) {
        this(httpClient, baseUrl, signer, rateLimiter, circuitBreaker, retryPolicy, clock, sleeper,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public RequestExecutor(OkHttpClient httpClient, String baseUrl, RequestSigner signer, RateLimiter rateLimiter,
                           CircuitBreaker circuitBreaker, RetryPolicy retryPolicy, Clock clock, Sleeper sleeper,
                           DoubleSupplier random) {
        this.httpClient = httpClient;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.signer = signer;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.sleeper = sleeper;
        this.random = random;
    }

    public ApiResult<ApiResponse> send(RequestSpec spec) {
        HttpUrl url = resolve(spec);
        ApiError lastError = null;

        for (int attempt = 1; attempt <= retryPolicy.getMaxAttempts(); attempt++) {
            try {
                rateLimiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ApiResult.failure(ApiError.unavailable(0, "Interrupted while waiting for rate limiter"));
            }

            Optional<CircuitBreaker.Permission> admitted = circuitBreaker.tryAcquirePermission();
            if (admitted.isEmpty()) {
                log.debug("[API] {} {} rejected, circuit '{}' is open", spec.getMethod(), spec.getPath(), circuitBreaker.getName());
                return ApiResult.failure(ApiError.circuitOpen("Circuit '" + circuitBreaker.getName() + "' is open"));
            }

            CircuitBreaker.Permission permission = admitted.get();
            Duration delay;
            try (Response response = httpClient.newCall(buildRequest(spec, url)).execute()) {
                int code = response.code();
                if (response.isSuccessful()) {
                    circuitBreaker.recordSuccess(permission);
                    ResponseBody body = response.body();
                    return ApiResult.success(new ApiResponse(code, body == null ? "" : body.string()));
                }
                if (code == 429) {
                    circuitBreaker.releasePermission(permission);
                    lastError = ApiError.rateLimited("Rate limited on " + spec.getPath());
                    Duration hint = parseRetryAfter(response.header("Retry-After"));
                    delay = hint != null ? retryPolicy.retryAfter(hint) : retryPolicy.backoff(attempt, random.getAsDouble());
                } else if (code >= 500) {
                    circuitBreaker.recordFailure(permission);
                    lastError = ApiError.unavailable(code, "Upstream error on " + spec.getPath() + ": " + response.message());
                    delay = retryPolicy.backoff(attempt, random.getAsDouble());
                } else {
                    // client errors say nothing about upstream health
                    circuitBreaker.recordSuccess(permission);
                    String detail = response.body() != null ? response.body().string() : "";
                    log.warn("[API] {} {} failed with {}: {}", spec.getMethod(), spec.getPath(), code, abbreviate(detail));
                    return ApiResult.failure(ApiError.clientError(code, "Request rejected: " + abbreviate(detail)));
                }
            } catch (IOException e) {
                circuitBreaker.recordFailure(permission);
                lastError = ApiError.unavailable(0, "I/O failure on " + spec.getPath() + ": " + e.getMessage());
                delay = retryPolicy.backoff(attempt, random.getAsDouble());
            }

            if (attempt < retryPolicy.getMaxAttempts()) {
                log.warn("[API] {} {} attempt {}/{} failed ({}), retrying in {} ms", spec.getMethod(), spec.getPath(),
                        attempt, retryPolicy.getMaxAttempts(), lastError.getKind(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return ApiResult.failure(lastError);
                }
            }
        }

        log.warn("[API] {} {} gave up after {} attempts: {}", spec.getMethod(), spec.getPath(), retryPolicy.getMaxAttempts(), lastError);
        return ApiResult.failure(lastError);
    }

    HttpUrl resolve(RequestSpec spec) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        String path = spec.getPath().startsWith("/") ? spec.getPath().substring(1) : spec.getPath();
        builder.addPathSegments(path);
        for (Map.Entry<String, String> param : spec.getQuery().entrySet()) {
            builder.addQueryParameter(param.getKey(), param.getValue());
        }
        return builder.build();
    }

    private Request buildRequest(RequestSpec spec, HttpUrl url) {
        String pathWithQuery = url.encodedPath() + (url.encodedQuery() != null ? "?" + url.encodedQuery() : "");
        long timestamp = clock.instant().getEpochSecond();

        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json");
        signer.sign(spec.getMethod(), pathWithQuery, spec.bodyOrEmpty(), timestamp).forEach(builder::header);

        RequestBody body = spec.getBody() != null ? RequestBody.create(spec.getBody(), JSON) : null;
        if (body == null && "POST".equalsIgnoreCase(spec.getMethod())) {
            body = RequestBody.create("", JSON);
        }
        return builder.method(spec.getMethod().toUpperCase(), body).build();
    }

    private Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        if (value.length() <= 9 && value.chars().allMatch(Character::isDigit)) {
            return Duration.ofSeconds(Long.parseLong(value));
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration until = Duration.between(clock.instant(), at.toInstant());
            return until.isNegative() ? Duration.ZERO : until;
        } catch (DateTimeParseException e) {
            log.debug("[API] Ignoring unparseable Retry-After '{}'", header);
            return null;
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
