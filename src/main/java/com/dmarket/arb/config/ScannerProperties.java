package com.dmarket.arb.config;

import com.dmarket.arb.domain.ScanParameters;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "scanner")
public class ScannerProperties {

    private Api api = new Api();
    private RateLimit rateLimit = new RateLimit();
    private Retry retry = new Retry();
    private Breaker circuitBreaker = new Breaker();
    private Cache cache = new Cache();
    private Checkpoint checkpoint = new Checkpoint();
    private Batch batch = new Batch();
    private Scan scan = new Scan();

    @Data
    public static class Api {
        private String baseUrl = "https://api.dmarket.com";
        private String publicKey = "";
        private String secretKey = "";
        private Duration callTimeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class RateLimit {
        private int capacity = 30;
        private Duration period = Duration.ofSeconds(60);
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(10);
        private double jitterRatio = 0.2;
        private Duration maxRetryAfter = Duration.ofSeconds(60);
    }

    @Data
    public static class Breaker {
        private int failureThreshold = 5;
        private Duration failureWindow = Duration.ofSeconds(60);
        private Duration resetTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Cache {
        private long l1MaxEntries = 10_000;
        private Duration listingTtl = Duration.ofMinutes(2);
        private Duration referenceTtl = Duration.ofMinutes(15);
        private boolean l2Enabled = false;
        private String keyPrefix = "dmarket:cache:";
    }

    @Data
    public static class Checkpoint {
        private String store = "file"; // file | redis
        private String directory = "data/checkpoints";
        private String keyPrefix = "dmarket:checkpoint:";
        private int saveEveryItems = 10;
        private Duration saveEvery = Duration.ofSeconds(30);
        private Duration retention = Duration.ofDays(7);
        private Duration purgeInterval = Duration.ofHours(1); // read by the @Scheduled purge
    }

    @Data
    public static class Batch {
        private int chunkSize = 1;
        private int maxConcurrency = 4;
        private Duration drainTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Scan {
        private boolean enabled = true;
        private Duration initialDelay = Duration.ofSeconds(10); // read by the @Scheduled trigger
        private Duration interval = Duration.ofMinutes(5);
        private List<String> games = new ArrayList<>(List.of("a8db"));
        private List<Tier> tiers = new ArrayList<>();
        private int pageSize = 100;
        private int maxPagesPerSegment = 5;
        private int segmentsPerTier = 4;
        private BigDecimal commissionRate = new BigDecimal("0.07");
        private long minProfit = 10; // cents
        private boolean liquidityFilter = true;
        private int minLiquidityScore = 20;
        private int maxResultsPerTier = 50;

        public ScanParameters parametersFor(String gameId, Tier tier) {
            return ScanParameters.builder()
                    .gameId(gameId)
                    .tierName(tier.getName())
                    .priceFrom(tier.getPriceFrom())
                    .priceTo(tier.getPriceTo())
                    .commissionRate(commissionRate)
                    .minProfit(minProfit)
                    .minProfitPercent(tier.getMinProfitPercent())
                    .pageSize(pageSize)
                    .maxPagesPerSegment(maxPagesPerSegment)
                    .segments(segmentsPerTier)
                    .liquidityFilter(liquidityFilter)
                    .minLiquidityScore(minLiquidityScore)
                    .maxResults(maxResultsPerTier)
                    .build();
        }
    }

    @Data
    public static class Tier {
        private String name;
        private long priceFrom; // cents
        private long priceTo; // cents
        private BigDecimal minProfitPercent;
    }
}
