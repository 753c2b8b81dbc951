package com.dmarket.arb.config;

import com.dmarket.arb.core.ArbitrageScanner;
import com.dmarket.arb.core.BatchOptions;
import com.dmarket.arb.core.BatchProcessor;
import com.dmarket.arb.core.LiquidityEnricher;
import com.dmarket.arb.core.OpportunityDetector;
import com.dmarket.arb.core.OpportunityRanker;
import com.dmarket.arb.infra.CheckpointStore;
import com.dmarket.arb.infra.MarketApiClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScanConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scanWorkers(ScannerProperties properties) {
        return Executors.newFixedThreadPool(properties.getBatch().getMaxConcurrency(), new CustomizableThreadFactory("scan-worker-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService notificationExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("opportunity-notify-"));
    }

    @Bean
    public BatchProcessor batchProcessor(@Qualifier("scanWorkers") ExecutorService scanWorkers, Clock clock) {
        return new BatchProcessor(scanWorkers, clock);
    }

    @Bean
    public BatchOptions batchOptions(ScannerProperties properties) {
        ScannerProperties.Batch batch = properties.getBatch();
        ScannerProperties.Checkpoint checkpoint = properties.getCheckpoint();
        return BatchOptions.builder()
                .chunkSize(batch.getChunkSize())
                .maxConcurrency(batch.getMaxConcurrency())
                .drainTimeout(batch.getDrainTimeout())
                .checkpointEveryItems(checkpoint.getSaveEveryItems())
                .checkpointInterval(checkpoint.getSaveEvery())
                .build();
    }

    @Bean
    public ArbitrageScanner arbitrageScanner(MarketApiClient marketApiClient, List<OpportunityDetector> detectors,
                                             LiquidityEnricher liquidityEnricher, OpportunityRanker ranker,
                                             BatchProcessor batchProcessor, BatchOptions batchOptions,
                                             CheckpointStore checkpointStore, Clock clock) {
        return new ArbitrageScanner(marketApiClient, detectors, liquidityEnricher, ranker, batchProcessor, batchOptions,
                checkpointStore, clock);
    }
}
