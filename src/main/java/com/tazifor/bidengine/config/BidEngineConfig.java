package com.tazifor.bidengine.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tazifor.bidengine.geo.spi.H3Tiler;
import com.tazifor.bidengine.geo.spi.RectGridTiler;
import com.tazifor.bidengine.geo.spi.Tiler;
import com.tazifor.bidengine.repository.AerospikeCampaignRepository;
import com.tazifor.bidengine.repository.CampaignRepository;
import com.tazifor.bidengine.repository.InMemoryCampaignRepository;
import com.tazifor.bidengine.service.AerospikeBudgetLedger;
import com.tazifor.bidengine.service.AuctionEngine;
import com.tazifor.bidengine.service.AuctionWorkerPool;
import com.tazifor.bidengine.service.BidScorer;
import com.tazifor.bidengine.service.BidSource;
import com.tazifor.bidengine.service.BiddingService;
import com.tazifor.bidengine.service.BudgetLedger;
import com.tazifor.bidengine.service.CampaignCatalog;
import com.tazifor.bidengine.service.CampaignIndex;
import com.tazifor.bidengine.service.DuplicateSuppressionFilter;
import com.tazifor.bidengine.service.FrequencyCapService;
import com.tazifor.bidengine.service.HttpWinNotifier;
import com.tazifor.bidengine.service.InMemoryBudgetLedger;
import com.tazifor.bidengine.service.RequestValidator;
import com.tazifor.bidengine.service.TargetingService;
import com.tazifor.bidengine.service.ValuePredictor;
import com.tazifor.bidengine.service.WinNotifier;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Wires the bidding core from {@link BidEngineProperties}.
 *
 * Core classes are plain Java; only this class knows about Spring.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(BidEngineProperties.class)
public class BidEngineConfig {

    private static final int CAMPAIGN_SCAN_LIMIT = 10_000;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Tiler tiler(BidEngineProperties properties) {
        BidEngineProperties.Index index = properties.getIndex();
        return switch (index.getTiler()) {
            case H3 -> new H3Tiler(index.getH3Resolution());
            case RECT -> new RectGridTiler(index.getCellSizeDegrees(), index.getCellSizeDegrees());
        };
    }

    @Bean
    public CampaignIndex campaignIndex(Tiler tiler, BidEngineProperties properties) {
        return new CampaignIndex(tiler, properties.getIndex().getMaxCellsPerZone());
    }

    @Bean
    public FrequencyCapService frequencyCapService(Clock clock) {
        return new FrequencyCapService(clock);
    }

    @Bean
    public DuplicateSuppressionFilter duplicateSuppressionFilter(BidEngineProperties properties) {
        BidEngineProperties.Dedup dedup = properties.getDedup();
        return new DuplicateSuppressionFilter(dedup.getExpectedItemsPerUser(), dedup.getFalsePositiveRate(),
            dedup.getRotation(), dedup.getMaxUsers());
    }

    @Bean
    @ConditionalOnMissingBean
    public ValuePredictor valuePredictor() {
        return ValuePredictor.NEUTRAL;
    }

    @Bean
    public BidScorer bidScorer(BidEngineProperties properties, ValuePredictor valuePredictor) {
        BidEngineProperties.Scorer scorer = properties.getScorer();
        return new BidScorer(scorer.getInterestMatchWeight(), scorer.getMaxInterestWeight(),
            scorer.getMaxProximityBonus(), valuePredictor);
    }

    @Bean
    public TargetingService targetingService() {
        return new TargetingService();
    }

    @Bean
    public RequestValidator requestValidator(Clock clock) {
        return new RequestValidator(clock);
    }

    // ===== Storage =====

    @Bean
    @ConditionalOnProperty(name = "bidengine.store", havingValue = "memory", matchIfMissing = true)
    public InMemoryCampaignRepository inMemoryCampaignRepository(BidEngineProperties properties,
                                                                 ObjectMapper objectMapper,
                                                                 ResourceLoader resourceLoader) {
        String seedLocation = properties.getCampaigns().getSeedLocation();
        if (StringUtils.isBlank(seedLocation)) {
            return new InMemoryCampaignRepository();
        }
        return new InMemoryCampaignRepository(objectMapper, resourceLoader.getResource(seedLocation));
    }

    @Bean
    @ConditionalOnProperty(name = "bidengine.store", havingValue = "memory", matchIfMissing = true)
    public BudgetLedger inMemoryBudgetLedger() {
        return new InMemoryBudgetLedger();
    }

    @Bean
    @ConditionalOnProperty(name = "bidengine.store", havingValue = "aerospike")
    public CampaignRepository aerospikeCampaignRepository(AerospikeClient client, ObjectMapper objectMapper,
                                                          @Value("${aerospike.namespace}") String namespace) {
        return new AerospikeCampaignRepository(client, objectMapper, namespace, CAMPAIGN_SCAN_LIMIT);
    }

    @Bean
    @ConditionalOnProperty(name = "bidengine.store", havingValue = "aerospike")
    public BudgetLedger aerospikeBudgetLedger(AerospikeClient client,
                                              @Qualifier("budgetWritePolicy") WritePolicy budgetWritePolicy,
                                              @Value("${aerospike.namespace}") String namespace) {
        return new AerospikeBudgetLedger(client, budgetWritePolicy, namespace);
    }

    @Bean
    public CampaignCatalog campaignCatalog(CampaignRepository repository, CampaignIndex index,
                                           BudgetLedger budgetLedger, Clock clock) {
        CampaignCatalog catalog = new CampaignCatalog(repository, index, budgetLedger, clock);
        catalog.refreshQuietly();
        return catalog;
    }

    // ===== Auction =====

    @Bean
    public AuctionEngine auctionEngine(BidScorer scorer, BudgetLedger budgetLedger,
                                       FrequencyCapService frequencyCaps,
                                       DuplicateSuppressionFilter duplicateFilter,
                                       BidEngineProperties properties, Clock clock) {
        BidEngineProperties.Auction auction = properties.getAuction();
        return new AuctionEngine(scorer, budgetLedger, frequencyCaps, duplicateFilter,
            auction.getPriceIncrement(), auction.getMaxCascades(), clock);
    }

    @Bean(destroyMethod = "shutdown")
    public AuctionWorkerPool auctionWorkerPool(BidEngineProperties properties) {
        BidEngineProperties.Orchestrator orchestrator = properties.getOrchestrator();
        return new AuctionWorkerPool(orchestrator.getWorkerThreads(), orchestrator.getQueueCapacity(),
            orchestrator.getOverflowPolicy());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService bidSourceExecutor(BidEngineProperties properties) {
        int threads = properties.getOrchestrator().getBidSourceThreads();
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(threads * 4), new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService winNotifierExecutor() {
        return new ThreadPoolExecutor(2, 2, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(1_000), new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public WinNotifier winNotifier(BidEngineProperties properties, RestTemplateBuilder restTemplateBuilder,
                                   @Qualifier("winNotifierExecutor") ExecutorService winNotifierExecutor) {
        BidEngineProperties.Notifier notifier = properties.getNotifier();
        if (!notifier.isEnabled()) {
            log.info("[WIN] Win notifications disabled");
            return WinNotifier.NOOP;
        }
        return new HttpWinNotifier(
            restTemplateBuilder
                .setConnectTimeout(notifier.getTimeout())
                .setReadTimeout(notifier.getTimeout())
                .build(),
            winNotifierExecutor);
    }

    @Bean
    public BiddingService biddingService(RequestValidator validator, CampaignCatalog catalog, CampaignIndex index,
                                         TargetingService targetingService, FrequencyCapService frequencyCaps,
                                         DuplicateSuppressionFilter duplicateFilter, AuctionEngine auctionEngine,
                                         ObjectProvider<BidSource> bidSources,
                                         @Qualifier("bidSourceExecutor") ExecutorService bidSourceExecutor,
                                         WinNotifier winNotifier, BidEngineProperties properties, Clock clock) {
        List<BidSource> sources = bidSources.orderedStream().toList();
        log.info("Bidding service: {} external bid sources, deadline {}",
            sources.size(), properties.getOrchestrator().getDeadline());

        return BiddingService.builder()
            .validator(validator)
            .catalog(catalog)
            .index(index)
            .targetingService(targetingService)
            .frequencyCaps(frequencyCaps)
            .duplicateFilter(duplicateFilter)
            .dedupEnabled(properties.getDedup().isEnabled())
            .auctionEngine(auctionEngine)
            .deadline(properties.getOrchestrator().getDeadline())
            .bidSources(sources)
            .bidSourceExecutor(bidSourceExecutor)
            .winNotifier(winNotifier)
            .currency(properties.getAuction().getCurrency())
            .clock(clock)
            .build();
    }
}
