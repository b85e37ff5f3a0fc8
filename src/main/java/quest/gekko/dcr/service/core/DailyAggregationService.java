package quest.gekko.dcr.service.core;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import quest.gekko.dcr.domain.EntityType;
import quest.gekko.dcr.service.integration.BrandRatingSource;
import quest.gekko.dcr.service.integration.EntityResolver;
import quest.gekko.dcr.service.integration.TransactionRecord;
import quest.gekko.dcr.service.integration.TransactionRecordSource;
import quest.gekko.dcr.service.integration.TrendSnapshot;
import quest.gekko.dcr.service.integration.TrendSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns one day of raw orders into ranked, scored stat rows for every entity type.
 *
 * <p>Per type: aggregate, rank, then resolve/score/persist each entity on the bounded entity executor. Ranks are
 * fixed before any per-entity work starts. A failure for one entity is counted as skipped and never aborts the
 * type; only losing both order fetches fails the run. Re-running a date overwrites that date's rows.
 *
 * <p>Runs for the same date are serialized: a scheduled refresh and a submitted job never upsert the same rows at
 * once. Runs for different dates proceed in parallel.
 */
@Slf4j
@Service
public class DailyAggregationService {
    private final TransactionRecordSource recordSource;
    private final BrandRatingSource brandRatingSource;
    private final EntityResolver resolver;
    private final TrendSource trendSource;
    private final TrendHistoryService historyService;
    private final StatsService statsService;
    private final Executor aggregationExecutor;
    private final Executor entityExecutor;
    private final Cache<LocalDate, ReentrantLock> runLocks = Caffeine.newBuilder().weakValues().build();

    public DailyAggregationService(final TransactionRecordSource recordSource,
                                   final BrandRatingSource brandRatingSource,
                                   final EntityResolver resolver,
                                   final TrendSource trendSource,
                                   final TrendHistoryService historyService,
                                   final StatsService statsService,
                                   @Qualifier("aggregationExecutor") final Executor aggregationExecutor,
                                   @Qualifier("entityExecutor") final Executor entityExecutor) {
        this.recordSource = recordSource;
        this.brandRatingSource = brandRatingSource;
        this.resolver = resolver;
        this.trendSource = trendSource;
        this.historyService = historyService;
        this.statsService = statsService;
        this.aggregationExecutor = aggregationExecutor;
        this.entityExecutor = entityExecutor;
    }

    public AggregationSummary aggregateForDate(final LocalDate date) {
        return aggregateForDate(date, AggregationOptions.DEFAULT);
    }

    public AggregationSummary aggregateForDate(final LocalDate date, final AggregationOptions options) {
        final ReentrantLock lock = runLocks.get(date, d -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.info("[{}] Another aggregation for this date is running, waiting for it", date);
            lock.lock();
        }
        try {
            return runExclusively(date, options);
        } finally {
            lock.unlock();
        }
    }

    private AggregationSummary runExclusively(final LocalDate date, final AggregationOptions options) {
        final AggregationOptions opts = options == null ? AggregationOptions.DEFAULT : options;
        final RunLog runLog = new RunLog(date, opts.logger());
        runLog.info("Starting aggregation for " + opts.entityTypes());

        final List<TransactionRecord> orders = fetchOrders(date, runLog);
        runLog.info("Fetched " + orders.size() + " orders");

        Map<EntityType, CompletableFuture<AggregationSummary.TypeSummary>> pending = new EnumMap<>(EntityType.class);
        for (EntityType type : opts.entityTypes()) {
            pending.put(type, CompletableFuture
                    .supplyAsync(() -> aggregateType(type, date, orders, runLog), aggregationExecutor)
                    .exceptionally(ex -> {
                        runLog.error(type + " pipeline failed", ex);
                        return AggregationSummary.TypeSummary.EMPTY;
                    }));
        }

        Map<EntityType, AggregationSummary.TypeSummary> perType = new EnumMap<>(EntityType.class);
        pending.forEach((type, future) -> perType.put(type, future.join()));

        runLog.info("Aggregation complete: " + perType);
        return new AggregationSummary(date, orders.size(), perType);
    }

    /**
     * Prefers the date-filtered card; on any failure falls back to the full export and filters by the local date of
     * each order.
     */
    List<TransactionRecord> fetchOrders(final LocalDate date, final RunLog runLog) {
        try {
            return recordSource.fetchForDate(date);
        } catch (RuntimeException narrowFailure) {
            runLog.warn("Date-filtered fetch failed (" + narrowFailure.getMessage() + "), falling back to client-side filtering");
            try {
                return recordSource.fetchAll().stream()
                        .filter(r -> r.orderedAt() != null && r.orderedAt().toLocalDate().equals(date))
                        .toList();
            } catch (RuntimeException broadFailure) {
                broadFailure.addSuppressed(narrowFailure);
                throw new DataSourceUnavailableException("Order source unavailable for " + date, broadFailure);
            }
        }
    }

    AggregationSummary.TypeSummary aggregateType(final EntityType type, final LocalDate date,
                                                 final List<TransactionRecord> orders, final RunLog runLog) {
        final Map<String, EntityCounters> aggregated;
        if (type == EntityType.BRAND) {
            try {
                aggregated = EntityAggregator.fromRatings(brandRatingSource.fetchRatings());
            } catch (RuntimeException e) {
                runLog.error("Brand ratings unavailable, skipping brands", e);
                return AggregationSummary.TypeSummary.EMPTY;
            }
        } else {
            aggregated = EntityAggregator.aggregate(type, orders);
        }

        final List<RankedEntity> ranked = Ranker.rank(type, aggregated);
        runLog.info("Found " + ranked.size() + " unique " + type);
        if (ranked.isEmpty()) return AggregationSummary.TypeSummary.EMPTY;

        final Map<String, TrendSnapshot> trends = loadTrends(type, date, runLog);
        final long categoryDays7 = trends.values().stream().mapToLong(TrendSnapshot::days7).sum();

        AtomicInteger processed = new AtomicInteger();
        AtomicInteger skipped = new AtomicInteger();
        List<CompletableFuture<Void>> work = new ArrayList<>(ranked.size());
        for (RankedEntity entity : ranked) {
            work.add(CompletableFuture.runAsync(() -> {
                if (processEntity(type, date, entity, trends.get(entity.name()), categoryDays7, runLog)) {
                    processed.incrementAndGet();
                } else {
                    skipped.incrementAndGet();
                }
            }, entityExecutor));
        }
        CompletableFuture.allOf(work.toArray(new CompletableFuture[0])).join();

        return new AggregationSummary.TypeSummary(processed.get(), skipped.get());
    }

    private boolean processEntity(final EntityType type, final LocalDate date, final RankedEntity entity,
                                  final TrendSnapshot snapshot, final long categoryDays7, final RunLog runLog) {
        try {
            Optional<Long> entityId = resolver.resolve(type, entity.name());
            if (entityId.isEmpty()) {
                runLog.warn(type + " not found: " + entity.name());
                return false;
            }

            TrendInputs inputs = type == EntityType.BRAND
                    ? historyService.inputsFor(type, entityId.get(), date, entity.rank(), null, 0)
                    : historyService.inputsFor(type, entityId.get(), date, entity.rank(), snapshot, categoryDays7);
            ScoreBreakdown score = TrendScoringEngine.score(type, entity.counters(), entity.rank(), inputs);
            statsService.upsert(type, entityId.get(), date, entity, score);

            log.debug("[{}] {}: {} orders, {}x trend, {} pts (rank #{})", date, entity.name(),
                    entity.counters().orderCount(), String.format("%.2f", score.trendMultiplier()), score.totalPoints(), entity.rank());
            return true;
        } catch (RuntimeException e) {
            runLog.error("Error processing " + type + " " + entity.name(), e);
            return false;
        }
    }

    private Map<String, TrendSnapshot> loadTrends(final EntityType type, final LocalDate date, final RunLog runLog) {
        try {
            Map<String, TrendSnapshot> snapshots = trendSource.fetchSnapshots(type, date);
            return snapshots == null ? Map.of() : snapshots;
        } catch (RuntimeException e) {
            runLog.warn("Trend data unavailable for " + type + " (" + e.getMessage() + "), scoring with neutral trends");
            return Map.of();
        }
    }

    /** Mirrors every message to SLF4J and to the caller's optional logger; a broken caller logger is ignored. */
    static final class RunLog {
        private final LocalDate date;
        private final AggregationLogger sink;

        RunLog(LocalDate date, AggregationLogger sink) {
            this.date = date;
            this.sink = sink;
        }

        void info(String message) {
            log.info("[{}] {}", date, message);
            forward(() -> sink.info(message));
        }

        void warn(String message) {
            log.warn("[{}] {}", date, message);
            forward(() -> sink.warn(message));
        }

        void error(String message, Throwable cause) {
            log.error("[{}] {}", date, message, cause);
            forward(() -> sink.error(message, cause));
        }

        private void forward(Runnable call) {
            try {
                call.run();
            } catch (RuntimeException e) {
                log.error("Aggregation logger callback failed", e);
            }
        }
    }
}
