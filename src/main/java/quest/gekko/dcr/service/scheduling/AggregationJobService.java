package quest.gekko.dcr.service.scheduling;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import quest.gekko.dcr.service.core.AggregationLogger;
import quest.gekko.dcr.service.core.AggregationOptions;
import quest.gekko.dcr.service.core.AggregationSummary;
import quest.gekko.dcr.service.core.DailyAggregationService;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Queues aggregation runs in the background and hands back a job id straight away; callers poll
 * {@link #find(String)} for the outcome.
 */
@Slf4j
@Service
public class AggregationJobService {
    private final DailyAggregationService aggregationService;
    private final Executor jobExecutor;
    private final Clock clock;
    private final Cache<String, AggregationJob> jobs = Caffeine.newBuilder()
            .maximumSize(1_000)
            .expireAfterWrite(Duration.ofDays(2))
            .build();

    public AggregationJobService(final DailyAggregationService aggregationService,
                                 @Qualifier("jobExecutor") final Executor jobExecutor,
                                 final Clock clock) {
        this.aggregationService = aggregationService;
        this.jobExecutor = jobExecutor;
        this.clock = clock;
    }

    public AggregationJob submit(final LocalDate date) {
        String id = UUID.randomUUID().toString();
        AggregationJob job = AggregationJob.queued(id, date, clock.instant());
        jobs.put(id, job);
        jobExecutor.execute(() -> run(id, date));
        log.info("Queued aggregation job {} for {}", id, date);
        return job;
    }

    public Optional<AggregationJob> find(final String id) {
        return Optional.ofNullable(jobs.getIfPresent(id));
    }

    private void run(String id, LocalDate date) {
        jobs.asMap().computeIfPresent(id, (k, j) -> j.running());
        AggregationLogger jobLogger = new AggregationLogger() {
            @Override
            public void warn(String message) {
                log.debug("job {}: {}", id, message);
            }
        };
        try {
            AggregationSummary summary = aggregationService.aggregateForDate(date, AggregationOptions.withLogger(jobLogger));
            jobs.asMap().computeIfPresent(id, (k, j) -> j.succeeded(summary, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Aggregation job {} for {} failed", id, date, e);
            jobs.asMap().computeIfPresent(id, (k, j) -> j.failed(e.getMessage(), clock.instant()));
        }
    }
}
