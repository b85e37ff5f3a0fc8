package quest.gekko.dcr.service.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.dcr.config.RankerProperties;
import quest.gekko.dcr.service.core.DailyAggregationService;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

@Slf4j
@Service
public class AggregationScheduler {
    private final DailyAggregationService aggregationService;
    private final Clock clock;
    private final ZoneId zone;

    public AggregationScheduler(final DailyAggregationService aggregationService,
                                final Clock clock,
                                final RankerProperties.Aggregation props) {
        this.aggregationService = aggregationService;
        this.clock = clock;
        this.zone = ZoneId.of(props.zone());
    }

    /**
     * Refreshes today's live scores and re-finalizes yesterday, every 10 minutes.
     */
    @Scheduled(cron = "${aggregation.cron:0 */10 * * * *}", zone = "${aggregation.zone:Europe/Berlin}")
    public void runDailyAggregation() {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        for (LocalDate date : new LocalDate[] { today, today.minusDays(1) }) {
            try {
                var summary = aggregationService.aggregateForDate(date);
                log.info("Scheduled aggregation for {}: {} orders, {}", date, summary.totalOrders(), summary.perEntityType());
            } catch (RuntimeException e) {
                log.error("Scheduled aggregation for {} failed", date, e);
            }
        }
    }
}
