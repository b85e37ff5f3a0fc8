package quest.gekko.dcr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;
import quest.gekko.dcr.service.challenge.SubstitutionBudgetMode;

import java.time.Duration;

/**
 * Configuration properties for the order feed, the aggregation runs and the challenge rules
 */
@Configuration
@EnableConfigurationProperties({
        RankerProperties.Metabase.class,
        RankerProperties.Aggregation.class,
        RankerProperties.ChallengeRules.class
})
public class RankerProperties {

    @ConfigurationProperties("metabase")
    public record Metabase(@DefaultValue("http://localhost:3000") String url,
                           String apiKey,
                           @DefaultValue Cards cards,
                           @DefaultValue("5") int maxConcurrentCalls,
                           @DefaultValue("3") int maxAttempts,
                           @DefaultValue("800") long backoffMillis) {

        public record Cards(@DefaultValue("1267") int ordersByDate,
                            @DefaultValue("1266") int ordersAll,
                            @DefaultValue("1270") int trendMetrics,
                            @DefaultValue("1271") int brandRatings) {}
    }

    /**
     * @param trendCacheTtl how long a fetched trend window is reused; keep it below the refresh cron interval so
     *                      every refresh of today sees fresh trends
     */
    @ConfigurationProperties("aggregation")
    public record Aggregation(@DefaultValue("20") int entityConcurrency,
                              @DefaultValue("5") int typeConcurrency,
                              @DefaultValue("30") int streakLookbackDays,
                              @DefaultValue("Europe/Berlin") String zone,
                              @DefaultValue("5m") Duration trendCacheTtl) {}

    @ConfigurationProperties("challenge")
    public record ChallengeRules(@DefaultValue("Europe/Berlin") String zone,
                                 @DefaultValue("2") int maxSubstitutionsPerTeam,
                                 @DefaultValue("PER_POSITION") SubstitutionBudgetMode budgetMode,
                                 @DefaultValue("15") int halftimeWindowMinutes,
                                 @DefaultValue("60") int overtimeMinutes) {}
}
