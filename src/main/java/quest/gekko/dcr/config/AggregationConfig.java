package quest.gekko.dcr.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AggregationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs the five entity-type pipelines side by side. */
    @Bean
    public ThreadPoolTaskExecutor aggregationExecutor(final RankerProperties.Aggregation props) {
        return executor("agg-type-", props.typeConcurrency());
    }

    /** Bounded fan-out for per-entity resolve, score and persist work. */
    @Bean
    public ThreadPoolTaskExecutor entityExecutor(final RankerProperties.Aggregation props) {
        return executor("agg-entity-", props.entityConcurrency());
    }

    /** Background aggregation jobs submitted over HTTP or by the scheduler. */
    @Bean
    public ThreadPoolTaskExecutor jobExecutor() {
        return executor("agg-job-", 1);
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        return executor;
    }
}
