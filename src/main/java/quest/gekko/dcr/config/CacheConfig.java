package quest.gekko.dcr.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableCaching
public class CacheConfig {
    public static final String TREND_SNAPSHOTS = "trendSnapshots";
    public static final String ENTITY_IDS = "entityIds";

    @Bean
    public Caffeine<Object, Object> caffeine() {
        return Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofMinutes(15));
    }

    @Bean
    public CacheManager cacheManager(final Caffeine<Object, Object> caffeine, final RankerProperties.Aggregation aggregation) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager(ENTITY_IDS);
        cacheManager.setCaffeine(caffeine);
        // Trend windows move with every order of the day, so they expire before the next scheduled refresh.
        cacheManager.registerCustomCache(TREND_SNAPSHOTS, Caffeine.newBuilder()
                .maximumSize(1_000)
                .expireAfterWrite(aggregation.trendCacheTtl())
                .build());
        return cacheManager;
    }
}
