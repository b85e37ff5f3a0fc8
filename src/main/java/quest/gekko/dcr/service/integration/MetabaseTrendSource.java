package quest.gekko.dcr.service.integration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import quest.gekko.dcr.config.CacheConfig;
import quest.gekko.dcr.config.RankerProperties;
import quest.gekko.dcr.domain.EntityType;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the TrendMetrics collection through a saved card filtered by entity kind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetabaseTrendSource implements TrendSource {
    private final MetabaseClient metabase;
    private final RankerProperties.Metabase props;

    @Override
    @Cacheable(value = CacheConfig.TREND_SNAPSHOTS, key = "#type + ':' + #date")
    public Map<String, TrendSnapshot> fetchSnapshots(EntityType type, LocalDate date) {
        String entityKey = trendEntityKey(type);
        if (entityKey == null) return Map.of();

        var rows = metabase.executeCard(props.cards().trendMetrics(), Map.of("entity", entityKey, "date", date.toString()));
        Map<String, TrendSnapshot> out = new LinkedHashMap<>();
        for (var row : rows) {
            String name = MetabaseRows.string(row, "entityName", "EntityName");
            if (name == null || name.isEmpty()) continue;
            out.put(name, new TrendSnapshot(name,
                    MetabaseRows.longValue(row, "days1", "Days1"),
                    MetabaseRows.longValue(row, "days7", "Days7"),
                    MetabaseRows.longValue(row, "days14", "Days14"),
                    MetabaseRows.longValue(row, "days30", "Days30"),
                    MetabaseRows.longValue(row, "days60", "Days60"),
                    MetabaseRows.longValue(row, "days90", "Days90"),
                    (int) MetabaseRows.longValue(row, "days1Rank", "Days1Rank"),
                    (int) MetabaseRows.longValue(row, "days7Rank", "Days7Rank"),
                    (int) MetabaseRows.longValue(row, "days14Rank", "Days14Rank"),
                    (int) MetabaseRows.longValue(row, "days30Rank", "Days30Rank"),
                    (int) MetabaseRows.longValue(row, "days60Rank", "Days60Rank"),
                    (int) MetabaseRows.longValue(row, "days90Rank", "Days90Rank")));
        }
        log.info("Loaded {} trend snapshots for {} on {}", out.size(), type, date);
        return out;
    }

    static String trendEntityKey(EntityType type) {
        return switch (type) {
            case MANUFACTURER -> "productManufacturer";
            case STRAIN -> "productStrainName";
            case PRODUCT -> "productName";
            case PHARMACY -> "pharmacyName";
            case BRAND -> null; // brands have no order-volume trends
        };
    }
}
