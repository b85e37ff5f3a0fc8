package quest.gekko.dcr.service.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import quest.gekko.dcr.config.RankerProperties;
import quest.gekko.dcr.domain.EntityType;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MetabaseSourcesTest {
    private static final RankerProperties.Metabase PROPS = new RankerProperties.Metabase(
            "http://metabase", "key", new RankerProperties.Metabase.Cards(1267, 1266, 1270, 1271), 5, 3, 800);
    private static final RankerProperties.Aggregation AGGREGATION = new RankerProperties.Aggregation(20, 5, 30, "Europe/Berlin", Duration.ofMinutes(5));

    private MetabaseClient client;

    @BeforeEach
    void setUp() {
        client = mock(MetabaseClient.class);
    }

    @Test
    void orderRowsWithoutADateAreDropped() {
        Map<String, Object> good = new HashMap<>();
        good.put("OrderDate", "Nov 7, 2024, 14:51");
        good.put("ProductManufacturer", "Aurora");
        good.put("ProductStrainName", "Pink Kush");
        good.put("ProductName", "Aurora Pink Kush 22/1");
        good.put("PharmacyName", "Apotheke am Markt");
        good.put("Quantity", 10);
        good.put("TotalPrice", "1.099,90");
        Map<String, Object> undated = new HashMap<>(good);
        undated.put("OrderDate", null);
        when(client.executeCard(1267, Map.of("date", "2024-11-07"))).thenReturn(List.of(good, undated));

        List<TransactionRecord> records = new MetabaseOrderSource(client, PROPS, AGGREGATION).fetchForDate(LocalDate.of(2024, 11, 7));

        assertThat(records).containsExactly(new TransactionRecord("Aurora", "Pink Kush", "Aurora Pink Kush 22/1",
                "Apotheke am Markt", 10, new BigDecimal("1099.90"), LocalDateTime.of(2024, 11, 7, 14, 51)));
    }

    @Test
    void trendRowsAreKeyedByEntityName() {
        when(client.executeCard(1270, Map.of("entity", "productStrainName", "date", "2024-11-07"))).thenReturn(List.of(
                Map.of("entityName", "Pink Kush", "days1", 20, "days7", 70, "days14", 120, "days1Rank", 3),
                Map.of("days1", 5)));

        Map<String, TrendSnapshot> trends = new MetabaseTrendSource(client, PROPS).fetchSnapshots(EntityType.STRAIN, LocalDate.of(2024, 11, 7));

        assertThat(trends).containsOnlyKeys("Pink Kush");
        TrendSnapshot pinkKush = trends.get("Pink Kush");
        assertThat(pinkKush.days7()).isEqualTo(70);
        assertThat(pinkKush.days14()).isEqualTo(120);
        assertThat(pinkKush.days1Rank()).isEqualTo(3);
        assertThat(pinkKush.days90()).isZero();
    }

    @Test
    void brandsHaveNoTrendCard() {
        assertThat(new MetabaseTrendSource(client, PROPS).fetchSnapshots(EntityType.BRAND, LocalDate.of(2024, 11, 7))).isEmpty();
        verify(client, never()).executeCard(anyInt(), anyMap());
    }

    @Test
    void brandRatingsAreRead() {
        when(client.executeCard(1271)).thenReturn(List.of(
                Map.of("brandName", "Aurora", "totalRatings", 42, "averageRating", "4,5", "bayesianAverage", 4.37)));

        assertThat(new MetabaseBrandRatingSource(client, PROPS).fetchRatings())
                .containsExactly(new BrandRating("Aurora", 42, 4.5, 4.37));
    }
}
