package quest.gekko.dcr.service.integration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.dcr.config.RankerProperties;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Service
public class MetabaseOrderSource implements TransactionRecordSource {
    private final MetabaseClient metabase;
    private final RankerProperties.Metabase.Cards cards;
    private final ZoneId zone;

    public MetabaseOrderSource(final MetabaseClient metabase,
                               final RankerProperties.Metabase props,
                               final RankerProperties.Aggregation aggregation) {
        this.metabase = metabase;
        this.cards = props.cards();
        this.zone = ZoneId.of(aggregation.zone());
    }

    @Override
    public List<TransactionRecord> fetchForDate(LocalDate date) {
        var rows = metabase.executeCard(cards.ordersByDate(), Map.of("date", date.toString()));
        log.info("Date-filtered order card returned {} rows for {}", rows.size(), date);
        return toRecords(rows);
    }

    @Override
    public List<TransactionRecord> fetchAll() {
        var rows = metabase.executeCard(cards.ordersAll());
        log.info("Full order card returned {} rows", rows.size());
        return toRecords(rows);
    }

    List<TransactionRecord> toRecords(List<Map<String, Object>> rows) {
        return rows.stream()
                .map(this::toRecord)
                .filter(Objects::nonNull)
                .toList();
    }

    private TransactionRecord toRecord(Map<String, Object> row) {
        var orderedAt = MetabaseRows.timestamp(MetabaseRows.first(row, "OrderDate", "orderDate"), zone);
        if (orderedAt == null) {
            log.debug("Dropping order row without a parseable date: {}", row.get("ID"));
            return null;
        }
        var amount = MetabaseRows.decimal(MetabaseRows.first(row, "TotalPrice", "totalPrice"));
        return new TransactionRecord(
                MetabaseRows.string(row, "ProductManufacturer", "productManufacturer"),
                MetabaseRows.string(row, "ProductStrainName", "productStrainName"),
                MetabaseRows.string(row, "ProductName", "productName", "Product"),
                MetabaseRows.string(row, "PharmacyName", "pharmacyName"),
                MetabaseRows.longValue(row, "Quantity", "quantity"),
                amount,
                orderedAt);
    }
}
