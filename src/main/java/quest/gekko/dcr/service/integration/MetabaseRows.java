package quest.gekko.dcr.service.integration;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Lenient readers for Metabase row values. The order export mixes German number formatting ("1.234,5"),
 * display dates ("Nov 7, 2024, 14:51") and ISO timestamps depending on the card.
 */
final class MetabaseRows {
    private static final List<DateTimeFormatter> DISPLAY_FORMATS = List.of(
            DateTimeFormatter.ofPattern("MMM d, yyyy, HH:mm", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMMM d, yyyy, HH:mm", Locale.ENGLISH));

    private MetabaseRows() {
    }

    /** First non-null value among the candidate column names. */
    static Object first(Map<String, Object> row, String... keys) {
        for (String k : keys) {
            Object v = row.get(k);
            if (v != null) return v;
        }
        return null;
    }

    static String string(Map<String, Object> row, String... keys) {
        Object v = first(row, keys);
        return v == null ? null : v.toString().trim();
    }

    static long longValue(Map<String, Object> row, String... keys) {
        BigDecimal d = decimal(first(row, keys));
        return d == null ? 0L : d.longValue();
    }

    static double doubleValue(Map<String, Object> row, String... keys) {
        BigDecimal d = decimal(first(row, keys));
        return d == null ? 0d : d.doubleValue();
    }

    static BigDecimal decimal(Object value) {
        if (value == null) return null;
        if (value instanceof BigDecimal b) return b;
        if (value instanceof Number n) return new BigDecimal(n.toString());

        String s = value.toString().trim();
        if (s.isEmpty()) return null;
        if (s.indexOf(',') >= 0) {
            // German format: dots group thousands, comma marks decimals
            s = s.replace(".", "").replace(',', '.');
        }
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Parses any of the supported timestamp shapes; offset timestamps are shifted into {@code zone}. */
    static LocalDateTime timestamp(Object value, ZoneId zone) {
        if (value == null) return null;
        String s = value.toString().trim();
        if (s.isEmpty()) return null;

        List<Function<String, LocalDateTime>> parsers = List.of(
                v -> OffsetDateTime.parse(v).atZoneSameInstant(zone).toLocalDateTime(),
                LocalDateTime::parse,
                v -> LocalDateTime.parse(v, DISPLAY_FORMATS.get(0)),
                v -> LocalDateTime.parse(v, DISPLAY_FORMATS.get(1)));
        for (Function<String, LocalDateTime> parser : parsers) {
            LocalDateTime parsed = tryParse(s, parser);
            if (parsed != null) return parsed;
        }
        return null;
    }

    private static LocalDateTime tryParse(String s, Function<String, LocalDateTime> parser) {
        try {
            return parser.apply(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
