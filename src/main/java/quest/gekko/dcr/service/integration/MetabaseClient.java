package quest.gekko.dcr.service.integration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.dcr.util.RateLimiter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs saved Metabase questions ("cards") and flattens the column/row payload into one map per row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetabaseClient {
    private final WebClient metabaseWebClient;
    private final RateLimiter rateLimiter;

    public List<Map<String, Object>> executeCard(int cardId, Map<String, Object> templateTags) {
        Map<String, Object> body = Map.of("parameters", toParameters(templateTags));
        log.debug("Executing card {} with {}", cardId, templateTags);

        Map<?, ?> response = rateLimiter.call(() -> metabaseWebClient.post()
                .uri("/api/card/{id}/query", cardId)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(Map.class)
                .block());

        return toRows(response);
    }

    public List<Map<String, Object>> executeCard(int cardId) {
        return executeCard(cardId, Map.of());
    }

    private static List<Map<String, Object>> toParameters(Map<String, Object> templateTags) {
        List<Map<String, Object>> params = new ArrayList<>();
        templateTags.forEach((tag, value) -> params.add(Map.of(
                "type", "category",
                "target", List.of("variable", List.of("template-tag", tag)),
                "value", value)));
        return params;
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> toRows(Map<?, ?> response) {
        if (response == null || !(response.get("data") instanceof Map<?, ?> data)) return List.of();
        if (!(data.get("cols") instanceof List<?> cols) || !(data.get("rows") instanceof List<?> rows)) return List.of();

        List<String> names = new ArrayList<>(cols.size());
        for (Object col : cols) {
            names.add(col instanceof Map<?, ?> m ? String.valueOf(m.get("name")) : String.valueOf(col));
        }

        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Object row : rows) {
            if (!(row instanceof List<?> values)) continue;
            Map<String, Object> mapped = new LinkedHashMap<>();
            for (int i = 0; i < names.size() && i < values.size(); i++) {
                mapped.put(names.get(i), values.get(i));
            }
            out.add(mapped);
        }
        return out;
    }
}
