package quest.gekko.dcr.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class MetabaseConfig {

    @Bean
    public WebClient metabaseWebClient(final WebClient.Builder builder, final RankerProperties.Metabase props) {
        WebClient.Builder b = builder
                .baseUrl(props.url())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                // card exports for a full order history are large
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(64 * 1024 * 1024))
                        .build());
        if (props.apiKey() != null && !props.apiKey().isBlank()) {
            b.defaultHeader("X-API-KEY", props.apiKey());
        }
        return b.build();
    }
}
