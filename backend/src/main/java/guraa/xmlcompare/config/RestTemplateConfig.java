package guraa.xmlcompare.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client used to log in to and download documents from remote hosts.
 * Connect and read timeouts bound every individual request.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate documentRestTemplate(RestTemplateBuilder builder, AppProperties appProperties) {
        return builder
                .setConnectTimeout(appProperties.getHttp().getConnectTimeout())
                .setReadTimeout(appProperties.getHttp().getReadTimeout())
                .build();
    }
}
