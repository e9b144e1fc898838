package guraa.xmlcompare.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the application
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Session session = new Session();
    private final Http http = new Http();
    private final Cors cors = new Cors();
    private final Xml xml = new Xml();

    public Session getSession() {
        return session;
    }

    public Http getHttp() {
        return http;
    }

    public Cors getCors() {
        return cors;
    }

    public Xml getXml() {
        return xml;
    }

    /**
     * Session store configuration properties
     */
    public static class Session {
        private Duration ttl = Duration.ofHours(1);
        private Duration sweepInterval = Duration.ofMinutes(5);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    /**
     * Outbound HTTP configuration properties
     */
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    /**
     * CORS configuration properties
     */
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
        private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST"));
        private Long maxAge = 3600L;

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }

        public List<String> getAllowedMethods() {
            return allowedMethods;
        }

        public void setAllowedMethods(List<String> allowedMethods) {
            this.allowedMethods = allowedMethods;
        }

        public Long getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Long maxAge) {
            this.maxAge = maxAge;
        }
    }

    /**
     * XML tokenizer limits. Unbounded by default so that any well-formed
     * document is accepted.
     */
    public static class Xml {
        private int maxElementDepth = Integer.MAX_VALUE;
        private int maxAttributesPerElement = Integer.MAX_VALUE;
        private int maxAttributeSize = Integer.MAX_VALUE;

        public int getMaxElementDepth() {
            return maxElementDepth;
        }

        public void setMaxElementDepth(int maxElementDepth) {
            this.maxElementDepth = maxElementDepth;
        }

        public int getMaxAttributesPerElement() {
            return maxAttributesPerElement;
        }

        public void setMaxAttributesPerElement(int maxAttributesPerElement) {
            this.maxAttributesPerElement = maxAttributesPerElement;
        }

        public int getMaxAttributeSize() {
            return maxAttributeSize;
        }

        public void setMaxAttributeSize(int maxAttributeSize) {
            this.maxAttributeSize = maxAttributeSize;
        }
    }
}
