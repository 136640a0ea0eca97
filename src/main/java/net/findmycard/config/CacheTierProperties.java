package net.findmycard.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Sizing, time-to-live and endpoint settings for the response cache tiers.
 */
@Component
@ConfigurationProperties(prefix = "app.cache")
public class CacheTierProperties {

    private final Hot hot = new Hot();
    private final Edge edge = new Edge();
    private final Ttl ttl = new Ttl();

    @PostConstruct
    void validate() {
        Assert.isTrue(hot.maxSize > 0, "app.cache.hot.max-size must be positive");
        Assert.isTrue(!edge.timeout.isNegative() && !edge.timeout.isZero(), "app.cache.edge.timeout must be positive");
        Assert.isTrue(edge.purgeBatchSize > 0, "app.cache.edge.purge-batch-size must be positive");
        Assert.isTrue(!edge.enabled || edge.baseUrl != null && !edge.baseUrl.isBlank(),
            "app.cache.edge.base-url is required when the edge tier is enabled");
        Assert.isTrue(ttl.card.toSeconds() > 0 && ttl.search.toSeconds() > 0 && ttl.recommendations.toSeconds() > 0,
            "app.cache.ttl.* must be at least one second");
    }

    public Hot getHot() {
        return hot;
    }

    public Edge getEdge() {
        return edge;
    }

    public Ttl getTtl() {
        return ttl;
    }

    /**
     * In-process Caffeine tier.
     */
    public static class Hot {
        /** Maximum number of cached responses. */
        private long maxSize = 10_000;

        public long getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(long maxSize) {
            this.maxSize = maxSize;
        }
    }

    /**
     * Edge key-value tier reached over HTTP.
     */
    public static class Edge {
        private boolean enabled = false;
        /** Base URL of the key-value namespace, e.g. {@code https://api.cloudflare.com/client/v4/accounts/{id}/storage/kv/namespaces/{ns}}. */
        private String baseUrl;
        /** Tag purge endpoint; tag purge is unsupported when blank. */
        private String purgeUrl;
        private String apiToken;
        /** Upper bound for one edge round trip before it counts as a miss. */
        private Duration timeout = Duration.ofSeconds(2);
        /** Tags sent per purge request. */
        private int purgeBatchSize = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPurgeUrl() {
            return purgeUrl;
        }

        public void setPurgeUrl(String purgeUrl) {
            this.purgeUrl = purgeUrl;
        }

        public String getApiToken() {
            return apiToken;
        }

        public void setApiToken(String apiToken) {
            this.apiToken = apiToken;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getPurgeBatchSize() {
            return purgeBatchSize;
        }

        public void setPurgeBatchSize(int purgeBatchSize) {
            this.purgeBatchSize = purgeBatchSize;
        }
    }

    /**
     * Fallback lifetimes; tag purges on catalog writes are the primary invalidation.
     */
    public static class Ttl {
        private Duration card = Duration.ofHours(24);
        private Duration search = Duration.ofMinutes(15);
        private Duration recommendations = Duration.ofHours(6);

        public Duration getCard() {
            return card;
        }

        public void setCard(Duration card) {
            this.card = card;
        }

        public Duration getSearch() {
            return search;
        }

        public void setSearch(Duration search) {
            this.search = search;
        }

        public Duration getRecommendations() {
            return recommendations;
        }

        public void setRecommendations(Duration recommendations) {
            this.recommendations = recommendations;
        }
    }
}
