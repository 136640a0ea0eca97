package net.findmycard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import net.findmycard.service.cache.CacheCoordinator;
import net.findmycard.service.cache.CacheTier;
import net.findmycard.service.cache.EdgeCacheTier;
import net.findmycard.service.cache.EdgeKeyValueStore;
import net.findmycard.service.cache.HotCacheTier;
import net.findmycard.service.cache.HttpEdgeKeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the response cache chain: the Caffeine hot tier always, the edge tier when enabled.
 */
@Configuration
public class CacheTierConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheTierConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HotCacheTier hotCacheTier(CacheFactory cacheFactory, CacheTierProperties properties, Clock clock) {
        return new HotCacheTier(cacheFactory, properties.getHot().getMaxSize(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.cache.edge", name = "enabled", havingValue = "true")
    public EdgeKeyValueStore edgeKeyValueStore(WebClient.Builder webClientBuilder, CacheTierProperties properties) {
        return new HttpEdgeKeyValueStore(webClientBuilder, properties);
    }

    @Bean
    public CacheCoordinator cacheCoordinator(HotCacheTier hotCacheTier,
                                             ObjectProvider<EdgeKeyValueStore> edgeStore,
                                             ObjectMapper objectMapper,
                                             CacheTierProperties properties,
                                             Clock clock) {
        List<CacheTier> tiers = new ArrayList<>();
        tiers.add(hotCacheTier);
        EdgeKeyValueStore store = edgeStore.getIfAvailable();
        if (store != null) {
            tiers.add(new EdgeCacheTier(store, objectMapper, properties.getEdge().getTimeout(), clock));
        }
        CacheCoordinator coordinator = new CacheCoordinator(tiers, clock);
        log.info("Response cache tiers: {}", coordinator.tierNames());
        return coordinator;
    }
}
