package com.whereq.tessera.config;

import com.whereq.tessera.engine.DistributedEngineAdapter;
import com.whereq.tessera.engine.EmbeddedEngineAdapter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Engine adapter beans. Each adapter is closed with the context, which
 * closes its connection pool.
 *
 * @author WhereQ Inc.
 */
@Configuration
public class EngineConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "tessera.engines.embedded", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EmbeddedEngineAdapter embeddedEngineAdapter(TesseraProperties properties) {
        return new EmbeddedEngineAdapter(properties.getEngines().getEmbedded());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "tessera.engines.distributed", name = "enabled", havingValue = "true")
    public DistributedEngineAdapter distributedEngineAdapter(TesseraProperties properties) {
        return new DistributedEngineAdapter(properties.getEngines().getDistributed());
    }
}
