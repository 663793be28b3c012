package com.whereq.tessera.engine;

import com.whereq.tessera.exception.UnknownEngineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Adapters by canonical engine id and alias, built once at startup
 */
@Slf4j
@Component
public class EngineRegistry {

    private final Map<String, EngineAdapter> byId = new LinkedHashMap<>();
    private final Map<String, EngineAdapter> byName = new LinkedHashMap<>();

    @Autowired
    public EngineRegistry(ObjectProvider<EngineAdapter> adapters) {
        this(adapters.orderedStream().toList());
    }

    public EngineRegistry(List<EngineAdapter> adapters) {
        for (EngineAdapter adapter : adapters) {
            String engineId = adapter.descriptor().getEngineId();
            register(engineId, adapter);
            adapter.descriptor().getAliases().forEach(alias -> register(alias, adapter));
            byId.put(engineId, adapter);
            log.info("Registered engine {} (aliases {}, maxConcurrency {})",
                engineId, adapter.descriptor().getAliases(), adapter.descriptor().getMaxConcurrency());
        }
    }

    /**
     * Resolve an adapter by canonical id or alias
     *
     * @throws UnknownEngineException if nothing answers to the id
     */
    public EngineAdapter resolve(String engineId) {
        return find(engineId).orElseThrow(() -> new UnknownEngineException(engineId));
    }

    public Optional<EngineAdapter> find(String engineId) {
        if (engineId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(engineId.toLowerCase(Locale.ROOT)));
    }

    public Collection<EngineAdapter> all() {
        return Collections.unmodifiableCollection(byId.values());
    }

    private void register(String name, EngineAdapter adapter) {
        EngineAdapter previous = byName.putIfAbsent(name.toLowerCase(Locale.ROOT), adapter);
        if (previous != null && previous != adapter) {
            throw new IllegalStateException("Engine id '" + name + "' is claimed by both "
                + previous.descriptor().getEngineId() + " and " + adapter.descriptor().getEngineId());
        }
    }
}
