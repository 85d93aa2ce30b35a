package com.tradingagents.orchestrator.memory;

import com.tradingagents.common.memory.EmbeddingModel;
import com.tradingagents.common.memory.MemoryScope;
import com.tradingagents.common.memory.MemoryStore;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * One {@link MemoryStore} per decision scope, sharing a single embedding model.
 */
@Component
public class MemoryBank {

    private final Map<MemoryScope, MemoryStore> stores;

    public MemoryBank(EmbeddingModel embeddingModel) {
        Map<MemoryScope, MemoryStore> byScope = new EnumMap<>(MemoryScope.class);
        for (MemoryScope scope : MemoryScope.values()) {
            byScope.put(scope, new MemoryStore(scope.name().toLowerCase(Locale.ROOT), embeddingModel));
        }
        this.stores = Collections.unmodifiableMap(byScope);
    }

    public MemoryStore store(MemoryScope scope) {
        return stores.get(scope);
    }
}
