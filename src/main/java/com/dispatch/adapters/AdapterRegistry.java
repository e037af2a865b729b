package com.dispatch.adapters;

import com.dispatch.shared.model.SessionKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

public class AdapterRegistry {

    private final Map<SessionKind, ProcessAdapter> adapters = new EnumMap<>(SessionKind.class);

    public synchronized void register(ProcessAdapter adapter) {
        if (adapters.containsKey(adapter.kind())) {
            throw new IllegalArgumentException("Duplicate process adapter: " + adapter.kind().wireName());
        }
        adapters.put(adapter.kind(), adapter);
    }

    public synchronized ProcessAdapter get(SessionKind kind) {
        return adapters.get(kind);
    }

    public synchronized Set<SessionKind> kinds() {
        return Set.copyOf(adapters.keySet());
    }
}
