package com.multiquery.service;

import com.multiquery.connector.BackendConnector;
import com.multiquery.model.BackendId;
import com.multiquery.model.SelectionMask;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The fixed set of connectors known to this process, in registration order.
 */
@Slf4j
public class BackendRegistry implements AutoCloseable {

    private final Map<BackendId, BackendConnector> connectors;

    public BackendRegistry(Collection<? extends BackendConnector> connectors) {
        Map<BackendId, BackendConnector> byId = new LinkedHashMap<>();
        for (BackendConnector connector : connectors) {
            BackendConnector existing = byId.putIfAbsent(connector.getBackendId(), connector);
            if (existing != null) {
                throw new IllegalArgumentException("Duplicate backend id: " + connector.getBackendId());
            }
        }
        this.connectors = Collections.unmodifiableMap(byId);
    }

    public List<BackendId> getBackendIds() {
        return List.copyOf(connectors.keySet());
    }

    public Collection<BackendConnector> getConnectors() {
        return connectors.values();
    }

    public Optional<BackendConnector> find(BackendId backendId) {
        return Optional.ofNullable(connectors.get(backendId));
    }

    /**
     * Resolve a mask to the connectors it selects.
     *
     * @param selection selection mask
     * @return selected connectors in registration order, never empty
     * @throws InvalidSelectionException when the mask names an unknown backend or selects nothing
     */
    public List<BackendConnector> resolve(SelectionMask selection) {
        if (selection == null) {
            throw new InvalidSelectionException("Backend selection is required");
        }

        List<String> unknown = selection.getBackends().stream()
                .filter(id -> !connectors.containsKey(id))
                .map(BackendId::getValue)
                .sorted()
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new InvalidSelectionException("Unknown backend(s): " + String.join(", ", unknown)
                    + ". Registered: " + describe(connectors.keySet()));
        }

        List<BackendConnector> selected = new ArrayList<>();
        for (Map.Entry<BackendId, BackendConnector> entry : connectors.entrySet()) {
            if (selection.matches(entry.getKey())) {
                selected.add(entry.getValue());
            }
        }
        if (selected.isEmpty()) {
            throw new InvalidSelectionException("Selection " + selection + " selects no backend. Registered: "
                    + describe(connectors.keySet()));
        }
        return selected;
    }

    private static String describe(Collection<BackendId> ids) {
        return ids.stream().map(BackendId::getValue).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public void close() {
        for (BackendConnector connector : connectors.values()) {
            if (connector instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    log.warn("Failed to close backend {}", connector.getBackendId(), e);
                }
            }
        }
    }
}
