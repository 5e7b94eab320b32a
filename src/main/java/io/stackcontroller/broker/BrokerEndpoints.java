package io.stackcontroller.broker;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The broker endpoints of every tier, keyed by endpoint id. Registering one endpoint instance
 * under two ids is rejected: each tier must own its own client.
 */
@Slf4j
public class BrokerEndpoints implements AutoCloseable {

    private final Map<String, BrokerEndpoint> endpoints = new LinkedHashMap<>();
    private final Set<BrokerEndpoint> instances = Collections.newSetFromMap(new IdentityHashMap<>());

    public synchronized void register(BrokerEndpoint endpoint) {
        if (endpoints.containsKey(endpoint.getId())) {
            throw new IllegalArgumentException("Broker endpoint " + endpoint.getId() + " is already registered");
        }
        if (!instances.add(endpoint)) {
            throw new IllegalArgumentException("Broker endpoint instance is already registered under another id");
        }
        endpoints.put(endpoint.getId(), endpoint);
        log.info("Registered broker endpoint {}", endpoint.getId());
    }

    public synchronized Optional<BrokerEndpoint> get(String id) {
        return Optional.ofNullable(endpoints.get(id));
    }

    public synchronized BrokerEndpoint require(String id) {
        BrokerEndpoint endpoint = endpoints.get(id);
        if (endpoint == null) {
            throw new IllegalArgumentException("Unknown broker endpoint: " + id);
        }
        return endpoint;
    }

    public synchronized Collection<BrokerEndpoint> all() {
        return Collections.unmodifiableCollection(new ArrayList<>(endpoints.values()));
    }

    @Override
    public synchronized void close() {
        for (BrokerEndpoint endpoint : endpoints.values()) {
            try {
                endpoint.close();
            } catch (RuntimeException e) {
                log.error("Error closing broker endpoint {}", endpoint.getId(), e);
            }
        }
        endpoints.clear();
        instances.clear();
    }
}
