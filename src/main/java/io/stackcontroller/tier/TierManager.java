package io.stackcontroller.tier;

import io.stackcontroller.enums.NodeState;
import io.stackcontroller.orchestration.NodeStateListener;
import io.stackcontroller.orchestration.NodeStateRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Starts each tier's workers and scheduler the first time every node the tier requires is
 * healthy, and stops them on shutdown.
 */
@Slf4j
public class TierManager implements NodeStateListener {

    private final NodeStateRegistry registry;
    private final Map<String, Tier> tiers = new LinkedHashMap<>();

    public TierManager(NodeStateRegistry registry, Collection<Tier> tiers) {
        this.registry = registry;
        for (Tier tier : tiers) {
            if (this.tiers.put(tier.getId(), tier) != null) {
                throw new IllegalArgumentException("Duplicate tier: " + tier.getId());
            }
        }
    }

    /**
     * Subscribe to node transitions and start any tier whose requirements already hold.
     */
    public void attach() {
        registry.addListener(this);
        startReadyTiers();
    }

    @Override
    public void onTransition(String nodeName, NodeState from, NodeState to) {
        if (to == NodeState.HEALTHY) {
            startReadyTiers();
        }
    }

    public synchronized void stopAll() {
        for (Tier tier : tiers.values()) {
            try {
                tier.stop();
            } catch (RuntimeException e) {
                log.error("[Tier: {}] Error while stopping: {}", tier.getId(), e.getMessage(), e);
            }
        }
    }

    public Optional<Tier> getTier(String tierId) {
        return Optional.ofNullable(tiers.get(tierId));
    }

    public Collection<Tier> getTiers() {
        return Collections.unmodifiableCollection(tiers.values());
    }

    private synchronized void startReadyTiers() {
        for (Tier tier : tiers.values()) {
            if (tier.isStarted() || !requirementsHealthy(tier)) {
                continue;
            }
            try {
                tier.start();
            } catch (RuntimeException e) {
                log.error("[Tier: {}] Failed to start: {}", tier.getId(), e.getMessage(), e);
            }
        }
    }

    private boolean requirementsHealthy(Tier tier) {
        for (String node : tier.getRequirements()) {
            if (!registry.isHealthy(node)) {
                return false;
            }
        }
        return true;
    }
}
