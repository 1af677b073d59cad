package com.eainde.atlas.tools;

import com.eainde.atlas.error.DuplicateCapabilityException;
import com.eainde.atlas.error.UnknownCapabilityException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog of the capabilities offered to the reasoning step, keyed by name in
 * registration order.
 * <p>
 * The registry is filled at startup and then {@link #freeze() frozen}; from that point it is
 * read-only and safe to share between concurrent runs. A repeated name is rejected rather
 * than overwritten.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolCapability> capabilities = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, ToolCallable> callables = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    public ToolRegistry() {
    }

    public ToolRegistry(Collection<? extends ToolCapability> initial) {
        initial.forEach(this::register);
    }

    public void register(ToolCapability capability) {
        if (frozen) {
            throw new IllegalStateException("Registry is frozen; cannot register " + capability.name());
        }
        synchronized (capabilities) {
            if (capabilities.containsKey(capability.name())) {
                throw new DuplicateCapabilityException(capability.name());
            }
            capabilities.put(capability.name(), capability);
        }
        log.info("Registered tool capability: {}", capability.name());
    }

    public ToolCapability get(String name) {
        ToolCapability capability = capabilities.get(name);
        if (capability == null) {
            throw new UnknownCapabilityException(name);
        }
        return capability;
    }

    public boolean contains(String name) {
        return capabilities.containsKey(name);
    }

    public int size() {
        return capabilities.size();
    }

    /**
     * Lazily maps the registered capabilities to manifest entries. Every call to
     * {@code iterator()} starts over from the first registered capability.
     */
    public Iterable<ToolManifestEntry> manifest() {
        return () -> snapshot().stream().map(ToolManifestEntry::of).iterator();
    }

    /**
     * @return name to callable, in registration order
     */
    public Map<String, ToolCallable> createCallables() {
        Map<String, ToolCallable> bound = new LinkedHashMap<>();
        for (ToolCapability capability : snapshot()) {
            bound.put(capability.name(), callables.computeIfAbsent(capability.name(), n -> bind(capability)));
        }
        return Collections.unmodifiableMap(bound);
    }

    /**
     * Ends the registration phase.
     */
    public void freeze() {
        frozen = true;
        log.info("Tool registry frozen with {} capabilities: {}", capabilities.size(), capabilities.keySet());
    }

    public boolean isFrozen() {
        return frozen;
    }

    private List<ToolCapability> snapshot() {
        synchronized (capabilities) {
            return List.copyOf(capabilities.values());
        }
    }

    private static ToolCallable bind(ToolCapability capability) {
        return rawArguments -> capability.execute(capability.schema().validate(capability.name(), rawArguments));
    }
}
