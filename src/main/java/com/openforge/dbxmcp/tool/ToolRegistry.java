package com.openforge.dbxmcp.tool;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Name → {@link ToolDescriptor} table.
 *
 * Lifecycle: populated once at startup (see ToolCatalogConfig), then {@link #freeze()}
 * publishes an unmodifiable snapshot through a volatile write. After that the registry is
 * read-only and lookups from concurrent dispatches need no locking.
 */
@Slf4j
public class ToolRegistry {

    /** MCP clients accept at most 64 chars of [A-Za-z0-9_-]. */
    private static final Pattern TOOL_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private volatile Map<String, ToolDescriptor> descriptors = new LinkedHashMap<>();
    private volatile boolean frozen;

    // ── Startup ──────────────────────────────────────────────────────────────

    public synchronized void register(ToolDescriptor descriptor) {
        if (frozen) {
            throw new IllegalStateException("Tool registry is frozen; cannot register " + descriptor.name());
        }
        if (!TOOL_NAME.matcher(descriptor.name()).matches()) {
            throw new IllegalArgumentException("Invalid tool name: '" + descriptor.name() + "'");
        }
        if (descriptors.containsKey(descriptor.name())) {
            throw new DuplicateToolException(descriptor.name());
        }
        descriptors.put(descriptor.name(), descriptor);
        log.debug("[ToolRegistry] Registered {}", descriptor.name());
    }

    /** Ends the startup phase. Idempotent. */
    public synchronized void freeze() {
        if (frozen) return;
        descriptors = Collections.unmodifiableMap(new LinkedHashMap<>(descriptors));
        frozen = true;
        log.info("[ToolRegistry] Frozen with {} tools", descriptors.size());
    }

    // ── Lookup ───────────────────────────────────────────────────────────────

    public ToolDescriptor lookup(String name) {
        ToolDescriptor descriptor = name == null ? null : descriptors.get(name);
        if (descriptor == null) {
            throw new UnknownToolException(name);
        }
        return descriptor;
    }

    public boolean contains(String name) {
        return name != null && descriptors.containsKey(name);
    }

    /**
     * Lazy, restartable view in registration order: every {@code iterator()} call starts
     * again from the first tool, so two passes over the result see the same sequence.
     */
    public Iterable<ToolDescriptor> listAll() {
        return () -> descriptors.values().iterator();
    }

    public Stream<ToolDescriptor> stream() {
        return descriptors.values().stream();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(descriptors.keySet());
    }

    public int size() {
        return descriptors.size();
    }

    public boolean isFrozen() {
        return frozen;
    }
}
