package com.doctrace.core.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A node of the traceability graph.
 *
 * <p>Edges are written only while the graph is built; afterwards {@link #uplinks()} and
 * {@link #downlinks()} are read-only views. {@link #metadata()} stays writable.
 */
public final class GraphNode {

    private final String id;
    private final Set<String> uplinks = new LinkedHashSet<>();
    private final Set<String> downlinks = new LinkedHashSet<>();
    private final NodeMetadata metadata = new NodeMetadata();

    GraphNode(String id) {
        this.id = Objects.requireNonNull(id, "id must not be null");
    }

    public String id() {
        return id;
    }

    /**
     * Parents of this node, in the order they were linked.
     *
     * @return uplink targets
     */
    public Set<String> uplinks() {
        return Collections.unmodifiableSet(uplinks);
    }

    /**
     * Children of this node, in the order they were linked.
     *
     * @return downlink targets
     */
    public Set<String> downlinks() {
        return Collections.unmodifiableSet(downlinks);
    }

    public NodeMetadata metadata() {
        return metadata;
    }

    public boolean hasUplinkWithPrefix(String prefix) {
        return uplinks.stream().anyMatch(uplink -> uplink.startsWith(prefix));
    }

    public boolean hasDownlinkWithPrefix(String prefix) {
        return downlinks.stream().anyMatch(downlink -> downlink.startsWith(prefix));
    }

    void addUplink(String target) {
        uplinks.add(target);
    }

    void addDownlink(String target) {
        downlinks.add(target);
    }

    @Override
    public String toString() {
        return "GraphNode{" + id + ", up=" + uplinks + ", down=" + downlinks + '}';
    }
}
