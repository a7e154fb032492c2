package com.trading.calcgraph.engine;

import com.trading.calcgraph.api.DuplicateNodeException;
import com.trading.calcgraph.api.Node;
import com.trading.calcgraph.api.UnknownNodeException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Owns the mapping from node name to its {@link Node} definition.
 *
 * One definition per name for the lifetime of the graph: there is no
 * unregistration and no redefinition. Registration order is preserved for
 * diagnostics.
 */
@Log4j2
public final class NodeRegistry {
    private final Map<String, Node<?>> nodesByName = new LinkedHashMap<>();

    /**
     * Adds a node.
     *
     * @throws DuplicateNodeException if a node with the same name is registered.
     */
    public void register(Node<?> node) {
        Objects.requireNonNull(node, "node");
        String name = Objects.requireNonNull(node.name(), "node name");
        if (nodesByName.containsKey(name))
            throw new DuplicateNodeException(name);
        nodesByName.put(name, node);
        log.debug("Registered {} as {}", name, node.getClass().getSimpleName());
    }

    /**
     * Resolves a name to its node.
     *
     * @throws UnknownNodeException if nothing is registered under {@code name}.
     */
    public Node<?> lookup(String name) {
        Node<?> node = nodesByName.get(name);
        if (node == null)
            throw new UnknownNodeException(name);
        return node;
    }

    public boolean contains(String name) {
        return nodesByName.containsKey(name);
    }

    public int size() {
        return nodesByName.size();
    }

    /** Registered names in registration order (read-only view). */
    public Set<String> names() {
        return Collections.unmodifiableSet(nodesByName.keySet());
    }
}
