package com.trading.calcgraph.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Addresses one cached slot of the graph: a node name plus an argument tuple.
 *
 * Two identities are equal iff their names and argument lists are equal, so
 * arguments must have value semantics (boxed primitives, strings, enums,
 * records). Arrays compare by reference and must not be used as arguments.
 * {@code null} arguments are permitted.
 */
public record NodeId(String name, List<Object> args) {

    public NodeId {
        Objects.requireNonNull(name, "name");
        args = args == null || args.isEmpty()
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static NodeId of(String name, Object... args) {
        return new NodeId(name, args == null ? null : Arrays.asList(args));
    }

    public boolean hasArgs() {
        return !args.isEmpty();
    }

    @Override
    public String toString() {
        if (args.isEmpty())
            return name;
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(args.get(i));
        }
        return sb.append(')').toString();
    }
}
