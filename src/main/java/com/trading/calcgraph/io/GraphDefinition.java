package com.trading.calcgraph.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a graph's input data and scenario.
 *
 * Only data nodes (constants and variables) are declarative; calculated nodes
 * are code and are registered programmatically on top of a loaded graph.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private GraphInfo graph;

    /** Meta-information about the graph. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphInfo {
        private String name, version;
        private List<NodeDef> nodes;
        private List<OverrideDef> overrides;
    }

    /** Definition of a single data node. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, type, description;
        private Object value;
    }

    /** An override applied once the nodes are registered. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class OverrideDef {
        private String name;
        private List<Object> args;
        private Object value;
    }
}
