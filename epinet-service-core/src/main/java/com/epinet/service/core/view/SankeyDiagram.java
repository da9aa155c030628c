package com.epinet.service.core.view;

import java.util.List;

/** Chart-ready flattening of a funnel's nodes and transitions; link ends index into {@code nodes}. */
public record SankeyDiagram(String id, String title, List<Node> nodes, List<Link> links) {

    public static final String DEFAULT_TITLE = "User Journey Flow";

    public SankeyDiagram {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        links = links == null ? List.of() : List.copyOf(links);
    }

    public record Node(String id, String name) {}

    public record Link(int source, int target, int value) {}
}
