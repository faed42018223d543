package com.monolith.maven.template.ast;

import java.util.List;
import java.util.Map;

/**
 * A parsed template, ready to be rendered any number of times.
 */
public class Template {
    private final List<Node> nodes;

    public Template(List<Node> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public String render(Map<String, Object> context) {
        StringBuilder out = new StringBuilder();
        for (Node node : nodes) {
            node.render(out, context, context);
        }
        return out.toString();
    }
}
