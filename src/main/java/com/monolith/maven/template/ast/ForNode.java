package com.monolith.maven.template.ast;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.monolith.maven.template.eval.ValueResolver;

/**
 * A loop group: {@code {%N for var in path %} body {%N endfor %}}.
 * <p>
 * Each iteration renders the body against a new scope holding only the loop variable.
 * Variables and nested loop paths in the body see nothing from the enclosing scope;
 * conditions in the body still read the root context (see {@link IfNode}).
 */
public class ForNode implements Node {
    private final String variable;
    private final String path;
    private final List<Node> body;

    public ForNode(String variable, String path, List<Node> body) {
        this.variable = variable;
        this.path = path.trim();
        this.body = List.copyOf(body);
    }

    public String getVariable() {
        return variable;
    }

    public String getPath() {
        return path;
    }

    public List<Node> getBody() {
        return body;
    }

    @Override
    public void render(StringBuilder out, Map<String, Object> root, Map<String, Object> scope) {
        for (Object element : ValueResolver.resolve(path, scope).asIterable()) {
            Map<String, Object> iterationScope = new HashMap<>();
            iterationScope.put(variable, element);
            for (Node node : body) {
                node.render(out, root, iterationScope);
            }
        }
    }
}
