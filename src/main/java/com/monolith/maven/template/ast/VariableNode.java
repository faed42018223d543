package com.monolith.maven.template.ast;

import java.util.Map;

import com.monolith.maven.template.eval.ValueResolver;

/**
 * A {@code {{ path | default:'fallback' }}} directive.
 */
public class VariableNode implements Node {
    private final String expression;

    public VariableNode(String expression) {
        this.expression = expression.trim();
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public void render(StringBuilder out, Map<String, Object> root, Map<String, Object> scope) {
        out.append(ValueResolver.resolve(expression, scope).asText());
    }
}
