package com.monolith.maven.template.ast;

import java.util.Map;

/**
 * Literal text, including directive tags that did not pair up.
 */
public class TextNode implements Node {
    private final String text;

    public TextNode(String text) {
        this.text = text == null ? "" : text;
    }

    public String getText() {
        return text;
    }

    @Override
    public void render(StringBuilder out, Map<String, Object> root, Map<String, Object> scope) {
        out.append(text);
    }
}
