package com.monolith.maven.template.ast;

import java.util.Map;

/**
 * A parsed piece of a template.
 */
public interface Node {

    /**
     * Appends this node's output.
     *
     * @param out the buffer receiving rendered text
     * @param root the context the template is rendered with; conditions resolve against it
     * @param scope the mapping variables and loop paths resolve against, either the root
     *              or a loop iteration scope
     */
    void render(StringBuilder out, Map<String, Object> root, Map<String, Object> scope);
}
