package com.monolith.maven.template;

import java.io.IOException;
import java.util.Map;

/**
 * Interface for template rendering engines.
 */
public interface TemplateEngine {
    /**
     * Renders a template with the given context.
     *
     * @param templateName the name of the template, relative to the template directory
     * @param context the context data for rendering
     * @return the rendered content
     * @throws IOException if the template cannot be loaded
     */
    String render(String templateName, Map<String, Object> context) throws IOException;
}
