package com.monolith.maven.template;

import java.io.IOException;
import java.util.Map;

import com.monolith.maven.template.ast.TemplateParser;

/**
 * Template engine for the Monolith directive syntax.
 * <p>
 * Rendering runs include expansion on the raw text, parses the result and evaluates
 * the parsed template against the context. Conditionals and loops are expanded during
 * evaluation; variables are substituted in the scope they appear in.
 */
public class MonolithTemplateEngine implements TemplateEngine {
    private final TemplateLoader templateLoader;
    private final IncludeExpander includeExpander;

    public MonolithTemplateEngine(TemplateLoader templateLoader) {
        this.templateLoader = templateLoader;
        this.includeExpander = new IncludeExpander(templateLoader);
    }

    @Override
    public String render(String templateName, Map<String, Object> context) throws IOException {
        String templateContent = templateLoader.loadTemplate(templateName);
        return renderText(templateContent, context);
    }

    /**
     * Renders template text that has already been loaded.
     * Includes are resolved against the loader's template directory.
     */
    public String renderText(String templateContent, Map<String, Object> context) throws IOException {
        String expanded = includeExpander.expand(templateContent);
        return TemplateParser.parse(expanded).render(context == null ? Map.of() : context);
    }
}
