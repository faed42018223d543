package com.monolith.maven.template;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.apache.maven.plugin.logging.Log;

/**
 * Reads templates and partials from a template directory.
 * A missing template is an error, a missing partial is not.
 */
public class TemplateLoader {
    private final Path templateDir;
    private final Log log;

    public TemplateLoader(Path templateDir, Log log) {
        this.templateDir = templateDir;
        this.log = log;
    }

    public Path getTemplateDir() {
        return templateDir;
    }

    /**
     * Loads a template.
     *
     * @param templateName path of the template relative to the template directory (e.g., "base.html")
     * @return template content
     * @throws IOException if the template cannot be found or read
     */
    public String loadTemplate(String templateName) throws IOException {
        Path template = templateDir.resolve(templateName);
        if (!Files.isRegularFile(template)) {
            throw new IOException("Template not found: " + templateName
                    + " (checked: " + templateDir.toAbsolutePath() + ")");
        }
        log.debug("Using template: " + template);
        return Files.readString(template);
    }

    /**
     * Loads a partial referenced by an include directive.
     *
     * @param partialName path of the partial relative to the template directory
     * @return partial content, or empty if there is no such file
     * @throws IOException if the partial exists but cannot be read
     */
    public Optional<String> loadPartial(String partialName) throws IOException {
        Path partial = templateDir.resolve(partialName);
        if (!Files.isRegularFile(partial)) {
            log.debug("Partial not found, leaving include in place: " + partial);
            return Optional.empty();
        }
        log.debug("Using partial: " + partial);
        return Optional.of(Files.readString(partial));
    }
}
