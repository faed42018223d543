package com.monolith.maven;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.monolith.maven.site.SiteConfig;
import com.monolith.maven.site.SiteConfigLoader;
import com.monolith.maven.template.MonolithTemplateEngine;
import com.monolith.maven.template.TemplateEngine;
import com.monolith.maven.template.TemplateLoader;

/**
 * Renders a site page from a YAML content file.
 * <p>
 * The content file is read from {@code contentDir/configName}. Its {@code template_path}
 * and {@code template} keys select the template, {@code outpath} and {@code render}
 * select the output file, and the whole document is the render context.
 */
@Mojo(name = "render", defaultPhase = LifecyclePhase.GENERATE_RESOURCES)
public class RenderMojo extends AbstractMojo {

    @Parameter(defaultValue = "${project.basedir}", readonly = true)
    private File baseDir;

    @Parameter(property = "monolith.contentDir", defaultValue = "${project.basedir}/content")
    private File contentDir;

    @Parameter(property = "monolith.config", defaultValue = "content.yaml")
    private String configName;

    @Parameter(property = "monolith.skip", defaultValue = "false")
    private boolean skip;

    @Override
    public void execute() throws MojoExecutionException {
        if (skip) {
            getLog().info("Monolith: Skipping site generation.");
            return;
        }

        Path base = baseDir != null ? baseDir.toPath() : Path.of("");
        Path contentPath = (contentDir != null ? contentDir.toPath() : base.resolve("content"))
                .resolve(configName != null ? configName : "content.yaml");

        SiteConfig config;
        try {
            config = SiteConfigLoader.load(contentPath);
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to load content file " + contentPath, e);
        }

        Path outputDir = base.resolve(config.getOutpath());
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new MojoExecutionException("Could not create directory " + outputDir, e);
        }

        Path templateDir = base.resolve(config.getTemplatePath());
        TemplateEngine engine = new MonolithTemplateEngine(new TemplateLoader(templateDir, getLog()));

        String rendered;
        try {
            rendered = engine.render(config.getTemplate(), config.getContext());
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to render template " + config.getTemplate(), e);
        }

        Path outputFile = outputDir.resolve(config.getRender());
        try {
            Files.writeString(outputFile, rendered);
        } catch (IOException e) {
            throw new MojoExecutionException("Could not write to file " + outputFile, e);
        }

        getLog().info("Monolith: Site generated successfully. File saved at: " + outputFile);
    }
}
