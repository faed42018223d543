package com.monolith.maven.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TemplateLoaderTest {

    private Path templateDir;
    private Log log;
    private TemplateLoader loader;

    @BeforeEach
    void setUp() throws Exception {
        templateDir = Path.of("target/test-output", getClass().getSimpleName(),
            String.valueOf(System.nanoTime()), "templates");
        Files.createDirectories(templateDir);
        log = mock(Log.class);
        loader = new TemplateLoader(templateDir, log);
    }

    @Test
    void testLoadTemplate_ReadsFileContent() throws Exception {
        Files.writeString(templateDir.resolve("base.html"), "<h1>{{ title }}</h1>");

        assertThat(loader.loadTemplate("base.html")).isEqualTo("<h1>{{ title }}</h1>");
        verify(log).debug(contains("base.html"));
    }

    @Test
    void testLoadTemplate_Subdirectory() throws Exception {
        Files.createDirectories(templateDir.resolve("pages"));
        Files.writeString(templateDir.resolve("pages/about.html"), "about");

        assertThat(loader.loadTemplate("pages/about.html")).isEqualTo("about");
    }

    @Test
    void testLoadTemplate_MissingTemplateThrowsWithContext() {
        IOException e = assertThrows(IOException.class, () -> loader.loadTemplate("missing.html"));

        assertThat(e.getMessage()).contains("Template not found: missing.html");
        assertThat(e.getMessage()).contains(templateDir.toAbsolutePath().toString());
    }

    @Test
    void testLoadTemplate_DirectoryIsNotATemplate() throws Exception {
        Files.createDirectories(templateDir.resolve("partials"));

        assertThrows(IOException.class, () -> loader.loadTemplate("partials"));
    }

    @Test
    void testLoadPartial_PresentAndMissing() throws Exception {
        Files.writeString(templateDir.resolve("nav.html"), "<nav/>");

        assertThat(loader.loadPartial("nav.html")).contains("<nav/>");
        assertThat(loader.loadPartial("footer.html")).isEmpty();
        verify(log).debug(contains("Partial not found"));
    }
}
