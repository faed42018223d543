package com.monolith.maven.site;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.monolith.maven.template.ast.TemplateParser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.error.YAMLException;

class SiteConfigLoaderTest {

    private Path testBaseDir;

    @BeforeEach
    void setUp() throws Exception {
        testBaseDir = Path.of("target/test-output", getClass().getSimpleName(),
            String.valueOf(System.nanoTime()));
        Files.createDirectories(testBaseDir);
    }

    @Test
    void testLoad_ReadsGeneratorKeysAndKeepsWholeDocumentAsContext() throws Exception {
        Path config = testBaseDir.resolve("content.yaml");
        Files.writeString(config, """
            outpath: public
            render: index.html
            template_path: site/templates
            template: page.html
            name: Ada
            projects:
              - title: Engine
              - title: Notes
            """);

        SiteConfig siteConfig = SiteConfigLoader.load(config);

        assertThat(siteConfig.getOutpath()).isEqualTo("public");
        assertThat(siteConfig.getRender()).isEqualTo("index.html");
        assertThat(siteConfig.getTemplatePath()).isEqualTo("site/templates");
        assertThat(siteConfig.getTemplate()).isEqualTo("page.html");
        assertThat(siteConfig.getContext()).containsEntry("name", "Ada");
        assertThat(siteConfig.getContext()).containsKey("outpath");
        assertThat((List<?>) siteConfig.getContext().get("projects")).hasSize(2);
    }

    @Test
    void testLoad_AppliesDefaults() throws Exception {
        Path config = testBaseDir.resolve("minimal.yaml");
        Files.writeString(config, "name: Ada\n");

        SiteConfig siteConfig = SiteConfigLoader.load(config);

        assertThat(siteConfig.getOutpath()).isEqualTo("output");
        assertThat(siteConfig.getRender()).isEqualTo("render.html");
        assertThat(siteConfig.getTemplatePath()).isEqualTo("templates");
        assertThat(siteConfig.getTemplate()).isEqualTo("base.html");
    }

    @Test
    void testLoad_MissingFile() {
        IOException e = assertThrows(IOException.class,
            () -> SiteConfigLoader.load(testBaseDir.resolve("absent.yaml")));
        assertThat(e.getMessage()).contains("absent.yaml");
    }

    @Test
    void testLoad_InvalidYaml() throws Exception {
        Path config = testBaseDir.resolve("broken.yaml");
        Files.writeString(config, "name: [unclosed\n");

        IOException e = assertThrows(IOException.class, () -> SiteConfigLoader.load(config));
        assertThat(e.getMessage()).contains("Failed to parse YAML file");
        assertThat(e.getCause()).isInstanceOf(YAMLException.class);
    }

    @Test
    void testLoad_EmptyDocument() throws Exception {
        Path config = testBaseDir.resolve("empty.yaml");
        Files.writeString(config, "# nothing here\n");

        IOException e = assertThrows(IOException.class, () -> SiteConfigLoader.load(config));
        assertThat(e.getMessage()).contains("empty");
    }

    @Test
    void testLoad_RootMustBeMapping() throws Exception {
        Path config = testBaseDir.resolve("list.yaml");
        Files.writeString(config, "- a\n- b\n");

        IOException e = assertThrows(IOException.class, () -> SiteConfigLoader.load(config));
        assertThat(e.getMessage()).contains("mapping");
    }

    @Test
    void testLoad_RejectsArbitraryTypes() throws Exception {
        Path config = testBaseDir.resolve("tagged.yaml");
        Files.writeString(config, "value: !!java.io.File [\"/tmp\"]\n");

        assertThrows(IOException.class, () -> SiteConfigLoader.load(config));
    }

    @Test
    void testLoadFromResource() throws Exception {
        SiteConfig siteConfig = SiteConfigLoader.loadFromResource("/content/sample.yaml");

        assertThat(siteConfig.getTemplate()).isEqualTo("resume.html");
        assertThat(siteConfig.getContext()).containsEntry("name", "Grace Hopper");
    }

    @Test
    void testLoadFromResource_Missing() {
        assertThrows(IOException.class, () -> SiteConfigLoader.loadFromResource("/content/missing.yaml"));
    }

    @Test
    void testLoad_TimestampsStayAsWritten() throws Exception {
        Path config = testBaseDir.resolve("dated.yaml");
        Files.writeString(config, """
            date: 2024-01-15
            updated: 2024-01-15 10:30:00
            """);

        SiteConfig siteConfig = SiteConfigLoader.load(config);

        assertThat(siteConfig.getContext()).containsEntry("date", "2024-01-15");
        assertThat(siteConfig.getContext()).containsEntry("updated", "2024-01-15 10:30:00");
    }

    @Test
    void testLoad_ScalarTypesRenderAsText() throws Exception {
        Path config = testBaseDir.resolve("scalars.yaml");
        Files.writeString(config, """
            date: 2024-01-15
            count: 3
            ratio: 2.5
            published: true
            """);

        SiteConfig siteConfig = SiteConfigLoader.load(config);
        String rendered = TemplateParser.parse("{{ date }}|{{ count }}|{{ ratio }}|{{ published }}")
            .render(siteConfig.getContext());

        assertThat(rendered).isEqualTo("2024-01-15|3|2.5|true");
    }
}
