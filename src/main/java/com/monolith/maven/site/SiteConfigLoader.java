package com.monolith.maven.site;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads site content files (YAML).
 */
public class SiteConfigLoader {

    /**
     * Loads configuration from a YAML file.
     *
     * @throws IOException if the file is missing, is not valid YAML, is empty or is not a mapping
     */
    public static SiteConfig load(Path configPath) throws IOException {
        if (!Files.isRegularFile(configPath)) {
            throw new IOException("Content file not found: " + configPath.toAbsolutePath());
        }
        try (InputStream inputStream = Files.newInputStream(configPath)) {
            return SiteConfig.fromMap(parse(inputStream, configPath.toString()));
        }
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static SiteConfig loadFromResource(String resourcePath) throws IOException {
        try (InputStream inputStream = SiteConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return SiteConfig.fromMap(parse(inputStream, resourcePath));
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(InputStream inputStream, String source) throws IOException {
        // Yaml instances are not thread-safe
        Yaml yaml = new Yaml(new SiteYamlSafeConstructor(new LoaderOptions()));
        Object data;
        try {
            data = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new IOException("Failed to parse YAML file '" + source + "': " + e.getMessage(), e);
        }
        if (data == null) {
            throw new IOException("Content file is empty: " + source);
        }
        if (!(data instanceof Map)) {
            throw new IOException("Content file must contain a mapping at the top level: " + source);
        }
        Map<?, ?> map = (Map<?, ?>) data;
        if (map.isEmpty()) {
            throw new IOException("Content file is empty: " + source);
        }
        return (Map<String, Object>) map;
    }
}
