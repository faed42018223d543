package com.monolith.maven.site;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.Tag;

/**
 * Safe constructor for content files. Timestamps stay as written ({@code 2024-01-15})
 * instead of becoming {@link java.util.Date} values.
 */
class SiteYamlSafeConstructor extends SafeConstructor {

    SiteYamlSafeConstructor(LoaderOptions loaderOptions) {
        super(loaderOptions);
        this.yamlConstructors.put(Tag.TIMESTAMP, new ConstructYamlStr());
    }
}
