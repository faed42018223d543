package com.monolith.maven.template;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code {% include "partial.html" %}} directives with the partial's content.
 * <p>
 * Runs once on the raw template text. Every occurrence of a directive is replaced, and
 * the inserted content is not scanned again for includes. Directives naming a partial
 * that does not exist are left as they are.
 */
public class IncludeExpander {

    private static final Pattern INCLUDE = Pattern.compile("\\{%\\s*include\\s*\"(.*?)\"\\s*%\\}");

    private final TemplateLoader templateLoader;

    public IncludeExpander(TemplateLoader templateLoader) {
        this.templateLoader = templateLoader;
    }

    public String expand(String template) throws IOException {
        // directive text -> partial name, in order of first appearance
        Map<String, String> directives = new LinkedHashMap<>();
        Matcher matcher = INCLUDE.matcher(template);
        while (matcher.find()) {
            directives.putIfAbsent(matcher.group(), matcher.group(1));
        }
        if (directives.isEmpty()) {
            return template;
        }

        Map<String, String> partials = new LinkedHashMap<>();
        for (Map.Entry<String, String> directive : directives.entrySet()) {
            Optional<String> content = templateLoader.loadPartial(directive.getValue());
            content.ifPresent(c -> partials.put(directive.getKey(), c));
        }

        // Single pass so inserted content is never matched again
        StringBuilder out = new StringBuilder();
        matcher.reset();
        while (matcher.find()) {
            String replacement = partials.getOrDefault(matcher.group(), matcher.group());
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
