package com.monolith.maven.site;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Site generation settings read from a content file.
 * <p>
 * The content file doubles as the render context: the whole document is passed to
 * the template, and the keys below also tell the generator where to read and write.
 */
public class SiteConfig {
    public static final String OUTPATH_KEY = "outpath";
    public static final String RENDER_KEY = "render";
    public static final String TEMPLATE_PATH_KEY = "template_path";
    public static final String TEMPLATE_KEY = "template";

    static final String DEFAULT_OUTPATH = "output";
    static final String DEFAULT_RENDER = "render.html";
    static final String DEFAULT_TEMPLATE_PATH = "templates";
    static final String DEFAULT_TEMPLATE = "base.html";

    private String outpath;
    private String render;
    private String templatePath;
    private String template;
    private Map<String, Object> context;

    public SiteConfig() {
        this.outpath = DEFAULT_OUTPATH;
        this.render = DEFAULT_RENDER;
        this.templatePath = DEFAULT_TEMPLATE_PATH;
        this.template = DEFAULT_TEMPLATE;
        this.context = new LinkedHashMap<>();
    }

    public String getOutpath() {
        return outpath;
    }

    public void setOutpath(String outpath) {
        this.outpath = outpath;
    }

    public String getRender() {
        return render;
    }

    public void setRender(String render) {
        this.render = render;
    }

    public String getTemplatePath() {
        return templatePath;
    }

    public void setTemplatePath(String templatePath) {
        this.templatePath = templatePath;
    }

    public String getTemplate() {
        return template;
    }

    public void setTemplate(String template) {
        this.template = template;
    }

    /**
     * The full content document, used as the render context.
     */
    public Map<String, Object> getContext() {
        return context;
    }

    public void setContext(Map<String, Object> context) {
        this.context = context;
    }

    public static SiteConfig fromMap(Map<String, Object> map) {
        SiteConfig config = new SiteConfig();
        config.setOutpath(stringValue(map, OUTPATH_KEY, DEFAULT_OUTPATH));
        config.setRender(stringValue(map, RENDER_KEY, DEFAULT_RENDER));
        config.setTemplatePath(stringValue(map, TEMPLATE_PATH_KEY, DEFAULT_TEMPLATE_PATH));
        config.setTemplate(stringValue(map, TEMPLATE_KEY, DEFAULT_TEMPLATE));
        config.setContext(Collections.unmodifiableMap(map));
        return config;
    }

    private static String stringValue(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? String.valueOf(value) : defaultValue;
    }
}
