package com.tablesmith.dialects.sqlserver;

import com.github.jknack.handlebars.EscapingStrategy;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.Template;
import com.tablesmith.core.TablesmithException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Handlebars-rendered SQL kept under {@code tablesmith/sqlserver/} on the classpath.
 *
 * <p>HTML escaping is off. Values go through the {@code q} helper (bracket-quoted identifier) or the
 * {@code lit} helper ({@code N'...'} literal); a bare {@code {{value}}} is inserted verbatim and is
 * only used for values the caller formatted itself.
 */
final class SqlServerTemplates {
    private static final Logger logger = LoggerFactory.getLogger(SqlServerTemplates.class);

    private static final String ROOT = "tablesmith/sqlserver/";

    private static final Handlebars handlebars = new Handlebars()
            .with(EscapingStrategy.NOOP)
            .registerHelper("q", (Helper<Object>) (context, options) -> SqlServerDialect.quote(String.valueOf(context)))
            .registerHelper("lit", (Helper<Object>) (context, options) -> SqlServerDialect.literal(String.valueOf(context)));

    private static final Map<String, Template> cache = new ConcurrentHashMap<>();

    private SqlServerTemplates() {
    }

    static String render(String path, Map<String, Object> context) {
        Template template = cache.computeIfAbsent(path, SqlServerTemplates::loadTemplate);
        try {
            return template.apply(context).strip();
        } catch (IOException e) {
            throw new TablesmithException("Failed to render SQL template " + path, e);
        }
    }

    private static Template loadTemplate(String path) {
        String resource = ROOT + path;
        try (InputStream is = SqlServerTemplates.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new FileNotFoundException("Template not found: " + resource);
            }
            try (InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                String content = new BufferedReader(reader)
                        .lines()
                        .collect(Collectors.joining("\n"));
                return handlebars.compileInline(content);
            }
        } catch (IOException e) {
            logger.error("Failed to load template: {}", resource, e);
            throw new TablesmithException("Failed to load template: " + resource, e);
        }
    }
}
