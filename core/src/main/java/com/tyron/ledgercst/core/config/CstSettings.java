package com.tyron.ledgercst.core.config;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Formatting defaults used when synthesizing new tokens.
 * <p>
 * Loaded from {@code ledgercst.yaml} on the classpath, or from the file named by the
 * {@code ledgercst.config} system property:
 * <pre>
 * indent: "    "
 * newline: "\n"
 * </pre>
 */
public final class CstSettings {

    private static final Logger LOG = Logger.getLogger(CstSettings.class.getName());

    public static final String CONFIG_PROPERTY = "ledgercst.config";
    public static final String RESOURCE = "ledgercst.yaml";

    private static final String DEFAULT_INDENT = "    ";
    private static final String DEFAULT_NEWLINE = "\n";

    private static volatile CstSettings instance;

    private final String indent;
    private final String newline;

    private CstSettings(@NotNull String indent, @NotNull String newline) {
        if (!indent.matches("[ \\t]*")) {
            throw new IllegalArgumentException("indent must consist of spaces and tabs: '" + indent + "'");
        }
        if (!newline.matches("\\r*\\n")) {
            throw new IllegalArgumentException("newline must be a line break: '" + newline.replace("\n", "\\n") + "'");
        }
        this.indent = indent;
        this.newline = newline;
    }

    public static @NotNull CstSettings getInstance() {
        CstSettings local = instance;
        if (local == null) {
            synchronized (CstSettings.class) {
                local = instance;
                if (local == null) {
                    local = load();
                    instance = local;
                }
            }
        }
        return local;
    }

    public static @NotNull CstSettings defaults() {
        return new CstSettings(DEFAULT_INDENT, DEFAULT_NEWLINE);
    }

    /**
     * Parses settings from YAML text. Missing keys take their defaults.
     *
     * @throws IllegalArgumentException if the document is malformed or a value is invalid
     */
    public static @NotNull CstSettings fromYaml(@NotNull String yaml) {
        Object doc;
        try {
            doc = new Yaml().load(yaml);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("malformed settings: " + e.getMessage(), e);
        }
        return fromDocument(doc);
    }

    /**
     * Drops the cached instance so the next {@link #getInstance()} reloads.
     */
    public static void reset() {
        synchronized (CstSettings.class) {
            instance = null;
        }
    }

    public @NotNull String getIndent() {
        return indent;
    }

    public @NotNull String getNewline() {
        return newline;
    }

    private static CstSettings fromDocument(@Nullable Object doc) {
        if (doc == null) {
            return defaults();
        }
        if (!(doc instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("settings must be a mapping, got " + doc.getClass().getSimpleName());
        }
        Object indent = map.get("indent");
        Object newline = map.get("newline");
        return new CstSettings(
                indent != null ? String.valueOf(indent) : DEFAULT_INDENT,
                newline != null ? String.valueOf(newline) : DEFAULT_NEWLINE);
    }

    private static CstSettings load() {
        String override = System.getProperty(CONFIG_PROPERTY);
        try {
            if (override != null && !override.isBlank()) {
                CstSettings settings = fromYaml(Files.readString(Path.of(override)));
                LOG.fine("settings source=" + override);
                return settings;
            }
            try (InputStream in = CstSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
                if (in == null) {
                    LOG.fine("settings source=defaults reason=no-resource");
                    return defaults();
                }
                CstSettings settings = fromDocument(new Yaml().load(in));
                LOG.fine("settings source=classpath:" + RESOURCE);
                return settings;
            }
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.WARNING, "settings action=fallback reason=" + e.getMessage(), e);
            return defaults();
        }
    }
}
