package com.tyron.lylex.core.settings;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Tuning for tokenized documents.
 *
 * Read from YAML ({@code lylex.yaml}):
 * <pre>
 * resyncLineLimit: 2000   # lines compared for a resync after an edit, 0 = no limit
 * mode: lilypond          # initial mode; omit to guess from the text
 * </pre>
 * System properties {@code lylex.resyncLineLimit} and {@code lylex.mode} override file values.
 * Invalid values are logged and replaced by defaults.
 */
public final class DocumentSettings {

    private static final Logger LOG = Logger.getLogger(DocumentSettings.class.getName());

    public static final String RESOURCE = "/lylex.yaml";
    public static final String PROPERTY_PREFIX = "lylex.";
    public static final int DEFAULT_RESYNC_LINE_LIMIT = 2000;

    private static final DocumentSettings BUILT_IN = builder().build();

    private final int resyncLineLimit;
    private final String mode;

    private DocumentSettings(Builder builder) {
        this.resyncLineLimit = builder.resyncLineLimit;
        this.mode = builder.mode;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Built-in values, ignoring configuration files and system properties.
     */
    public static DocumentSettings builtIn() {
        return BUILT_IN;
    }

    /**
     * Reads {@value #RESOURCE} from the classpath when present, then applies system property overrides.
     */
    public static DocumentSettings defaults() {
        Builder builder = builder();
        try (InputStream in = DocumentSettings.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                builder.apply(parse(in, RESOURCE));
            }
        } catch (IOException e) {
            throw new SettingsException("Failed to read " + RESOURCE, e);
        }
        return builder.applyProperties(System.getProperties()).build();
    }

    /**
     * Reads settings from a YAML stream and applies system property overrides. The stream is not closed.
     */
    public static DocumentSettings load(@NotNull InputStream in) {
        return builder().apply(parse(in, "stream")).applyProperties(System.getProperties()).build();
    }

    public int getResyncLineLimit() {
        return resyncLineLimit;
    }

    /**
     * @return the configured mode name, or {@code null} to guess it from the text
     */
    @Nullable
    public String getMode() {
        return mode;
    }

    public Builder toBuilder() {
        return builder().resyncLineLimit(resyncLineLimit).mode(mode);
    }

    private static Map<?, ?> parse(InputStream in, String source) {
        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new SettingsException("Invalid settings in " + source, e);
        }
        if (doc == null) {
            return Map.of();
        }
        if (!(doc instanceof Map<?, ?> map)) {
            LOG.warning("settings source=" + source + " ignored reason=notAMapping");
            return Map.of();
        }
        return map;
    }

    @Override
    public String toString() {
        return "DocumentSettings{resyncLineLimit=" + resyncLineLimit + ", mode=" + mode + "}";
    }

    public static final class Builder {

        private int resyncLineLimit = DEFAULT_RESYNC_LINE_LIMIT;
        private String mode;

        private Builder() {
        }

        public Builder resyncLineLimit(int resyncLineLimit) {
            if (resyncLineLimit < 0) {
                throw new IllegalArgumentException("resyncLineLimit must not be negative, got " + resyncLineLimit);
            }
            this.resyncLineLimit = resyncLineLimit;
            return this;
        }

        public Builder mode(@Nullable String mode) {
            this.mode = mode == null || mode.isBlank() ? null : mode.trim().toLowerCase(Locale.ROOT);
            return this;
        }

        Builder apply(Map<?, ?> values) {
            Object limit = values.get("resyncLineLimit");
            if (limit != null) {
                setLimit(String.valueOf(limit), "resyncLineLimit");
            }
            Object mode = values.get("mode");
            if (mode != null) {
                mode(String.valueOf(mode));
            }
            return this;
        }

        public Builder applyProperties(@NotNull Properties properties) {
            String limit = properties.getProperty(PROPERTY_PREFIX + "resyncLineLimit");
            if (limit != null) {
                setLimit(limit, PROPERTY_PREFIX + "resyncLineLimit");
            }
            String mode = properties.getProperty(PROPERTY_PREFIX + "mode");
            if (mode != null) {
                mode(mode);
            }
            return this;
        }

        public DocumentSettings build() {
            return new DocumentSettings(this);
        }

        private void setLimit(String raw, String key) {
            try {
                int value = Integer.parseInt(raw.trim());
                if (value < 0) {
                    LOG.warning("settings key=" + key + " value=" + raw + " ignored reason=negative");
                    return;
                }
                resyncLineLimit = value;
            } catch (NumberFormatException e) {
                LOG.warning("settings key=" + key + " value=" + raw + " ignored reason=notAnInteger");
            }
        }
    }
}
