package com.github.rudygunawan.rendercache.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The render inputs a cache key is derived from.
 *
 * <p>Only {@code source} is required. The file path doubles as the source file association used
 * for file-based invalidation.
 *
 * <pre>{@code
 * CacheKeyParams params = CacheKeyParams.builder("# Title")
 *     .filePath("/docs/readme.md")
 *     .option("math", true)
 *     .theme("github-dark")
 *     .build();
 * }</pre>
 */
public final class CacheKeyParams {
    private final String source;
    private final String filePath;
    private final Map<String, Object> options;
    private final String theme;
    private final Map<String, Object> metadata;

    private CacheKeyParams(Builder builder) {
        this.source = builder.source;
        this.filePath = builder.filePath;
        this.options = builder.options == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
        this.theme = builder.theme;
        this.metadata = builder.metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static CacheKeyParams of(String source) {
        return builder(source).build();
    }

    public static CacheKeyParams of(String source, String filePath) {
        return builder(source).filePath(filePath).build();
    }

    public static Builder builder(String source) {
        return new Builder(source);
    }

    public String getSource() {
        return source;
    }

    public String getFilePath() {
        return filePath;
    }

    /**
     * Returns the render options, or null when none were given.
     */
    public Map<String, Object> getOptions() {
        return options;
    }

    public String getTheme() {
        return theme;
    }

    /**
     * Returns the extra metadata, or null when none was given.
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheKeyParams)) {
            return false;
        }
        CacheKeyParams that = (CacheKeyParams) o;
        return Objects.equals(source, that.source)
                && Objects.equals(filePath, that.filePath)
                && Objects.equals(options, that.options)
                && Objects.equals(theme, that.theme)
                && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, filePath, options, theme, metadata);
    }

    @Override
    public String toString() {
        return "CacheKeyParams{filePath=" + filePath + ", theme=" + theme
                + ", options=" + options + ", sourceLength=" + (source == null ? -1 : source.length()) + '}';
    }

    /**
     * Builder for {@link CacheKeyParams}.
     */
    public static final class Builder {
        private final String source;
        private String filePath;
        private Map<String, Object> options;
        private String theme;
        private Map<String, Object> metadata;

        private Builder(String source) {
            this.source = source;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder options(Map<String, ?> options) {
            this.options = options == null ? null : new LinkedHashMap<>(options);
            return this;
        }

        public Builder option(String name, Object value) {
            if (options == null) {
                options = new LinkedHashMap<>();
            }
            options.put(name, value);
            return this;
        }

        public Builder theme(String theme) {
            this.theme = theme;
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            this.metadata = metadata == null ? null : new LinkedHashMap<>(metadata);
            return this;
        }

        public Builder metadata(String name, Object value) {
            if (metadata == null) {
                metadata = new LinkedHashMap<>();
            }
            metadata.put(name, value);
            return this;
        }

        public CacheKeyParams build() {
            return new CacheKeyParams(this);
        }
    }
}
