package com.github.rudygunawan.rendercache.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.rudygunawan.rendercache.exception.InvalidKeyParamsException;
import com.github.rudygunawan.rendercache.model.CacheKeyParams;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Derives cache keys from render inputs.
 *
 * <p>The five inputs are written as one JSON array in a fixed order, with map entries sorted by
 * key at every nesting level, and the result is hashed with SHA-256. Absent inputs are written as
 * JSON {@code null}, so an absent file path and an empty one give different keys. The key is the
 * lowercase hex digest (64 characters) and is stable across processes.
 *
 * <p>This class is stateless and thread-safe.
 */
public final class Fingerprinter {

    // Bump when the layout of the key material changes.
    private static final int FORMAT_VERSION = 1;

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .build();

    private static final HashFunction DIGEST = Hashing.sha256();

    private Fingerprinter() {
        // Utility
    }

    /**
     * Returns the cache key for {@code params}.
     *
     * @throws InvalidKeyParamsException if the source is null or an option or metadata value
     *     cannot be serialized
     */
    public static String fingerprint(CacheKeyParams params) {
        if (params == null) {
            throw new InvalidKeyParamsException("key params cannot be null");
        }
        return fingerprint(params.getSource(), params.getFilePath(), params.getOptions(),
                params.getTheme(), params.getMetadata());
    }

    /**
     * Returns the cache key for the given render inputs. Every argument except {@code source} may
     * be null.
     *
     * @throws InvalidKeyParamsException if the source is null or an option or metadata value
     *     cannot be serialized
     */
    public static String fingerprint(String source, String filePath, Map<String, ?> options,
                                     String theme, Map<String, ?> metadata) {
        if (source == null) {
            throw new InvalidKeyParamsException("source cannot be null");
        }
        Object[] material = {FORMAT_VERSION, source, filePath, options, theme, metadata};
        String canonical;
        try {
            canonical = MAPPER.writeValueAsString(material);
        } catch (JsonProcessingException | ClassCastException e) {
            // ClassCastException: map keys that cannot be ordered against each other
            throw new InvalidKeyParamsException("Render options or metadata cannot be serialized for filePath="
                    + filePath + ": " + e.getMessage(), e);
        }
        return DIGEST.hashString(canonical, StandardCharsets.UTF_8).toString();
    }
}
