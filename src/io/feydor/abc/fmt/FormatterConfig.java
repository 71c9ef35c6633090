package io.feydor.abc.fmt;

import io.feydor.util.FileIo;

import java.io.File;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Formatter settings. Defaults come from the {@code coolabc-defaults.json} resource; a JSON file with any
 * subset of the same keys can override them.
 *
 * @param alignVoices Pad multi-voice systems so simultaneous notes line up
 * @param formatTunesWithErrors Reformat tunes even when parts of their body failed to parse
 * @param strictAlignment Throw when alignment loses track of a node instead of leaving the bar as is
 */
public record FormatterConfig(boolean alignVoices, boolean formatTunesWithErrors, boolean strictAlignment) {
    private static final Logger LOGGER = Logger.getLogger(FormatterConfig.class.getName());
    private static final String DEFAULTS_JSON = "coolabc-defaults.json";
    private static final Set<String> KEYS = Set.of("alignVoices", "formatTunesWithErrors", "strictAlignment");

    public static FormatterConfig defaults() {
        return fromMap(FileIo.getJsonStringMapFromResources(DEFAULTS_JSON));
    }

    /** The defaults overridden by the keys present in {@code overrideFile}. */
    public static FormatterConfig load(File overrideFile) {
        var merged = new HashMap<>(FileIo.getJsonStringMapFromResources(DEFAULTS_JSON));
        if (overrideFile.exists()) {
            var overrides = FileIo.getJsonStringMap(overrideFile);
            LOGGER.log(Level.INFO, "Loaded formatter config overrides: {0}", overrides);
            merged.putAll(overrides);
        } else {
            LOGGER.log(Level.WARNING, "Config file not found: {0}", overrideFile.getAbsolutePath());
        }
        return fromMap(merged);
    }

    static FormatterConfig fromMap(Map<String, Object> json) {
        for (var key : json.keySet()) {
            if (!KEYS.contains(key)) {
                LOGGER.log(Level.WARNING, "Ignoring unknown formatter config key: {0}", key);
            }
        }
        return new FormatterConfig(
                flag(json, "alignVoices", true),
                flag(json, "formatTunesWithErrors", false),
                flag(json, "strictAlignment", false));
    }

    private static boolean flag(Map<String, Object> json, String key, boolean fallback) {
        Object value = json.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value != null) {
            LOGGER.log(Level.WARNING, "Formatter config key {0} should be true or false, got: {1}", new Object[]{key, value});
        }
        return fallback;
    }
}
