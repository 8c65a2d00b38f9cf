package com.mosaicmaker.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Central entry point for resolving mosaic settings from persisted preferences and system property overrides.
 */
public final class ConfigService {
    static final String LIBRARY_PROPERTY = "mosaic.library";
    static final String INPUT_PROPERTY = "mosaic.input";
    static final String SUBPIXEL_PROPERTY = "mosaic.subpixelSize";

    private static final ConfigService INSTANCE = new ConfigService(PreferencesStore.global());

    private final PreferencesStore preferences;

    ConfigService(PreferencesStore preferences) {
        this.preferences = preferences;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    public static ConfigService using(PreferencesStore preferences) {
        return new ConfigService(preferences);
    }

    public MosaicConfig load() {
        MosaicConfig.Builder b = MosaicConfig.builder()
            .intermediateWidth(preferences.getInt(MosaicConfig.KEY_INTERMEDIATE_WIDTH,
                MosaicConfig.DEFAULT_INTERMEDIATE_WIDTH))
            .intermediateHeight(preferences.getInt(MosaicConfig.KEY_INTERMEDIATE_HEIGHT,
                MosaicConfig.DEFAULT_INTERMEDIATE_HEIGHT))
            .prioritizeUnique(preferences.getBoolean(MosaicConfig.KEY_PRIORITIZE_UNIQUE,
                MosaicConfig.DEFAULT_PRIORITIZE_UNIQUE))
            .uniqueThreshold(preferences.getInt(MosaicConfig.KEY_UNIQUE_THRESHOLD,
                MosaicConfig.DEFAULT_UNIQUE_THRESHOLD))
            .subpixelSize(preferences.getInt(MosaicConfig.KEY_SUBPIXEL_SIZE,
                MosaicConfig.DEFAULT_SUBPIXEL_SIZE))
            .inputPath(preferences.getPath(MosaicConfig.KEY_INPUT_PATH).orElse(null))
            .libraryPath(preferences.getPath(MosaicConfig.KEY_LIBRARY_PATH).orElse(null));

        propertyPath(INPUT_PROPERTY).ifPresent(b::inputPath);
        propertyPath(LIBRARY_PROPERTY).ifPresent(b::libraryPath);
        String subpixel = System.getProperty(SUBPIXEL_PROPERTY);
        if (subpixel != null && !subpixel.isBlank()) {
            try {
                b.subpixelSize(Integer.parseInt(subpixel.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(SUBPIXEL_PROPERTY + " is not a number: " + subpixel, e);
            }
        }
        return b.build();
    }

    public void save(MosaicConfig config) {
        if (config == null) return;
        preferences.putInt(MosaicConfig.KEY_INTERMEDIATE_WIDTH, config.getIntermediateWidth());
        preferences.putInt(MosaicConfig.KEY_INTERMEDIATE_HEIGHT, config.getIntermediateHeight());
        preferences.putBoolean(MosaicConfig.KEY_PRIORITIZE_UNIQUE, config.isPrioritizeUnique());
        preferences.putInt(MosaicConfig.KEY_UNIQUE_THRESHOLD, config.getUniqueThreshold());
        preferences.putInt(MosaicConfig.KEY_SUBPIXEL_SIZE, config.getSubpixelSize());
        preferences.putPath(MosaicConfig.KEY_INPUT_PATH, config.getInputPath().orElse(null));
        preferences.putPath(MosaicConfig.KEY_LIBRARY_PATH, config.getLibraryPath().orElse(null));
    }

    private static Optional<Path> propertyPath(String property) {
        String override = System.getProperty(property);
        if (override == null || override.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(override.trim()));
    }
}
