package com.mosaicmaker.config;

import org.json.JSONException;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings for building a mosaic.
 */
public final class MosaicConfig {
    public static final int DEFAULT_INTERMEDIATE_WIDTH = 32;
    public static final int DEFAULT_INTERMEDIATE_HEIGHT = 32;
    public static final boolean DEFAULT_PRIORITIZE_UNIQUE = true;
    public static final int DEFAULT_UNIQUE_THRESHOLD = 100;
    public static final int DEFAULT_SUBPIXEL_SIZE = 16;

    static final String KEY_INTERMEDIATE_WIDTH = "intermediateWidth";
    static final String KEY_INTERMEDIATE_HEIGHT = "intermediateHeight";
    static final String KEY_PRIORITIZE_UNIQUE = "prioritizeUnique";
    static final String KEY_UNIQUE_THRESHOLD = "uniqueThreshold";
    static final String KEY_SUBPIXEL_SIZE = "subpixelSize";
    static final String KEY_INPUT_PATH = "inputPath";
    static final String KEY_LIBRARY_PATH = "libraryPath";

    private final int intermediateWidth;
    private final int intermediateHeight;
    private final boolean prioritizeUnique;
    private final int uniqueThreshold;
    private final int subpixelSize;
    private final Path inputPath;
    private final Path libraryPath;

    private MosaicConfig(Builder b) {
        requireAtLeastOne(KEY_INTERMEDIATE_WIDTH, b.intermediateWidth);
        requireAtLeastOne(KEY_INTERMEDIATE_HEIGHT, b.intermediateHeight);
        requireAtLeastOne(KEY_SUBPIXEL_SIZE, b.subpixelSize);
        if (b.uniqueThreshold < 0) {
            throw new IllegalArgumentException(KEY_UNIQUE_THRESHOLD + " must be >= 0, got " + b.uniqueThreshold);
        }
        this.intermediateWidth = b.intermediateWidth;
        this.intermediateHeight = b.intermediateHeight;
        this.prioritizeUnique = b.prioritizeUnique;
        this.uniqueThreshold = b.uniqueThreshold;
        this.subpixelSize = b.subpixelSize;
        this.inputPath = b.inputPath;
        this.libraryPath = b.libraryPath;
    }

    public static MosaicConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .intermediateWidth(intermediateWidth)
            .intermediateHeight(intermediateHeight)
            .prioritizeUnique(prioritizeUnique)
            .uniqueThreshold(uniqueThreshold)
            .subpixelSize(subpixelSize)
            .inputPath(inputPath)
            .libraryPath(libraryPath);
    }

    public int getIntermediateWidth() {
        return intermediateWidth;
    }

    public int getIntermediateHeight() {
        return intermediateHeight;
    }

    public boolean isPrioritizeUnique() {
        return prioritizeUnique;
    }

    public int getUniqueThreshold() {
        return uniqueThreshold;
    }

    public int getSubpixelSize() {
        return subpixelSize;
    }

    public Optional<Path> getInputPath() {
        return Optional.ofNullable(inputPath);
    }

    public Optional<Path> getLibraryPath() {
        return Optional.ofNullable(libraryPath);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put(KEY_INTERMEDIATE_WIDTH, intermediateWidth);
        json.put(KEY_INTERMEDIATE_HEIGHT, intermediateHeight);
        json.put(KEY_PRIORITIZE_UNIQUE, prioritizeUnique);
        json.put(KEY_UNIQUE_THRESHOLD, uniqueThreshold);
        json.put(KEY_SUBPIXEL_SIZE, subpixelSize);
        json.put(KEY_INPUT_PATH, inputPath == null ? JSONObject.NULL : inputPath.toString());
        json.put(KEY_LIBRARY_PATH, libraryPath == null ? JSONObject.NULL : libraryPath.toString());
        return json;
    }

    /**
     * Parses a JSON config. Missing keys keep their defaults; {@code null} paths clear the path.
     *
     * @throws IllegalArgumentException when the text is not a JSON object or a value is invalid
     */
    public static MosaicConfig fromJson(String text) {
        JSONObject root;
        try {
            root = new JSONObject(text);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Config is not a JSON object: " + e.getMessage(), e);
        }
        Builder b = builder();
        try {
            b.intermediateWidth(root.has(KEY_INTERMEDIATE_WIDTH)
                ? root.getInt(KEY_INTERMEDIATE_WIDTH) : DEFAULT_INTERMEDIATE_WIDTH);
            b.intermediateHeight(root.has(KEY_INTERMEDIATE_HEIGHT)
                ? root.getInt(KEY_INTERMEDIATE_HEIGHT) : DEFAULT_INTERMEDIATE_HEIGHT);
            b.prioritizeUnique(root.has(KEY_PRIORITIZE_UNIQUE)
                ? root.getBoolean(KEY_PRIORITIZE_UNIQUE) : DEFAULT_PRIORITIZE_UNIQUE);
            b.uniqueThreshold(root.has(KEY_UNIQUE_THRESHOLD)
                ? root.getInt(KEY_UNIQUE_THRESHOLD) : DEFAULT_UNIQUE_THRESHOLD);
            b.subpixelSize(root.has(KEY_SUBPIXEL_SIZE)
                ? root.getInt(KEY_SUBPIXEL_SIZE) : DEFAULT_SUBPIXEL_SIZE);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid config value: " + e.getMessage(), e);
        }
        b.inputPath(optPath(root, KEY_INPUT_PATH));
        b.libraryPath(optPath(root, KEY_LIBRARY_PATH));
        return b.build();
    }

    private static Path optPath(JSONObject root, String key) {
        if (!root.has(key) || root.isNull(key)) {
            return null;
        }
        String value = root.optString(key, "");
        return value.isBlank() ? null : Path.of(value);
    }

    private static void requireAtLeastOne(String key, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(key + " must be >= 1, got " + value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MosaicConfig)) return false;
        MosaicConfig that = (MosaicConfig) o;
        return intermediateWidth == that.intermediateWidth
            && intermediateHeight == that.intermediateHeight
            && prioritizeUnique == that.prioritizeUnique
            && uniqueThreshold == that.uniqueThreshold
            && subpixelSize == that.subpixelSize
            && Objects.equals(inputPath, that.inputPath)
            && Objects.equals(libraryPath, that.libraryPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(intermediateWidth, intermediateHeight, prioritizeUnique,
            uniqueThreshold, subpixelSize, inputPath, libraryPath);
    }

    @Override
    public String toString() {
        return toJson().toString();
    }

    public static final class Builder {
        private int intermediateWidth = DEFAULT_INTERMEDIATE_WIDTH;
        private int intermediateHeight = DEFAULT_INTERMEDIATE_HEIGHT;
        private boolean prioritizeUnique = DEFAULT_PRIORITIZE_UNIQUE;
        private int uniqueThreshold = DEFAULT_UNIQUE_THRESHOLD;
        private int subpixelSize = DEFAULT_SUBPIXEL_SIZE;
        private Path inputPath;
        private Path libraryPath;

        private Builder() {
        }

        public Builder intermediateWidth(int value) {
            this.intermediateWidth = value;
            return this;
        }

        public Builder intermediateHeight(int value) {
            this.intermediateHeight = value;
            return this;
        }

        public Builder prioritizeUnique(boolean value) {
            this.prioritizeUnique = value;
            return this;
        }

        public Builder uniqueThreshold(int value) {
            this.uniqueThreshold = value;
            return this;
        }

        public Builder subpixelSize(int value) {
            this.subpixelSize = value;
            return this;
        }

        public Builder inputPath(Path value) {
            this.inputPath = value;
            return this;
        }

        public Builder libraryPath(Path value) {
            this.libraryPath = value;
            return this;
        }

        public MosaicConfig build() {
            return new MosaicConfig(this);
        }
    }
}
