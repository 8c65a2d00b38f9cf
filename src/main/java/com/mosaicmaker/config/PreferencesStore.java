package com.mosaicmaker.config;

import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Lightweight wrapper around {@link Preferences} so the mosaic settings survive between runs.
 */
public final class PreferencesStore {
    private static final Logger LOGGER = Logger.getLogger(PreferencesStore.class.getName());
    private static final String ROOT_NODE = "com/mosaicmaker";

    private final Preferences delegate;

    private PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    /**
     * Store rooted at a child node of the application node, e.g. for isolated test runs.
     */
    public static PreferencesStore child(String name) {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE).node(name));
    }

    public Optional<Path> getPath(String key) {
        return getString(key).map(Path::of);
    }

    public void putPath(String key, Path path) {
        if (key == null || key.isBlank()) return;
        if (path == null) {
            remove(key);
            return;
        }
        delegate.put(key, path.toString());
        flushQuietly();
    }

    public Optional<String> getString(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public void putString(String key, String value) {
        if (key == null || key.isBlank() || value == null) return;
        delegate.put(key, value);
        flushQuietly();
    }

    public int getInt(String key, int fallback) {
        return delegate.getInt(key, fallback);
    }

    public void putInt(String key, int value) {
        if (key == null || key.isBlank()) return;
        delegate.putInt(key, value);
        flushQuietly();
    }

    public boolean getBoolean(String key, boolean fallback) {
        return delegate.getBoolean(key, fallback);
    }

    public void putBoolean(String key, boolean value) {
        if (key == null || key.isBlank()) return;
        delegate.putBoolean(key, value);
        flushQuietly();
    }

    public void remove(String key) {
        delegate.remove(key);
        flushQuietly();
    }

    /**
     * Deletes this node and everything stored under it.
     */
    public void clear() {
        try {
            delegate.removeNode();
            delegate.flush();
        } catch (BackingStoreException | IllegalStateException e) {
            LOGGER.log(Level.FINE, "Could not remove preferences node " + delegate.absolutePath(), e);
        }
    }

    private void flushQuietly() {
        try {
            delegate.flush();
        } catch (BackingStoreException e) {
            // values stay in memory for this run
            LOGGER.log(Level.FINE, "Preferences flush failed", e);
        }
    }
}
