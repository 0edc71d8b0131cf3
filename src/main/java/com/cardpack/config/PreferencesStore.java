package com.cardpack.config;

import com.cardpack.logging.AppLogger;

import java.nio.file.Path;
import java.util.Optional;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Lightweight wrapper around {@link Preferences} so the packager remembers folders between runs.
 */
public final class PreferencesStore {
    private static final String ROOT_NODE = "com/cardpack/packager";

    private final Preferences delegate;

    private PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return forNode(ROOT_NODE);
    }

    public static PreferencesStore forNode(String node) {
        return new PreferencesStore(Preferences.userRoot().node(node));
    }

    public Optional<Path> getPath(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Path.of(value));
    }

    public void putPath(String key, Path path) {
        if (key == null || key.isBlank() || path == null) return;
        delegate.put(key, path.toAbsolutePath().toString());
        flush();
    }

    /** Drops every value stored under this node. */
    public void clear() {
        try {
            delegate.clear();
            delegate.flush();
        } catch (BackingStoreException ex) {
            AppLogger.get().warning("Could not clear preferences " + delegate.absolutePath() + ": " + ex.getMessage());
        }
    }

    private void flush() {
        try {
            delegate.flush();
        } catch (BackingStoreException ex) {
            AppLogger.get().warning("Could not persist preferences: " + ex.getMessage());
        }
    }
}
