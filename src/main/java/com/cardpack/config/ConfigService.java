package com.cardpack.config;

import com.cardpack.core.pack.IdentifierSource;
import com.cardpack.core.pack.PackagerSettings;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Resolves configuration values from system properties, then persisted preferences, then defaults.
 */
public final class ConfigService {
    static final String TEMPLATE_DIR_PROPERTY = "templateDir";
    static final String RASTER_DPI_PROPERTY = "rasterDpi";
    static final String ARCHIVE_EXTENSION_PROPERTY = "archiveExtension";
    static final String PREF_KEY_TEMPLATE_DIR = "template.dir";

    static final String DEFAULT_TEMPLATE_DIR = "template_base";
    static final float DEFAULT_RASTER_DPI = 300f;

    private final PreferencesStore preferences;

    public ConfigService(PreferencesStore preferences) {
        this.preferences = preferences;
    }

    public static ConfigService createDefault() {
        return new ConfigService(PreferencesStore.global());
    }

    public Path getTemplateDirectory() {
        String override = System.getProperty(TEMPLATE_DIR_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override.trim());
        }
        Optional<Path> persisted = preferences.getPath(PREF_KEY_TEMPLATE_DIR);
        return persisted.orElse(Paths.get(DEFAULT_TEMPLATE_DIR));
    }

    public void setTemplateDirectory(Path templateDirectory) {
        if (templateDirectory == null) return;
        preferences.putPath(PREF_KEY_TEMPLATE_DIR, templateDirectory);
    }

    public float getRasterDpi() {
        String value = System.getProperty(RASTER_DPI_PROPERTY);
        if (value == null || value.isBlank()) {
            return DEFAULT_RASTER_DPI;
        }
        try {
            float dpi = Float.parseFloat(value.trim());
            return dpi > 0 ? dpi : DEFAULT_RASTER_DPI;
        } catch (NumberFormatException ex) {
            return DEFAULT_RASTER_DPI;
        }
    }

    public String getArchiveExtension() {
        String value = System.getProperty(ARCHIVE_EXTENSION_PROPERTY);
        return (value == null || value.isBlank()) ? PackagerSettings.DEFAULT_EXTENSION : value.trim();
    }

    public PackagerSettings packagerSettings() {
        return new PackagerSettings(getArchiveExtension(), IdentifierSource.RANDOM_UUID);
    }
}
