package com.phillippitts.photobatch.settings;

import com.phillippitts.photobatch.config.properties.ProcessingProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Stores {@link UserSettings} in the user's {@link Preferences} tree.
 *
 * <p>Missing keys fall back to the {@code photobatch.processing.*} defaults. Persistence is best
 * effort: a store that cannot be flushed is logged and the run goes on.
 */
@Component
public class UserSettingsStore {

    private static final Logger LOG = LogManager.getLogger(UserSettingsStore.class);

    static final String NODE_PATH = "/com/phillippitts/photobatch";
    static final String INPUT_DIR = "input_dir";
    static final String OUTPUT_DIR = "output_dir";
    static final String MAX_SIDE = "max_side";
    static final String JPG_QUALITY = "jpg_quality";
    static final String PROCESS_RAW = "process_raw";
    static final String HIGH_QUALITY_RAW = "high_quality_raw";

    private final Preferences prefs;
    private final ProcessingProperties defaults;

    @Autowired
    public UserSettingsStore(ProcessingProperties defaults) {
        this(Preferences.userRoot().node(NODE_PATH), defaults);
    }

    UserSettingsStore(Preferences prefs, ProcessingProperties defaults) {
        this.prefs = prefs;
        this.defaults = defaults;
    }

    public UserSettings load() {
        return new UserSettings(
                toPath(prefs.get(INPUT_DIR, "")),
                toPath(prefs.get(OUTPUT_DIR, "")),
                prefs.getInt(MAX_SIDE, defaults.getMaxSide()),
                prefs.getInt(JPG_QUALITY, defaults.getJpgQuality()),
                prefs.getBoolean(PROCESS_RAW, defaults.isProcessRaw()),
                prefs.getBoolean(HIGH_QUALITY_RAW, defaults.isHighQualityRaw()));
    }

    public void save(UserSettings settings) {
        putPath(INPUT_DIR, settings.inputDir());
        putPath(OUTPUT_DIR, settings.outputDir());
        prefs.putInt(MAX_SIDE, settings.maxSide());
        prefs.putInt(JPG_QUALITY, settings.jpgQuality());
        prefs.putBoolean(PROCESS_RAW, settings.processRaw());
        prefs.putBoolean(HIGH_QUALITY_RAW, settings.highQualityRaw());
        try {
            prefs.flush();
        } catch (BackingStoreException e) {
            LOG.warn("Could not persist user settings: {}", e.getMessage());
        }
    }

    private void putPath(String key, Path value) {
        if (value == null) {
            prefs.remove(key);
        } else {
            prefs.put(key, value.toString());
        }
    }

    private static Path toPath(String value) {
        return value == null || value.isBlank() ? null : Path.of(value);
    }
}
