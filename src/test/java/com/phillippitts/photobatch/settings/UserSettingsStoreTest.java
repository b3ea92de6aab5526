package com.phillippitts.photobatch.settings;

import com.phillippitts.photobatch.config.properties.ProcessingProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.UUID;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

import static org.assertj.core.api.Assertions.assertThat;

class UserSettingsStoreTest {

    private Preferences node;
    private UserSettingsStore store;

    @BeforeEach
    void setUp() {
        node = Preferences.userRoot().node("/com/phillippitts/photobatch-test-" + UUID.randomUUID());
        store = new UserSettingsStore(node, new ProcessingProperties());
    }

    @AfterEach
    void tearDown() throws BackingStoreException {
        node.removeNode();
    }

    @Test
    void shouldFallBackToConfiguredDefaultsWhenStoreIsEmpty() {
        UserSettings settings = store.load();

        assertThat(settings.inputDir()).isNull();
        assertThat(settings.outputDir()).isNull();
        assertThat(settings.maxSide()).isEqualTo(3000);
        assertThat(settings.jpgQuality()).isEqualTo(95);
        assertThat(settings.processRaw()).isTrue();
        assertThat(settings.highQualityRaw()).isFalse();
    }

    @Test
    void defaultsFollowProperties() {
        ProcessingProperties props = new ProcessingProperties();
        props.setMaxSide(1600);
        props.setJpgQuality(90);
        props.setProcessRaw(false);

        UserSettings settings = new UserSettingsStore(node, props).load();

        assertThat(settings.maxSide()).isEqualTo(1600);
        assertThat(settings.jpgQuality()).isEqualTo(90);
        assertThat(settings.processRaw()).isFalse();
    }

    @Test
    void shouldLoadSavedSettingsBack() {
        UserSettings saved = new UserSettings(Path.of("/photos/in"), Path.of("/photos/out"), 2048, 88, false, true);

        store.save(saved);

        assertThat(store.load()).isEqualTo(saved);
        assertThat(node.get(UserSettingsStore.INPUT_DIR, null)).isEqualTo(Path.of("/photos/in").toString());
        assertThat(node.getInt(UserSettingsStore.MAX_SIDE, -1)).isEqualTo(2048);
    }

    @Test
    void nullPathRemovesStoredKey() {
        store.save(new UserSettings(Path.of("/a"), Path.of("/b"), 3000, 95, true, false));

        store.save(new UserSettings(null, Path.of("/b"), 3000, 95, true, false));

        assertThat(node.get(UserSettingsStore.INPUT_DIR, null)).isNull();
        assertThat(store.load().inputDir()).isNull();
        assertThat(store.load().outputDir()).isEqualTo(Path.of("/b"));
    }

    @Test
    void blankStoredPathReadsAsNull() {
        node.put(UserSettingsStore.OUTPUT_DIR, "  ");

        assertThat(store.load().outputDir()).isNull();
    }
}
