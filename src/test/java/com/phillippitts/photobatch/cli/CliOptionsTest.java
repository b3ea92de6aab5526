package com.phillippitts.photobatch.cli;

import com.phillippitts.photobatch.domain.ProcessingConfig;
import com.phillippitts.photobatch.settings.UserSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliOptionsTest {

    private static final UserSettings STORED =
            new UserSettings(Path.of("/stored/in"), Path.of("/stored/out"), 2000, 90, false, true);

    @Test
    void shouldParseSeparateAndInlineValues() {
        CliOptions options = CliOptions.parse(new String[]{
                "--cli", "--input", "/in", "--output=/out", "--max-side=1200", "--quality", "97", "--threads=6",
                "--no-raw", "--hq-raw"});

        assertThat(options.cli()).isTrue();
        assertThat(options.input()).isEqualTo(Path.of("/in"));
        assertThat(options.output()).isEqualTo(Path.of("/out"));
        assertThat(options.maxSide()).isEqualTo(1200);
        assertThat(options.quality()).isEqualTo(97);
        assertThat(options.threads()).isEqualTo(6);
        assertThat(options.noRaw()).isTrue();
        assertThat(options.hqRaw()).isTrue();
    }

    @Test
    void springAndLoggingArgumentsAreIgnored() {
        CliOptions options = CliOptions.parse(new String[]{
                "--spring.profiles.active=dev", "--logging.level.root=DEBUG", "--cli", "--input=/in", "--output=/out"});

        assertThat(options.runnable()).isTrue();
    }

    @Test
    void emptyArgumentsAreNotRunnable() {
        CliOptions options = CliOptions.parse(new String[0]);

        assertThat(options.cli()).isFalse();
        assertThat(options.runnable()).isFalse();
    }

    @Test
    void cliFlagAloneIsNotRunnable() {
        assertThat(CliOptions.parse(new String[]{"--cli", "--input", "/in"}).runnable()).isFalse();
        assertThat(CliOptions.parse(new String[]{"--input", "/in", "--output", "/out"}).runnable()).isFalse();
    }

    @Test
    void shouldRejectUnknownOption() {
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--cli", "--fast"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown option --fast")
                .hasMessageContaining("Usage:");
    }

    @Test
    void bareArgumentIsRejected() {
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"photos"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unexpected argument 'photos'");
    }

    @Test
    void shouldRejectMissingValue() {
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--cli", "--input"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing value for --input");
    }

    @Test
    void nonNumericValueIsRejected() {
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--quality", "high"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--quality expects a number")
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-5", "10001"})
    void maxSideOutsideRangeIsRejected(String value) {
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--max-side", value}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--max-side must be within [1, 10000]");
    }

    @Test
    void maxSideAtLimitIsAccepted() {
        assertThat(CliOptions.parse(new String[]{"--max-side", "10000"}).maxSide())
                .isEqualTo(CliOptions.MAX_SIDE_LIMIT);
    }

    @Test
    void zeroThreadsIsRejected() {
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--threads=0"}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldLetFlagsOverrideStoredSettings() {
        CliOptions options = CliOptions.parse(new String[]{
                "--cli", "--input", "/in", "--output", "/out", "--max-side", "800", "--quality", "99", "--threads", "3"});

        ProcessingConfig config = options.toConfig(STORED, 12);

        assertThat(config.inputRoot()).isEqualTo(Path.of("/in").toAbsolutePath());
        assertThat(config.outputRoot()).isEqualTo(Path.of("/out").toAbsolutePath());
        assertThat(config.maxSide()).isEqualTo(800);
        assertThat(config.jpgQuality()).isEqualTo(99);
        assertThat(config.threads()).isEqualTo(3);
    }

    @Test
    void storedSettingsFillUnsetSizeAndQuality() {
        CliOptions options = CliOptions.parse(new String[]{"--cli", "--input", "/in", "--output", "/out"});

        ProcessingConfig config = options.toConfig(STORED, 12);

        assertThat(config.maxSide()).isEqualTo(2000);
        assertThat(config.jpgQuality()).isEqualTo(90);
        assertThat(config.threads()).isEqualTo(12);
    }

    @Test
    void rawSwitchesComeFromCommandLineOnly() {
        ProcessingConfig plain = CliOptions.parse(new String[]{"--cli", "--input", "/in", "--output", "/out"})
                .toConfig(STORED, null);
        ProcessingConfig flagged = CliOptions.parse(new String[]{
                "--cli", "--input", "/in", "--output", "/out", "--no-raw", "--hq-raw"}).toConfig(STORED, null);

        assertThat(plain.processRaw()).isTrue();
        assertThat(plain.highQualityRaw()).isFalse();
        assertThat(plain.threads()).isNull();
        assertThat(flagged.processRaw()).isFalse();
        assertThat(flagged.highQualityRaw()).isTrue();
    }

    @Test
    void shouldClampLowQualityInRunConfig() {
        ProcessingConfig config = CliOptions.parse(new String[]{
                "--cli", "--input", "/in", "--output", "/out", "--quality", "40"}).toConfig(STORED, null);

        assertThat(config.jpgQuality()).isEqualTo(ProcessingConfig.MIN_JPG_QUALITY);
    }

    @Test
    void toConfigRequiresRunnableOptions() {
        CliOptions options = CliOptions.parse(new String[]{"--input", "/in"});

        assertThatThrownBy(() -> options.toConfig(STORED, null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void usageListsEveryOption() {
        assertThat(CliOptions.usage())
                .startsWith("Usage: --cli --input <path> --output <path>")
                .contains("--max-side N", "--quality N", "--threads N", "--no-raw", "--hq-raw");
    }
}
