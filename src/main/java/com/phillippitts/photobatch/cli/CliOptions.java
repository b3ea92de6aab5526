package com.phillippitts.photobatch.cli;

import com.phillippitts.photobatch.domain.ProcessingConfig;
import com.phillippitts.photobatch.settings.UserSettings;

import java.nio.file.Path;

/**
 * Parsed command line.
 *
 * <p>Accepts {@code --name value} and {@code --name=value}. Arguments in the {@code spring.*}
 * and {@code logging.*} namespaces belong to Spring Boot and are ignored here.
 */
public final class CliOptions {

    static final int MAX_SIDE_LIMIT = 10_000;

    private boolean cli;
    private Path input;
    private Path output;
    private Integer maxSide;
    private Integer quality;
    private Integer threads;
    private boolean noRaw;
    private boolean hqRaw;

    private CliOptions() {
    }

    /**
     * @throws IllegalArgumentException on an unknown flag, a missing value or a bad number
     */
    public static CliOptions parse(String[] args) {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument '" + arg + "'. " + usage());
            }
            String name = arg.substring(2);
            String inlineValue = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                inlineValue = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            if (name.startsWith("spring.") || name.startsWith("logging.")) {
                continue;
            }
            switch (name) {
                case "cli" -> o.cli = true;
                case "no-raw" -> o.noRaw = true;
                case "hq-raw" -> o.hqRaw = true;
                case "input", "output", "max-side", "quality", "threads" -> {
                    String value = inlineValue;
                    if (value == null) {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("Missing value for --" + name + ". " + usage());
                        }
                        value = args[++i];
                    }
                    o.assign(name, value);
                }
                default -> throw new IllegalArgumentException("Unknown option --" + name + ". " + usage());
            }
        }
        return o;
    }

    private void assign(String name, String value) {
        switch (name) {
            case "input" -> input = Path.of(value);
            case "output" -> output = Path.of(value);
            case "max-side" -> maxSide = number(name, value, 1, MAX_SIDE_LIMIT);
            case "quality" -> quality = number(name, value, 1, Integer.MAX_VALUE);
            case "threads" -> threads = number(name, value, 1, Integer.MAX_VALUE);
            default -> throw new IllegalArgumentException("Unknown option --" + name);
        }
    }

    private static int number(String name, String value, int min, int max) {
        int n;
        try {
            n = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects a number, got '" + value + "'. " + usage(), e);
        }
        if (n < min || n > max) {
            throw new IllegalArgumentException("--" + name + " must be within [" + min + ", " + max + "], got " + n);
        }
        return n;
    }

    public static String usage() {
        return "Usage: --cli --input <path> --output <path> [--max-side N] [--quality N] [--threads N]"
                + " [--no-raw] [--hq-raw]";
    }

    /**
     * Whether a batch should run without the interactive front end.
     */
    public boolean runnable() {
        return cli && input != null && output != null;
    }

    /**
     * Builds the run config. Size and quality given on the command line win over stored settings;
     * the RAW switches are always taken from the command line, so a remembered {@code --no-raw}
     * never outlives the run that used it.
     *
     * @param stored         settings merged over the configured defaults
     * @param defaultThreads configured worker count, or null
     */
    public ProcessingConfig toConfig(UserSettings stored, Integer defaultThreads) {
        if (!runnable()) {
            throw new IllegalStateException("--cli, --input and --output are required");
        }
        return new ProcessingConfig(
                input,
                output,
                maxSide != null ? maxSide : stored.maxSide(),
                quality != null ? quality : stored.jpgQuality(),
                !noRaw,
                hqRaw,
                threads != null ? threads : defaultThreads);
    }

    public boolean cli() {
        return cli;
    }

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public Integer maxSide() {
        return maxSide;
    }

    public Integer quality() {
        return quality;
    }

    public Integer threads() {
        return threads;
    }

    public boolean noRaw() {
        return noRaw;
    }

    public boolean hqRaw() {
        return hqRaw;
    }
}
