package com.phillippitts.photobatch.service.codec.raw;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Parses the verbose identify report of dcraw ({@code dcraw -i -v}).
 *
 * <p>Relevant lines:
 * <pre>
 * Timestamp: Sat Mar 14 10:22:33 2020
 * Camera: Canon EOS 5D Mark III
 * ISO speed: 100
 * Shutter: 1/250.0 sec
 * Aperture: f/8.0
 * Focal length: 50.0 mm
 * Image size:  5760 x 3840
 * Output size: 5760 x 3840
 * </pre>
 * Zero or unparsable values are treated as absent.
 */
final class RawMetadataParser {

    private static final Logger LOG = LogManager.getLogger(RawMetadataParser.class);

    private static final DateTimeFormatter CTIME =
            DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.ENGLISH);

    private RawMetadataParser() {
    }

    static RawMetadata parse(String report) {
        if (report == null || report.isBlank()) {
            return RawMetadata.empty();
        }
        LocalDateTime captured = null;
        String make = null;
        String model = null;
        Double focal = null;
        Double aperture = null;
        Double shutter = null;
        Integer iso = null;
        Integer[] imageSize = null;
        Integer[] outputSize = null;

        for (String line : report.split("\\R")) {
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String key = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            if (value.isEmpty()) {
                continue;
            }
            switch (key) {
                case "Timestamp" -> captured = parseTimestamp(value);
                case "Camera" -> {
                    int space = value.indexOf(' ');
                    make = space < 0 ? value : value.substring(0, space);
                    model = space < 0 ? null : value.substring(space + 1).trim();
                }
                case "ISO speed" -> {
                    Double v = positive(value);
                    iso = v == null ? null : (int) Math.round(v);
                }
                case "Shutter" -> shutter = parseShutter(value);
                case "Aperture" -> aperture = positive(value.startsWith("f/") ? value.substring(2) : value);
                case "Focal length" -> focal = positive(stripUnit(value, "mm"));
                case "Image size" -> imageSize = parseSize(value);
                case "Output size" -> outputSize = parseSize(value);
                default -> {
                    // not part of the recovered field set
                }
            }
        }

        Integer[] size = outputSize != null ? outputSize : imageSize;
        return new RawMetadata(captured, make, model, focal, aperture, shutter, iso, null,
                size == null ? null : size[0], size == null ? null : size[1]);
    }

    private static LocalDateTime parseTimestamp(String value) {
        try {
            return LocalDateTime.parse(value.replaceAll("\\s+", " "), CTIME);
        } catch (DateTimeParseException e) {
            LOG.debug("Unparsable RAW timestamp '{}'", value);
            return null;
        }
    }

    private static Double parseShutter(String value) {
        String v = stripUnit(value, "sec");
        int slash = v.indexOf('/');
        if (slash < 0) {
            return positive(v);
        }
        Double numerator = positive(v.substring(0, slash));
        Double denominator = positive(v.substring(slash + 1));
        if (numerator == null || denominator == null) {
            return null;
        }
        return numerator / denominator;
    }

    private static Integer[] parseSize(String value) {
        String[] parts = value.split("x");
        if (parts.length != 2) {
            return null;
        }
        Double w = positive(parts[0]);
        Double h = positive(parts[1]);
        if (w == null || h == null) {
            return null;
        }
        return new Integer[] {w.intValue(), h.intValue()};
    }

    private static String stripUnit(String value, String unit) {
        String v = value.trim();
        return v.endsWith(unit) ? v.substring(0, v.length() - unit.length()).trim() : v;
    }

    private static Double positive(String value) {
        try {
            double d = Double.parseDouble(value.trim());
            return d > 0 && Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
