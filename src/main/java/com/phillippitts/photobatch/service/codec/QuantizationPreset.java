package com.phillippitts.photobatch.service.codec;

import javax.imageio.plugins.jpeg.JPEGQTable;

/**
 * Base quantization tables, scaled per quality with the IJG formula.
 */
public enum QuantizationPreset {

    /** JPEG Annex K luminance and chrominance tables. */
    STANDARD(JPEGQTable.K1Luminance, JPEGQTable.K2Chrominance),

    /**
     * Flatter table tuned for photographs (N. Robidoux), used for luma and chroma alike.
     * Keeps more high-frequency detail than Annex K at the same quality.
     */
    PHOTOGRAPHIC(photographicTable(), photographicTable());

    private final JPEGQTable luminance;
    private final JPEGQTable chrominance;

    QuantizationPreset(JPEGQTable luminance, JPEGQTable chrominance) {
        this.luminance = luminance;
        this.chrominance = chrominance;
    }

    public JPEGQTable luminance() {
        return luminance;
    }

    public JPEGQTable chrominance() {
        return chrominance;
    }

    /**
     * Scales both tables for a quality setting; entries are clamped to baseline range.
     *
     * @param quality IJG quality 1-100
     * @return {@code [luminance, chrominance]}
     */
    public JPEGQTable[] scaledTables(int quality) {
        float factor = scalePercent(quality) / 100f;
        return new JPEGQTable[] {
                luminance.getScaledInstance(factor, true),
                chrominance.getScaledInstance(factor, true)
        };
    }

    /**
     * IJG quality to table scale percentage: {@code q < 50 ? 5000 / q : 200 - 2q}.
     */
    static int scalePercent(int quality) {
        int q = Math.max(1, Math.min(quality, 100));
        return q < 50 ? 5000 / q : 200 - 2 * q;
    }

    private static JPEGQTable photographicTable() {
        // natural (row-major) order
        return new JPEGQTable(new int[] {
                16, 16, 16, 18, 25, 37, 56, 85,
                16, 17, 20, 27, 34, 40, 53, 75,
                16, 20, 24, 31, 43, 62, 91, 135,
                18, 27, 31, 40, 53, 74, 106, 156,
                25, 34, 43, 53, 69, 94, 131, 189,
                37, 40, 62, 74, 94, 124, 169, 238,
                56, 53, 91, 106, 131, 169, 226, 311,
                85, 75, 135, 156, 189, 238, 311, 418
        });
    }
}
