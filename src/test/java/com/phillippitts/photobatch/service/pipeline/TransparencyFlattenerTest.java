package com.phillippitts.photobatch.service.pipeline;

import com.phillippitts.photobatch.domain.PixelBuffer;
import com.phillippitts.photobatch.domain.PixelFormat;
import com.phillippitts.photobatch.testutil.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;

import static org.assertj.core.api.Assertions.assertThat;

class TransparencyFlattenerTest {

    @Test
    void shouldTurnFullyTransparentPixelsWhite() {
        PixelBuffer out = TransparencyFlattener.flatten(PixelBuffer.of(TestImages.transparent(4, 4)));

        assertThat(out.format()).isEqualTo(PixelFormat.PLAIN);
        assertThat(out.image().getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
        assertThat(out.image().getRGB(2, 2) & 0xFFFFFF).isEqualTo(0xFFFFFF);
    }

    @Test
    void opaquePixelsKeepTheirColour() {
        BufferedImage src = TestImages.transparent(2, 1);
        src.setRGB(0, 0, 0xFF00FF00);

        BufferedImage out = TransparencyFlattener.flatten(PixelBuffer.of(src)).image();

        assertThat(out.getRGB(0, 0) & 0xFFFFFF).isEqualTo(0x00FF00);
        assertThat(out.getRGB(1, 0) & 0xFFFFFF).isEqualTo(0xFFFFFF);
    }

    @Test
    void paletteImageIsExpandedToRgb() {
        byte[] r = {(byte) 255, 0};
        byte[] g = {0, 0};
        byte[] b = {0, (byte) 255};
        IndexColorModel palette = new IndexColorModel(1, 2, r, g, b);
        BufferedImage src = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_BINARY, palette);
        src.setRGB(1, 0, 0xFF0000FF);
        PixelBuffer pixels = PixelBuffer.of(src);
        assertThat(pixels.format()).isEqualTo(PixelFormat.PALETTE);

        BufferedImage out = TransparencyFlattener.flatten(pixels).image();

        assertThat(out.getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
        assertThat(out.getRGB(0, 0) & 0xFFFFFF).isEqualTo(0xFF0000);
        assertThat(out.getRGB(1, 0) & 0xFFFFFF).isEqualTo(0x0000FF);
    }

    @Test
    void plainRgbIsPassedThrough() {
        BufferedImage src = TestImages.split(4, 4);
        PixelBuffer pixels = PixelBuffer.of(src);

        assertThat(TransparencyFlattener.flatten(pixels).image()).isSameAs(src);
    }

    @Test
    void plainGreyIsRedrawnAsRgb() {
        BufferedImage grey = new BufferedImage(3, 3, BufferedImage.TYPE_BYTE_GRAY);

        PixelBuffer out = TransparencyFlattener.flatten(PixelBuffer.of(grey));

        assertThat(out.image().getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
        assertThat(out.format()).isEqualTo(PixelFormat.PLAIN);
    }
}
