package com.phillippitts.photobatch.service.codec;

import com.phillippitts.photobatch.testutil.TestImages;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputDirectory;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExifRoundTripTest {

    @TempDir
    Path tmp;

    private final JpegEncoder encoder = new JpegEncoder();

    @Test
    void readerFindsOrientationAndExifBlock() throws Exception {
        Path source = Files.write(tmp.resolve("rotated.jpg"), jpegWithExif(6, "TestCam"));

        SourceMetadata metadata = new MetadataReader().read(source);

        assertThat(metadata.orientation()).isEqualTo(6);
        assertThat(metadata.exif()).isNotNull();
        assertThat(metadata.iccProfile()).isNull();
    }

    @Test
    void plainJpegHasDefaults() {
        Path source = TestImages.writeJpeg(tmp.resolve("plain.jpg"), 8, 8);

        SourceMetadata metadata = new MetadataReader().read(source);

        assertThat(metadata.orientation()).isEqualTo(1);
        assertThat(metadata.exif()).isNull();
    }

    @Test
    void unreadableFileYieldsDefaults() throws Exception {
        Path junk = Files.write(tmp.resolve("junk.jpg"), new byte[] {1, 2, 3, 4});

        SourceMetadata metadata = new MetadataReader().read(junk);

        assertThat(metadata.orientation()).isEqualTo(1);
        assertThat(metadata.exif()).isNull();
    }

    @Test
    void shouldCarryTagsButDropOrientation() throws Exception {
        Path source = Files.write(tmp.resolve("rotated.jpg"), jpegWithExif(6, "TestCam"));
        SourceMetadata metadata = new MetadataReader().read(source);
        byte[] fresh = encoder.encode(TestImages.split(8, 8), 90, QuantizationPreset.STANDARD);

        byte[] withExif = new ExifEmbedder().embed(fresh, metadata.exif());

        JpegImageMetadata read = (JpegImageMetadata) Imaging.getMetadata(withExif);
        assertThat(read.findEXIFValue(TiffTagConstants.TIFF_TAG_MAKE).getStringValue()).isEqualTo("TestCam");
        assertThat(read.findEXIFValue(TiffTagConstants.TIFF_TAG_ORIENTATION)).isNull();
    }

    @Test
    void shouldKeepImageWhenExifCannotBeRewritten() throws Exception {
        byte[] fresh = encoder.encode(TestImages.split(8, 8), 90, QuantizationPreset.STANDARD);
        // a set without any directory cannot be serialized
        TiffOutputSet unwritable = new TiffOutputSet();

        byte[] out = new ExifEmbedder().embed(fresh, unwritable);

        assertThat(out).isEqualTo(fresh);
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(out));
        assertThat(decoded.getWidth()).isEqualTo(8);
        assertThat(decoded.getHeight()).isEqualTo(8);
    }

    private byte[] jpegWithExif(int orientation, String make) throws Exception {
        byte[] jpeg = encoder.encode(TestImages.split(8, 8), 90, QuantizationPreset.STANDARD);
        TiffOutputSet set = new TiffOutputSet();
        TiffOutputDirectory root = set.getOrCreateRootDirectory();
        root.add(TiffTagConstants.TIFF_TAG_ORIENTATION, (short) orientation);
        root.add(TiffTagConstants.TIFF_TAG_MAKE, make);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new ExifRewriter().updateExifMetadataLossless(jpeg, out, set);
        return out.toByteArray();
    }
}
