package com.phillippitts.photobatch.service.codec;

import com.phillippitts.photobatch.exception.EncodeException;
import org.springframework.stereotype.Component;
import org.w3c.dom.NodeList;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.plugins.jpeg.JPEGQTable;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Baseline JPEG writer on top of the JDK's ImageIO JPEG plugin.
 *
 * <p>Output is always non-progressive with optimized Huffman tables and full-resolution chroma
 * (every component's sampling factors forced to 1). Quantization tables come from a
 * {@link QuantizationPreset} scaled for the requested quality and are injected through the
 * native JPEG metadata tree, so the writer runs in copy-from-metadata mode.
 */
@Component
public class JpegEncoder {

    static final String NATIVE_FORMAT = "javax_imageio_jpeg_image_1.0";
    static final int MIN_BUFFER_BYTES = 64 * 1024;
    static final int MAX_BUFFER_BYTES = 64 * 1024 * 1024;

    /**
     * @param image   3-channel image (flattened before this point)
     * @param quality IJG quality 1-100
     * @param preset  base quantization tables
     * @return encoded JPEG bytes
     * @throws EncodeException if no JPEG writer exists or writing fails
     */
    public byte[] encode(BufferedImage image, int quality, QuantizationPreset preset) {
        ImageWriter writer = jpegWriter();
        try {
            JPEGImageWriteParam param = (JPEGImageWriteParam) writer.getDefaultWriteParam();
            param.setOptimizeHuffmanTables(true);
            param.setProgressiveMode(ImageWriteParam.MODE_DISABLED);

            IIOMetadata metadata = writer.getDefaultImageMetadata(
                    ImageTypeSpecifier.createFromRenderedImage(image), param);
            applyTablesAndSampling(metadata, preset.scaledTables(quality));

            ByteArrayOutputStream out = new ByteArrayOutputStream(initialBufferSize(image.getWidth(), image.getHeight()));
            try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
                writer.setOutput(ios);
                writer.write(null, new IIOImage(image, null, metadata), param);
            }
            return out.toByteArray();
        } catch (IOException | RuntimeException e) {
            throw new EncodeException("JPEG encoding failed: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
    }

    private static ImageWriter jpegWriter() {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new EncodeException("No ImageIO JPEG writer available");
        }
        return writers.next();
    }

    static void applyTablesAndSampling(IIOMetadata metadata, JPEGQTable[] tables)
            throws IIOInvalidTreeException {
        IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(NATIVE_FORMAT);

        NodeList dqtables = root.getElementsByTagName("dqtable");
        for (int i = 0; i < dqtables.getLength(); i++) {
            IIOMetadataNode table = (IIOMetadataNode) dqtables.item(i);
            int id = Integer.parseInt(table.getAttribute("qtableId"));
            table.setUserObject(id == 0 ? tables[0] : tables[1]);
        }

        NodeList components = root.getElementsByTagName("componentSpec");
        for (int i = 0; i < components.getLength(); i++) {
            IIOMetadataNode component = (IIOMetadataNode) components.item(i);
            component.setAttribute("HsamplingFactor", "1");
            component.setAttribute("VsamplingFactor", "1");
        }

        metadata.setFromTree(NATIVE_FORMAT, root);
    }

    /**
     * Initial output buffer: about half a byte per pixel, within {@code [64 KiB, 64 MiB]}.
     * The stream still grows past the cap when a large image needs it.
     */
    static int initialBufferSize(int width, int height) {
        long estimate = (long) width * height / 2;
        return (int) Math.max(MIN_BUFFER_BYTES, Math.min(estimate, MAX_BUFFER_BYTES));
    }
}
