package com.starscape.photolog.support;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for tests.
 * Provides helper methods for creating and decoding test images.
 */
public final class TestUtils {

    private TestUtils() {
    }

    /**
     * Create a simple test JPEG image with specified dimensions.
     */
    public static byte[] createTestImage(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();

        // Fill with a gradient for visual verification
        for (int y = 0; y < height; y++) {
            int colorValue = (int) (255 * ((double) y / height));
            g.setColor(new Color(colorValue, colorValue, colorValue));
            g.drawLine(0, y, width, y);
        }

        g.dispose();
        return encode(image, "jpg");
    }

    /**
     * Create a test PNG image with specified dimensions.
     */
    public static byte[] createTestPngImage(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.BLUE);
        g.fillRect(0, 0, width, height);
        g.dispose();
        return encode(image, "png");
    }

    /**
     * A PNG whose every pixel is fully transparent.
     */
    public static byte[] createTransparentPngImage(int width, int height) throws IOException {
        return encode(new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB), "png");
    }

    /**
     * A solid black JPEG carrying an Exif APP1 segment whose IFD0 holds only the given Orientation tag.
     * The pixel data is stored unrotated, {@code width} by {@code height}.
     */
    public static byte[] createJpegWithOrientation(int width, int height, int orientation) throws IOException {
        byte[] jpeg = encode(solidImage(width, height, Color.BLACK), "jpg");

        ByteBuffer tiff = ByteBuffer.allocate(26).order(ByteOrder.BIG_ENDIAN);
        tiff.put((byte) 'M').put((byte) 'M').putShort((short) 42).putInt(8);
        tiff.putShort((short) 1);
        tiff.putShort((short) 0x0112).putShort((short) 3).putInt(1).putShort((short) orientation).putShort((short) 0);
        tiff.putInt(0);

        byte[] header = "Exif\0\0".getBytes(StandardCharsets.US_ASCII);
        int segmentLength = 2 + header.length + tiff.capacity();

        // Place APP1 after SOI and the JFIF APP0 segment
        int insertAt = 2;
        if ((jpeg[2] & 0xff) == 0xff && (jpeg[3] & 0xff) == 0xe0) {
            insertAt = 4 + (((jpeg[4] & 0xff) << 8) | (jpeg[5] & 0xff));
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(jpeg, 0, insertAt);
        out.write(0xff);
        out.write(0xe1);
        out.write(segmentLength >> 8);
        out.write(segmentLength & 0xff);
        out.write(header);
        out.write(tiff.array());
        out.write(jpeg, insertAt, jpeg.length - insertAt);
        return out.toByteArray();
    }

    public static BufferedImage solidImage(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(color);
        g.fillRect(0, 0, width, height);
        g.dispose();
        return image;
    }

    public static BufferedImage decode(byte[] bytes) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            throw new IOException("Not a decodable image");
        }
        return image;
    }

    private static byte[] encode(BufferedImage image, String format) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        ImageIO.write(image, format, baos);
        return baos.toByteArray();
    }
}
