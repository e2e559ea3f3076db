/***********************************************************************
 * This file is part of VideoBatch.
 *
 * VideoBatch is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * VideoBatch is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with VideoBatch.  If not, see <http://www.gnu.org/licenses/>.
 ************************************************************************/

package org.cripac.isee.videobatch.io;

import javax.annotation.Nonnull;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Arrays;

/**
 * A decoded video frame of 8-bit RGB pixels, stored row by row as interleaved R, G, B bytes.
 * Pixels are addressed with 0-based (x, y), x being the column.
 */
public class RgbFrame {

    public static final int CHANNELS = 3;

    private final int width;
    private final int height;
    private final byte[] data;

    /**
     * Create an all-zero (black) frame.
     */
    public RgbFrame(int width, int height) {
        this(width, height, new byte[width * height * CHANNELS]);
    }

    /**
     * Wrap existing pixel data. The array is not copied.
     *
     * @param data Interleaved RGB bytes, <code>width * height * 3</code> of them.
     */
    public RgbFrame(int width, int height, @Nonnull byte[] data) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative frame size: " + width + "x" + height);
        }
        if (data.length != width * height * CHANNELS) {
            throw new IllegalArgumentException("Expected " + (width * height * CHANNELS)
                    + " bytes for a " + width + "x" + height + " frame but got " + data.length);
        }
        this.width = width;
        this.height = height;
        this.data = data;
    }

    /**
     * Create a frame filled with one color.
     */
    @Nonnull
    public static RgbFrame filled(int width, int height, int rgb) {
        RgbFrame frame = new RgbFrame(width, height);
        for (int y = 0; y < height; ++y) {
            for (int x = 0; x < width; ++x) {
                frame.setRgb(x, y, rgb);
            }
        }
        return frame;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @return The backing array, not a copy.
     */
    @Nonnull
    public byte[] getData() {
        return data;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    private int offset(int x, int y) {
        if (!contains(x, y)) {
            throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") is outside of the "
                    + width + "x" + height + " frame");
        }
        return (y * width + x) * CHANNELS;
    }

    /**
     * @return The pixel at (x, y) packed as <code>0xRRGGBB</code>.
     */
    public int getRgb(int x, int y) {
        final int i = offset(x, y);
        return ((data[i] & 0xFF) << 16) | ((data[i + 1] & 0xFF) << 8) | (data[i + 2] & 0xFF);
    }

    public void setRgb(int x, int y, int rgb) {
        final int i = offset(x, y);
        data[i] = (byte) (rgb >> 16);
        data[i + 1] = (byte) (rgb >> 8);
        data[i + 2] = (byte) rgb;
    }

    /**
     * @return Sum of the three channel values at (x, y).
     */
    public int channelSum(int x, int y) {
        final int i = offset(x, y);
        return (data[i] & 0xFF) + (data[i + 1] & 0xFF) + (data[i + 2] & 0xFF);
    }

    @Nonnull
    public static RgbFrame fromBufferedImage(@Nonnull BufferedImage image) {
        final int w = image.getWidth();
        final int h = image.getHeight();
        final byte[] rgb = new byte[w * h * CHANNELS];
        if (image.getType() == BufferedImage.TYPE_3BYTE_BGR
                && image.getRaster().getDataBuffer() instanceof DataBufferByte
                && image.getRaster().getDataBuffer().getSize() == rgb.length) {
            final byte[] bgr = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            for (int i = 0; i < rgb.length; i += CHANNELS) {
                rgb[i] = bgr[i + 2];
                rgb[i + 1] = bgr[i + 1];
                rgb[i + 2] = bgr[i];
            }
        } else {
            int i = 0;
            for (int y = 0; y < h; ++y) {
                for (int x = 0; x < w; ++x) {
                    final int argb = image.getRGB(x, y);
                    rgb[i++] = (byte) (argb >> 16);
                    rgb[i++] = (byte) (argb >> 8);
                    rgb[i++] = (byte) argb;
                }
            }
        }
        return new RgbFrame(w, h, rgb);
    }

    @Nonnull
    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
        final byte[] bgr = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        for (int i = 0; i < data.length; i += CHANNELS) {
            bgr[i] = data[i + 2];
            bgr[i + 1] = data[i + 1];
            bgr[i + 2] = data[i];
        }
        return image;
    }

    @Nonnull
    public RgbFrame copy() {
        return new RgbFrame(width, height, data.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RgbFrame)) {
            return false;
        }
        RgbFrame other = (RgbFrame) o;
        return width == other.width && height == other.height && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "RgbFrame(" + width + "x" + height + ")";
    }
}
