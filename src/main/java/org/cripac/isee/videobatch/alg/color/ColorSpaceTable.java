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

package org.cripac.isee.videobatch.alg.color;

import javax.annotation.Nonnull;

/**
 * The ColorSpaceTable class holds the hue and the luminance of every possible 24-bit RGB pixel,
 * computed once so that converting a frame costs one array access per pixel.
 * <p>
 * Tables are immutable after {@link #build()} and can be shared freely. Building one takes
 * 2<sup>24</sup> conversions and about 160MB, so it is meant to be built once per process.
 * <p>
 * Pixels are addressed packed as <code>0xRRGGBB</code>.
 */
public final class ColorSpaceTable {

    /**
     * Hue of achromatic pixels (R = G = B).
     */
    public static final int NO_HUE = -1;

    private static final int NUM_PIXEL_VALUES = 1 << 24;

    private final short[] hues;
    private final double[] luminances;

    private ColorSpaceTable(short[] hues, double[] luminances) {
        this.hues = hues;
        this.luminances = luminances;
    }

    /**
     * Compute the table for all pixel values.
     */
    @Nonnull
    public static ColorSpaceTable build() {
        final short[] hues = new short[NUM_PIXEL_VALUES];
        final double[] luminances = new double[NUM_PIXEL_VALUES];
        for (int r = 0; r < 256; ++r) {
            for (int g = 0; g < 256; ++g) {
                final int base = (r << 16) | (g << 8);
                for (int b = 0; b < 256; ++b) {
                    hues[base | b] = (short) computeHue(r, g, b);
                    luminances[base | b] = computeLuminance(r, g, b);
                }
            }
        }
        return new ColorSpaceTable(hues, luminances);
    }

    /**
     * Hue in whole degrees, following the HSV conversion keyed on the smallest channel.
     * Ties are broken in the order blue, red, green, and halves round to even.
     *
     * @return A value in [0, 360), or {@link #NO_HUE} for achromatic pixels.
     */
    public static int computeHue(int r, int g, int b) {
        final int max = Math.max(r, Math.max(g, b));
        final int min = Math.min(r, Math.min(g, b));
        final int range = max - min;
        if (range == 0) {
            return NO_HUE;
        }
        final double sector;
        if (min == b) {
            sector = 1 + (double) (g - r) / range;
        } else if (min == r) {
            sector = 3 + (double) (b - g) / range;
        } else {
            sector = 5 + (double) (r - b) / range;
        }
        return Math.floorMod((int) Math.rint(60 * sector), 360);
    }

    /**
     * Weighted sum of the channels normalized to [0, 1].
     */
    public static double computeLuminance(int r, int g, int b) {
        return (0.212 * r + 0.701 * g + 0.087 * b) / 255;
    }

    public int hue(int rgb) {
        return hues[rgb & 0xFFFFFF];
    }

    public double luminance(int rgb) {
        return luminances[rgb & 0xFFFFFF];
    }

    /**
     * Look up a run of pixels at once.
     *
     * @param pixels Packed RGB values.
     * @return Hues and luminances aligned with <code>pixels</code>.
     */
    @Nonnull
    public HueLuminance lookup(@Nonnull int[] pixels) {
        final int[] h = new int[pixels.length];
        final double[] l = new double[pixels.length];
        for (int i = 0; i < pixels.length; ++i) {
            final int index = pixels[i] & 0xFFFFFF;
            h[i] = hues[index];
            l[i] = luminances[index];
        }
        return new HueLuminance(h, l);
    }
}
