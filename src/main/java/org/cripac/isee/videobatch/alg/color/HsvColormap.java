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

/**
 * A 256-entry cyclic color map running red, yellow, green, cyan, blue, magenta and back to red,
 * built by linear interpolation between fixed control points of each channel.
 */
public final class HsvColormap {

    private static final int N = 256;

    // {position, value} pairs for each channel.
    private static final double[][] RED = {
            {0.0, 1.0}, {0.158730, 1.0}, {0.174603, 0.968750}, {0.333333, 0.031250},
            {0.349206, 0.0}, {0.666667, 0.0}, {0.682540, 0.031250}, {0.841270, 0.968750},
            {0.857143, 1.0}, {1.0, 1.0}};
    private static final double[][] GREEN = {
            {0.0, 0.0}, {0.158730, 0.937500}, {0.174603, 1.0}, {0.507937, 1.0},
            {0.666667, 0.062500}, {0.682540, 0.0}, {1.0, 0.0}};
    private static final double[][] BLUE = {
            {0.0, 0.0}, {0.333333, 0.0}, {0.349206, 0.062500}, {0.507937, 1.0},
            {0.841270, 1.0}, {0.857143, 0.937500}, {1.0, 0.09375}};

    private static final int[] LUT = new int[N];

    static {
        for (int i = 0; i < N; ++i) {
            final double t = (double) i / (N - 1);
            LUT[i] = (toByte(interpolate(RED, t)) << 16)
                    | (toByte(interpolate(GREEN, t)) << 8)
                    | toByte(interpolate(BLUE, t));
        }
    }

    private HsvColormap() {
    }

    private static double interpolate(double[][] points, double t) {
        for (int k = 1; k < points.length; ++k) {
            if (t <= points[k][0]) {
                final double x0 = points[k - 1][0];
                final double x1 = points[k][0];
                final double y0 = points[k - 1][1];
                final double y1 = points[k][1];
                return y0 + (t - x0) / (x1 - x0) * (y1 - y0);
            }
        }
        return points[points.length - 1][1];
    }

    private static int toByte(double v) {
        return (int) Math.rint(Math.max(0.0, Math.min(1.0, v)) * 255);
    }

    /**
     * Sample the map.
     *
     * @param v Position in [0, 1]; values outside are clamped.
     * @return The color packed as <code>0xRRGGBB</code>.
     */
    public static int sample(double v) {
        final int index = (int) (v * N);
        return LUT[Math.max(0, Math.min(N - 1, index))];
    }

    /**
     * @param hue Hue in degrees, [0, 360].
     * @return The color of the map at that hue.
     */
    public static int forHue(double hue) {
        return sample(hue / 360);
    }
}
