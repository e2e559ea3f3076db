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

package org.cripac.isee.videobatch.alg.region;

import javax.annotation.Nonnull;

/**
 * All pixels of <code>[x, x + w) &times; [y, y + h)</code>, row by row.
 */
public class RectangularRegion extends Region {

    public final int x;
    public final int y;
    public final int w;
    public final int h;

    public RectangularRegion(int x, int y, int w, int h) {
        super(columns(x, y, w, h), rows(x, y, w, h));
        this.x = x;
        this.y = y;
        this.w = w;
        this.h = h;
    }

    private static void check(int x, int y, int w, int h) {
        if (x < 0 || y < 0 || w < 0 || h < 0) {
            throw new IllegalArgumentException("Rectangle values must not be negative,"
                    + " got x=" + x + ", y=" + y + ", w=" + w + ", h=" + h);
        }
    }

    @Nonnull
    private static int[] columns(int x, int y, int w, int h) {
        check(x, y, w, h);
        final int[] xs = new int[w * h];
        for (int j = 0; j < h; ++j) {
            for (int i = 0; i < w; ++i) {
                xs[j * w + i] = x + i;
            }
        }
        return xs;
    }

    @Nonnull
    private static int[] rows(int x, int y, int w, int h) {
        final int[] ys = new int[w * h];
        for (int j = 0; j < h; ++j) {
            for (int i = 0; i < w; ++i) {
                ys[j * w + i] = y + j;
            }
        }
        return ys;
    }

    @Override
    public String toString() {
        return "RectangularRegion(x=" + x + ",y=" + y + ",w=" + w + ",h=" + h + ")";
    }
}
