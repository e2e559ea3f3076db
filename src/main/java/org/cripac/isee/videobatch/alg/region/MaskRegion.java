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
import java.io.File;

/**
 * The "on" pixels of a black/white image, row by row.
 */
public class MaskRegion extends Region {

    private final File path;

    /**
     * @param path Where the mask was loaded from, kept for reporting.
     * @param mask "On" states indexed <code>[y][x]</code>.
     */
    public MaskRegion(@Nonnull File path, @Nonnull boolean[][] mask) {
        super(columns(mask), rows(mask));
        this.path = path;
    }

    private static int count(boolean[][] mask) {
        int n = 0;
        for (boolean[] row : mask) {
            for (boolean on : row) {
                if (on) {
                    ++n;
                }
            }
        }
        return n;
    }

    @Nonnull
    private static int[] columns(boolean[][] mask) {
        final int[] xs = new int[count(mask)];
        int n = 0;
        for (boolean[] row : mask) {
            for (int x = 0; x < row.length; ++x) {
                if (row[x]) {
                    xs[n++] = x;
                }
            }
        }
        return xs;
    }

    @Nonnull
    private static int[] rows(boolean[][] mask) {
        final int[] ys = new int[count(mask)];
        int n = 0;
        for (int y = 0; y < mask.length; ++y) {
            for (boolean on : mask[y]) {
                if (on) {
                    ys[n++] = y;
                }
            }
        }
        return ys;
    }

    @Nonnull
    public File getPath() {
        return path;
    }

    @Override
    public String toString() {
        return "MaskRegion('" + path + "', " + size() + " pixels)";
    }
}
