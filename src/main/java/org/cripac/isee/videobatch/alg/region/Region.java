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

import org.cripac.isee.videobatch.io.RgbFrame;

import javax.annotation.Nonnull;
import java.awt.Point;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A fixed set of pixel coordinates within a frame, in an order that never changes once built.
 * Everything the region extracts from or writes to a frame is aligned with that order.
 */
public abstract class Region {

    private final int[] xs;
    private final int[] ys;
    private List<Point> coordinates = null;

    /**
     * @param xs 0-based columns.
     * @param ys 0-based rows, aligned with <code>xs</code>.
     */
    protected Region(@Nonnull int[] xs, @Nonnull int[] ys) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("Got " + xs.length + " columns but " + ys.length + " rows");
        }
        this.xs = xs;
        this.ys = ys;
    }

    public int size() {
        return xs.length;
    }

    public int getX(int i) {
        return xs[i];
    }

    public int getY(int i) {
        return ys[i];
    }

    /**
     * A region of fewer than two pixels is degenerate.
     */
    public boolean isEmpty() {
        return xs.length < 2;
    }

    /**
     * @return The coordinates in region order.
     */
    @Nonnull
    public synchronized List<Point> coordinates() {
        if (coordinates == null) {
            List<Point> points = new ArrayList<>(xs.length);
            for (int i = 0; i < xs.length; ++i) {
                points.add(new Point(xs[i], ys[i]));
            }
            coordinates = Collections.unmodifiableList(points);
        }
        return coordinates;
    }

    /**
     * Extract the pixels of this region.
     *
     * @return Packed RGB values aligned with {@link #coordinates()}.
     * @throws IndexOutOfBoundsException If the region reaches outside of the frame.
     */
    @Nonnull
    public int[] crop(@Nonnull RgbFrame frame) {
        final int[] pixels = new int[xs.length];
        for (int i = 0; i < xs.length; ++i) {
            pixels[i] = frame.getRgb(xs[i], ys[i]);
        }
        return pixels;
    }

    /**
     * Paint <code>color</code> on every pixel of this region whose entry in <code>mask</code> is set.
     *
     * @param mask Aligned with {@link #coordinates()}.
     */
    public void mark(@Nonnull RgbFrame target, @Nonnull boolean[] mask, int color) {
        if (mask.length != xs.length) {
            throw new IllegalArgumentException("Mask of " + mask.length
                    + " entries does not fit a region of " + xs.length + " pixels");
        }
        for (int i = 0; i < xs.length; ++i) {
            if (mask[i]) {
                target.setRgb(xs[i], ys[i], color);
            }
        }
    }
}
