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

package org.cripac.isee.videobatch.alg.pixylation;

import org.cripac.isee.videobatch.alg.region.Region;

import javax.annotation.Nonnull;

/**
 * Computes the weighted mean position of the selected pixels of a region.
 */
public class CentroidEstimator {

    /**
     * Weighted mean coordinates of a pixel selection, 0-based.
     * Both are NaN if nothing with a positive weight was selected.
     */
    public static class Centroid {
        public static final Centroid UNDEFINED = new Centroid(Double.NaN, Double.NaN, 0);

        public final double x;
        public final double y;
        public final int count;

        public Centroid(double x, double y, int count) {
            this.x = x;
            this.y = y;
            this.count = count;
        }

        public boolean isDefined() {
            return count > 0;
        }

        @Override
        public String toString() {
            return "Centroid(" + x + ", " + y + "; " + count + ")";
        }
    }

    private CentroidEstimator() {
    }

    /**
     * @param selected Aligned with the coordinates of <code>region</code>.
     * @param weights  Aligned with the coordinates of <code>region</code>. Must not be negative.
     */
    @Nonnull
    public static Centroid estimate(@Nonnull Region region,
                                    @Nonnull boolean[] selected,
                                    @Nonnull double[] weights) {
        if (selected.length != region.size() || weights.length != region.size()) {
            throw new IllegalArgumentException("Selection of " + selected.length + " entries and "
                    + weights.length + " weights do not fit a region of " + region.size() + " pixels");
        }
        double sumX = 0;
        double sumY = 0;
        double sumW = 0;
        int count = 0;
        for (int i = 0; i < selected.length; ++i) {
            if (selected[i]) {
                final double w = weights[i];
                sumX += region.getX(i) * w;
                sumY += region.getY(i) * w;
                sumW += w;
                ++count;
            }
        }
        if (count == 0 || !(sumW > 0)) {
            return Centroid.UNDEFINED;
        }
        return new Centroid(sumX / sumW, sumY / sumW, count);
    }
}
