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

import org.cripac.isee.videobatch.alg.pixylation.CentroidEstimator.Centroid;
import org.cripac.isee.videobatch.alg.region.RectangularRegion;
import org.junit.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CentroidEstimatorTest {

    @Test
    public void uniformWeightsGiveGeometricCenter() {
        RectangularRegion region = new RectangularRegion(4, 2, 6, 4);
        boolean[] all = new boolean[region.size()];
        double[] weights = new double[region.size()];
        Arrays.fill(all, true);
        Arrays.fill(weights, 0.3);

        Centroid centroid = CentroidEstimator.estimate(region, all, weights);
        assertTrue(centroid.isDefined());
        assertEquals(24, centroid.count);
        assertEquals(6.5, centroid.x, 1e-9);
        assertEquals(3.5, centroid.y, 1e-9);
    }

    @Test
    public void brighterPixelsPullTheCentroid() {
        RectangularRegion region = new RectangularRegion(0, 0, 5, 1);
        boolean[] selected = {true, false, false, false, true};
        double[] weights = {0.25, 1, 1, 1, 0.75};

        Centroid centroid = CentroidEstimator.estimate(region, selected, weights);
        assertEquals(3.0, centroid.x, 1e-9);
        assertEquals(0.0, centroid.y, 1e-9);
        assertEquals(2, centroid.count);
    }

    @Test
    public void nothingSelected() {
        RectangularRegion region = new RectangularRegion(0, 0, 3, 3);
        Centroid centroid = CentroidEstimator.estimate(region, new boolean[9], new double[9]);
        assertFalse(centroid.isDefined());
        assertTrue(Double.isNaN(centroid.x));
        assertTrue(Double.isNaN(centroid.y));
    }

    @Test
    public void scalingWeightsKeepsCentroid() {
        final Random random = new Random(2017);
        RectangularRegion region = new RectangularRegion(3, 1, 7, 5);
        for (int round = 0; round < 100; ++round) {
            boolean[] selected = new boolean[region.size()];
            double[] weights = new double[region.size()];
            double[] scaled = new double[region.size()];
            final double factor = 0.01 + random.nextDouble() * 100;
            selected[random.nextInt(selected.length)] = true;
            for (int i = 0; i < selected.length; ++i) {
                selected[i] |= random.nextBoolean();
                weights[i] = 0.001 + random.nextDouble();
                scaled[i] = weights[i] * factor;
            }
            Centroid expected = CentroidEstimator.estimate(region, selected, weights);
            Centroid actual = CentroidEstimator.estimate(region, selected, scaled);
            assertEquals(expected.x, actual.x, 1e-9);
            assertEquals(expected.y, actual.y, 1e-9);
        }
    }

    @Test
    public void resultFormatting() {
        assertEquals("7.5000", ResultFormat.decimal(7.5));
        assertEquals("0.1235", ResultFormat.decimal(0.12345678));
        assertEquals("12.0000", ResultFormat.decimal(12));
        assertEquals("nan", ResultFormat.decimal(Double.NaN));
    }

    @Test(expected = IllegalArgumentException.class)
    public void misalignedSelection() {
        CentroidEstimator.estimate(new RectangularRegion(0, 0, 2, 2), new boolean[3], new double[4]);
    }
}
