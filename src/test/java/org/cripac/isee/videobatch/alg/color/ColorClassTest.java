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

import org.cripac.isee.videobatch.common.ConfigurationException;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ColorClassTest {

    @Test
    public void intervalIsHalfOpen() throws ConfigurationException {
        ColorClass red = new ColorClass("red", 0, 30);
        assertTrue(red.contains(0));
        assertTrue(red.contains(29));
        assertFalse(red.contains(30));
        assertFalse(red.contains(359));
    }

    @Test
    public void achromaticNeverMatches() throws ConfigurationException {
        ColorClass wide = new ColorClass("any", -10, 360);
        assertFalse(wide.contains(ColorSpaceTable.NO_HUE));
        assertTrue(wide.contains(0));
    }

    @Test
    public void matchIsAligned() throws ConfigurationException {
        ColorClass green = new ColorClass("green", 90, 150);
        assertArrayEquals(new boolean[]{false, true, false, true},
                green.match(new int[]{ColorSpaceTable.NO_HUE, 120, 240, 90}));
    }

    @Test(expected = ConfigurationException.class)
    public void emptyIntervalIsRejected() throws ConfigurationException {
        new ColorClass("none", 30, 30);
    }

    @Test(expected = ConfigurationException.class)
    public void wrappingIntervalIsRejected() throws ConfigurationException {
        new ColorClass("red", 340, 20);
    }

    @Test
    public void displayColorFollowsIntervalCenter() throws ConfigurationException {
        final int green = new ColorClass("green", 100, 140).getDisplayColor();
        assertEquals(0xFF, (green >> 8) & 0xFF);
        assertEquals(0x00, green & 0xFF);
        assertTrue(((green >> 16) & 0xFF) < 0x10);

        assertEquals(HsvColormap.forHue(0), new ColorClass("red", -5, 5).getDisplayColor());
    }

    @Test
    public void colormapEndsAndClamping() {
        assertEquals(0xFF0000, HsvColormap.sample(0));
        assertEquals(HsvColormap.sample(0), HsvColormap.sample(-1));
        assertEquals(HsvColormap.sample(1), HsvColormap.sample(2));
        assertEquals(0xFF, (HsvColormap.sample(1) >> 16) & 0xFF);
    }
}
