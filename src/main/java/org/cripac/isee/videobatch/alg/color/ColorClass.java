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

import javax.annotation.Nonnull;

/**
 * A named hue interval [onset, offset) defining "this color" for tracking.
 * Achromatic pixels belong to no class. Intervals do not wrap around 0/360 degrees.
 */
public class ColorClass {

    private final String name;
    private final double onset;
    private final double offset;
    private int displayColor = -1;

    /**
     * @throws ConfigurationException If <code>onset &gt;= offset</code>.
     */
    public ColorClass(@Nonnull String name, double onset, double offset) throws ConfigurationException {
        if (!(onset < offset)) {
            throw new ConfigurationException("Color '" + name + "' must have its onset below its offset,"
                    + " got [" + onset + ", " + offset + ")");
        }
        this.name = name;
        this.onset = onset;
        this.offset = offset;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public double getOnset() {
        return onset;
    }

    public double getOffset() {
        return offset;
    }

    public boolean contains(int hue) {
        return hue != ColorSpaceTable.NO_HUE && onset <= hue && hue < offset;
    }

    /**
     * Evaluate membership over a run of hues.
     */
    @Nonnull
    public boolean[] match(@Nonnull int[] hues) {
        final boolean[] matched = new boolean[hues.length];
        for (int i = 0; i < hues.length; ++i) {
            matched[i] = contains(hues[i]);
        }
        return matched;
    }

    /**
     * @return The color used to paint matched pixels, taken from {@link HsvColormap} at the middle
     * of the interval, packed as <code>0xRRGGBB</code>.
     */
    public int getDisplayColor() {
        if (displayColor < 0) {
            displayColor = HsvColormap.sample((onset + offset) / 720);
        }
        return displayColor;
    }

    @Override
    public String toString() {
        return "ColorClass(" + name + ": " + onset + ", " + offset + ")";
    }
}
