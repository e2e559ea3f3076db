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
 * Hues and luminances of a run of pixels, aligned index by index.
 */
public class HueLuminance {

    public final int[] hues;
    public final double[] luminances;

    public HueLuminance(@Nonnull int[] hues, @Nonnull double[] luminances) {
        if (hues.length != luminances.length) {
            throw new IllegalArgumentException("Got " + hues.length + " hues but "
                    + luminances.length + " luminances");
        }
        this.hues = hues;
        this.luminances = luminances;
    }

    public int size() {
        return hues.length;
    }
}
