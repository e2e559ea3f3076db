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

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Text formatting of the numbers written to result files.
 */
public final class ResultFormat {

    public static final String NAN = "nan";
    public static final int DECIMALS = 4;

    private ResultFormat() {
    }

    /**
     * Fixed notation with four decimals, ties rounded to even. NaN and infinities are written as
     * <code>nan</code>.
     */
    @Nonnull
    public static String decimal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return NAN;
        }
        return new BigDecimal(value).setScale(DECIMALS, RoundingMode.HALF_EVEN).toPlainString();
    }
}
