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

import org.cripac.isee.videobatch.common.ConfigurationException;
import org.cripac.isee.videobatch.io.MaskImageLoader;

import javax.annotation.Nonnull;
import java.io.File;

/**
 * How a region is described in a configuration, before any image is read.
 * The variant is chosen explicitly by whoever parses the configuration.
 */
public abstract class RegionSpec {

    private RegionSpec() {
    }

    @Nonnull
    public static RegionSpec rect(int x, int y, int w, int h) throws ConfigurationException {
        return new Rect(x, y, w, h);
    }

    @Nonnull
    public static RegionSpec mask(@Nonnull File path) {
        return new Mask(path);
    }

    /**
     * Materialize the region, reading the mask image if there is one.
     *
     * @throws ConfigurationException If the mask image cannot be read.
     */
    @Nonnull
    public abstract Region build(@Nonnull MaskImageLoader loader) throws ConfigurationException;

    /**
     * A rectangle given by offset and size.
     */
    public static final class Rect extends RegionSpec {
        public final int x;
        public final int y;
        public final int w;
        public final int h;

        private Rect(int x, int y, int w, int h) throws ConfigurationException {
            if (x < 0 || y < 0 || w < 0 || h < 0) {
                throw new ConfigurationException("Rectangle values must not be negative,"
                        + " got x=" + x + ", y=" + y + ", w=" + w + ", h=" + h);
            }
            this.x = x;
            this.y = y;
            this.w = w;
            this.h = h;
        }

        @Nonnull
        @Override
        public Region build(@Nonnull MaskImageLoader loader) {
            return new RectangularRegion(x, y, w, h);
        }

        @Override
        public String toString() {
            return "Rect(x=" + x + ",y=" + y + ",w=" + w + ",h=" + h + ")";
        }
    }

    /**
     * A free shape given by the white pixels of an image file.
     */
    public static final class Mask extends RegionSpec {
        public final File path;

        private Mask(@Nonnull File path) {
            this.path = path;
        }

        @Nonnull
        @Override
        public Region build(@Nonnull MaskImageLoader loader) throws ConfigurationException {
            return new MaskRegion(path, loader.readBinaryImage(path));
        }

        @Override
        public String toString() {
            return "Mask('" + path + "')";
        }
    }
}
