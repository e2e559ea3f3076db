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

package org.cripac.isee.videobatch.io;

import org.cripac.isee.videobatch.common.ConfigurationException;

import javax.annotation.Nonnull;
import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.File;
import java.io.IOException;

/**
 * Loads mask images with {@link ImageIO}. A pixel is "on" when any of its color bands is non-zero;
 * the alpha band, if present, is ignored. Palette images are judged by the colors of their entries.
 */
public class ImageIOMaskLoader implements MaskImageLoader {

    @Nonnull
    @Override
    public boolean[][] readBinaryImage(@Nonnull File path) throws ConfigurationException {
        if (!path.isFile()) {
            throw new ConfigurationException("Mask image does not exist: " + path);
        }
        final BufferedImage image;
        try {
            image = ImageIO.read(path);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read mask image: " + path, e);
        }
        if (image == null) {
            throw new ConfigurationException("Not a readable image: " + path);
        }

        final boolean[][] mask = new boolean[image.getHeight()][image.getWidth()];
        if (image.getColorModel() instanceof IndexColorModel) {
            // Palette samples are indices, so compare the colors they stand for.
            for (int y = 0; y < image.getHeight(); ++y) {
                for (int x = 0; x < image.getWidth(); ++x) {
                    mask[y][x] = (image.getRGB(x, y) & 0xFFFFFF) != 0;
                }
            }
            return mask;
        }

        final Raster raster = image.getRaster();
        final int bands = Math.min(raster.getNumBands(), image.getColorModel().getNumColorComponents());
        for (int y = 0; y < image.getHeight(); ++y) {
            for (int x = 0; x < image.getWidth(); ++x) {
                for (int b = 0; b < bands; ++b) {
                    if (raster.getSample(x, y, b) != 0) {
                        mask[y][x] = true;
                        break;
                    }
                }
            }
        }
        return mask;
    }
}
