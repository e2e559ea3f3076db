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

import org.junit.Test;

import java.awt.image.BufferedImage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class RgbFrameTest {

    @Test
    public void pixelsArePackedRgb() {
        RgbFrame frame = new RgbFrame(3, 2);
        frame.setRgb(2, 1, 0x102030);
        assertEquals(0x102030, frame.getRgb(2, 1));
        assertEquals(0x10 + 0x20 + 0x30, frame.channelSum(2, 1));
        assertEquals(0, frame.getRgb(0, 0));

        byte[] data = frame.getData();
        int offset = (1 * 3 + 2) * RgbFrame.CHANNELS;
        assertEquals(0x10, data[offset]);
        assertEquals(0x20, data[offset + 1]);
        assertEquals(0x30, data[offset + 2]);
    }

    @Test
    public void bounds() {
        RgbFrame frame = RgbFrame.filled(4, 3, 0xFFFFFF);
        assertTrue(frame.contains(3, 2));
        assertFalse(frame.contains(4, 0));
        assertFalse(frame.contains(0, -1));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void readingOutsideFails() {
        new RgbFrame(4, 3).getRgb(0, 3);
    }

    @Test
    public void convertsFromAndToImages() {
        BufferedImage bgr = new BufferedImage(2, 2, BufferedImage.TYPE_3BYTE_BGR);
        bgr.setRGB(1, 0, 0xAA5511);
        BufferedImage argb = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);
        argb.setRGB(1, 0, 0xFFAA5511);

        RgbFrame fromBgr = RgbFrame.fromBufferedImage(bgr);
        RgbFrame fromArgb = RgbFrame.fromBufferedImage(argb);
        assertEquals(0xAA5511, fromBgr.getRgb(1, 0));
        assertEquals(fromBgr, fromArgb);
        assertEquals(0xAA5511, fromBgr.toBufferedImage().getRGB(1, 0) & 0xFFFFFF);
    }

    @Test
    public void copiesAreIndependent() {
        RgbFrame frame = RgbFrame.filled(2, 2, 0x010203);
        RgbFrame copy = frame.copy();
        assertEquals(frame, copy);
        assertEquals(frame.hashCode(), copy.hashCode());
        copy.setRgb(0, 0, 0);
        assertNotEquals(frame, copy);
    }
}
