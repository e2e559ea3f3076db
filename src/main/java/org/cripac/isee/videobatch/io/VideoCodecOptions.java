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

import javax.annotation.Nonnull;

/**
 * Encoding settings of an output video.
 */
public class VideoCodecOptions {

    /**
     * H.264 in an MP4 container, "slow" preset, constant rate factor 26.
     */
    public static final VideoCodecOptions H264 = new VideoCodecOptions("libx264", "mp4", "slow", 26, 25.0);

    public final String codec;
    public final String format;
    public final String preset;
    public final int crf;
    public final double frameRate;

    public VideoCodecOptions(@Nonnull String codec,
                             @Nonnull String format,
                             @Nonnull String preset,
                             int crf,
                             double frameRate) {
        this.codec = codec;
        this.format = format;
        this.preset = preset;
        this.crf = crf;
        this.frameRate = frameRate;
    }

    @Override
    public String toString() {
        return codec + "/" + format + " (preset=" + preset + ", crf=" + crf + ", fps=" + frameRate + ")";
    }
}
