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

package org.cripac.isee.videobatch.io.ffmpeg;

import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.cripac.isee.videobatch.common.StreamException;
import org.cripac.isee.videobatch.io.FrameSource;
import org.cripac.isee.videobatch.io.RgbFrame;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

import static org.bytedeco.ffmpeg.global.avutil.AV_LOG_QUIET;
import static org.bytedeco.ffmpeg.global.avutil.AV_PIX_FMT_BGR24;
import static org.bytedeco.ffmpeg.global.avutil.av_log_set_level;

/**
 * Decodes a video file with FFmpeg into RGB frames.
 */
public class FFmpegFrameSource implements FrameSource {

    private final File video;
    private final FFmpegFrameGrabber frameGrabber;
    private final Java2DFrameConverter converter = new Java2DFrameConverter();
    private boolean closed = false;

    public FFmpegFrameSource(@Nonnull File video) throws StreamException {
        this.video = video;
        if (!video.isFile()) {
            throw new StreamException("Video does not exist: " + video);
        }
        av_log_set_level(AV_LOG_QUIET);
        frameGrabber = new FFmpegFrameGrabber(video);
        frameGrabber.setPixelFormat(AV_PIX_FMT_BGR24);
        try {
            frameGrabber.start();
        } catch (FrameGrabber.Exception e) {
            try {
                frameGrabber.release();
            } catch (FrameGrabber.Exception releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw new StreamException("Could not open video decoder for " + video, e);
        }
    }

    @Nullable
    @Override
    public RgbFrame nextFrame() throws StreamException {
        if (closed) {
            throw new StreamException("Decoder of " + video + " has already been closed");
        }
        final Frame frame;
        try {
            frame = frameGrabber.grabImage();
        } catch (FrameGrabber.Exception e) {
            throw new StreamException("Decoding failed in " + video, e);
        }
        if (frame == null) {
            return null;
        }
        final BufferedImage image = converter.getBufferedImage(frame);
        if (image == null) {
            throw new StreamException("Malformed frame in " + video);
        }
        return RgbFrame.fromBufferedImage(image);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        frameGrabber.close();
    }
}
