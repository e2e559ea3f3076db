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

import org.apache.commons.io.FileUtils;
import org.bytedeco.javacv.FFmpegFrameRecorder;
import org.bytedeco.javacv.FrameRecorder;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.cripac.isee.videobatch.common.SinkOpenException;
import org.cripac.isee.videobatch.io.FrameSink;
import org.cripac.isee.videobatch.io.RgbFrame;
import org.cripac.isee.videobatch.io.VideoCodecOptions;

import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;

import static org.bytedeco.ffmpeg.global.avutil.AV_PIX_FMT_YUV420P;

/**
 * Encodes RGB frames into a video file with FFmpeg.
 * <p>
 * The frame size is only known once the first frame arrives, so the recorder is started then.
 * Every frame must have the size of the first one.
 */
public class FFmpegFrameSink implements FrameSink {

    private final File path;
    private final VideoCodecOptions options;
    private final Java2DFrameConverter converter = new Java2DFrameConverter();
    private FFmpegFrameRecorder recorder = null;
    private boolean closed = false;

    public FFmpegFrameSink(@Nonnull File path,
                           @Nonnull VideoCodecOptions options) throws SinkOpenException {
        this.path = path;
        this.options = options;
        try {
            FileUtils.forceMkdirParent(path);
        } catch (IOException e) {
            throw new SinkOpenException("Could not open: " + path, e);
        }
        if (path.isDirectory() || (path.exists() && !path.canWrite())) {
            throw new SinkOpenException("Could not open: " + path);
        }
    }

    private void startRecorder(int width, int height) throws SinkOpenException {
        FFmpegFrameRecorder started = new FFmpegFrameRecorder(path, width, height);
        started.setFormat(options.format);
        started.setVideoCodecName(options.codec);
        started.setVideoOption("preset", options.preset);
        started.setVideoOption("crf", String.valueOf(options.crf));
        started.setPixelFormat(AV_PIX_FMT_YUV420P);
        started.setFrameRate(options.frameRate);
        try {
            started.start();
        } catch (FrameRecorder.Exception e) {
            try {
                started.release();
            } catch (FrameRecorder.Exception releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw new SinkOpenException("Could not start encoding " + path + " with " + options, e);
        }
        recorder = started;
    }

    @Override
    public void writeFrame(@Nonnull RgbFrame frame) throws IOException {
        if (closed) {
            throw new IOException("Video " + path + " has already been closed");
        }
        if (recorder == null) {
            startRecorder(frame.getWidth(), frame.getHeight());
        } else if (frame.getWidth() != recorder.getImageWidth()
                || frame.getHeight() != recorder.getImageHeight()) {
            throw new IOException("Frame size changed to " + frame.getWidth() + "x" + frame.getHeight()
                    + " while writing " + path);
        }
        recorder.record(converter.convert(frame.toBufferedImage()));
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (recorder != null) {
            recorder.close();
        }
    }
}
