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

package org.cripac.isee.videobatch.batch;

import org.cripac.isee.videobatch.common.FinalizeException;
import org.cripac.isee.videobatch.common.StreamException;
import org.cripac.isee.videobatch.io.FrameSource;
import org.cripac.isee.videobatch.io.FrameSourceFactory;
import org.cripac.isee.videobatch.io.RgbFrame;
import org.cripac.isee.videobatch.util.logging.Logger;

import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;

/**
 * The BatchJob class drives a {@link BatchCommand} over the frames of one video.
 * <p>
 * The job goes IDLE, OPENED, STREAMING, CLOSED. The frame source is released on every path out
 * of {@link #run()}. If the command fails to start, it is not finished and no frame is read.
 * Otherwise it is finished exactly once, with the error flag set if the start, a frame or the
 * stream failed. A job runs only once.
 */
public class BatchJob {

    private final File video;
    private final String name;
    private final BatchCommand command;
    private final FrameSourceFactory sourceFactory;
    private final ProgressObserver progress;
    private final Logger logger;

    private JobState state = JobState.IDLE;
    private int frameIndex = 0;

    public BatchJob(@Nonnull File video,
                    @Nonnull BatchCommand command,
                    @Nonnull FrameSourceFactory sourceFactory,
                    @Nonnull ProgressObserver progress,
                    @Nonnull Logger logger) {
        this.video = video;
        this.name = video.getName();
        this.command = command;
        this.sourceFactory = sourceFactory;
        this.progress = progress;
        this.logger = logger;
    }

    @Nonnull
    public JobState getState() {
        return state;
    }

    /**
     * Process the whole video.
     *
     * @return What happened. Failures of this video are reported, not thrown.
     * @throws IllegalStateException If the job has already been run.
     */
    @Nonnull
    public JobReport run() {
        if (state != JobState.IDLE) {
            throw new IllegalStateException("Job on " + name + " has already been run");
        }

        final FrameSource source;
        try {
            source = sourceFactory.open(video);
        } catch (StreamException e) {
            state = JobState.CLOSED;
            return new JobReport(video, 0, false, e);
        }
        state = JobState.OPENED;

        Exception failure = null;
        boolean started = false;
        try {
            try {
                command.start(name);
                started = true;
            } catch (Exception e) {
                failure = e;
            }
            if (started) {
                failure = stream(source);
                failure = finish(failure);
            }
        } finally {
            release(source);
            state = JobState.CLOSED;
        }
        return new JobReport(video, frameIndex, started, failure);
    }

    private Exception stream(FrameSource source) {
        state = JobState.STREAMING;
        progress.onStart(name);
        try {
            RgbFrame frame;
            while ((frame = source.nextFrame()) != null) {
                command.update(frameIndex, frame);
                progress.onFrame(frameIndex);
                ++frameIndex;
                if (frameIndex % 1000 == 0) {
                    logger.debug("Processed " + frameIndex + " frames of " + name);
                }
            }
            if (frameIndex == 0) {
                logger.warn("No frame decoded from " + name);
            }
            return null;
        } catch (Exception e) {
            return e;
        }
    }

    private Exception finish(Exception failure) {
        final boolean error = failure != null;
        try {
            command.finish(name, error);
        } catch (Exception e) {
            if (failure == null) {
                failure = new FinalizeException("Could not finish " + name, e);
            } else {
                logger.error("Could not finish " + name + " after a previous error", e);
                failure.addSuppressed(e);
            }
        }
        progress.onFinish(name, frameIndex, failure != null);
        return failure;
    }

    private void release(FrameSource source) {
        try {
            source.close();
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not release the decoder of " + name, e);
        }
    }
}
