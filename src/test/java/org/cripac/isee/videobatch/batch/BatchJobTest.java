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

import org.apache.log4j.Level;
import org.cripac.isee.videobatch.common.ConfigurationException;
import org.cripac.isee.videobatch.common.FinalizeException;
import org.cripac.isee.videobatch.common.StreamException;
import org.cripac.isee.videobatch.io.InMemoryMedia;
import org.cripac.isee.videobatch.io.RgbFrame;
import org.cripac.isee.videobatch.util.logging.ConsoleLogger;
import org.cripac.isee.videobatch.util.logging.Logger;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class BatchJobTest {

    private final Logger logger = new ConsoleLogger(Level.DEBUG);
    private final File video = new File("movie.mp4");
    private InMemoryMedia media;
    private RecordingCommand command;

    @Before
    public void setUp() {
        media = new InMemoryMedia();
        List<RgbFrame> frames = new ArrayList<>();
        for (int i = 0; i < 3; ++i) {
            frames.add(RgbFrame.filled(2, 2, i));
        }
        media.addVideo(video, frames);
        command = new RecordingCommand();
    }

    private BatchJob job() {
        return new BatchJob(video, command, media, ProgressObserver.NONE, logger);
    }

    @Test
    public void fullLifecycle() {
        BatchJob job = job();
        assertEquals(JobState.IDLE, job.getState());
        JobReport report = job.run();

        assertTrue(report.isSuccess());
        assertNull(report.failure);
        assertEquals(3, report.framesProcessed);
        assertEquals(JobState.CLOSED, job.getState());
        assertEquals(Arrays.asList("start movie.mp4", "update 0", "update 1", "update 2",
                "finish movie.mp4 false"), command.calls);
        assertEquals(1, media.getSourcesClosed());
    }

    @Test(expected = IllegalStateException.class)
    public void runsOnlyOnce() {
        BatchJob job = job();
        job.run();
        job.run();
    }

    @Test
    public void failedStartSkipsFramesAndFinish() {
        ConfigurationException cause = new ConfigurationException("nothing to track");
        command.failOnStart = cause;
        JobReport report = job().run();

        assertFalse(report.isSuccess());
        assertFalse(report.started);
        assertSame(cause, report.failure);
        assertEquals(Collections.singletonList("start movie.mp4"), command.calls);
        assertEquals(1, media.getSourcesClosed());
    }

    @Test
    public void failedFrameStillFinishesWithError() {
        command.failOnFrame = 1;
        JobReport report = job().run();

        assertFalse(report.isSuccess());
        assertTrue(report.failure instanceof IllegalStateException);
        assertEquals(1, report.framesProcessed);
        assertEquals(Arrays.asList("start movie.mp4", "update 0", "update 1",
                "finish movie.mp4 true"), command.calls);
        assertEquals(1, media.getSourcesClosed());
    }

    @Test
    public void brokenStreamFinishesWithError() {
        media.breakVideoAt(video, 2);
        JobReport report = job().run();

        assertTrue(report.failure instanceof StreamException);
        assertEquals(2, report.framesProcessed);
        assertEquals("finish movie.mp4 true", command.calls.get(command.calls.size() - 1));
        assertEquals(1, media.getSourcesClosed());
    }

    @Test
    public void failedFinishFailsTheJob() {
        command.failOnFinish = new IOException("disk full");
        JobReport report = job().run();

        assertFalse(report.isSuccess());
        assertTrue(report.failure instanceof FinalizeException);
        assertSame(command.failOnFinish, report.failure.getCause());
        assertEquals(3, report.framesProcessed);
        assertEquals(1, media.getSourcesClosed());
    }

    @Test
    public void failedFinishAfterErrorKeepsFirstError() {
        command.failOnFrame = 0;
        command.failOnFinish = new IOException("disk full");
        JobReport report = job().run();

        assertTrue(report.failure instanceof IllegalStateException);
        assertSame(command.failOnFinish, report.failure.getSuppressed()[0]);
        assertEquals(1, media.getSourcesClosed());
    }

    @Test
    public void unopenableSourceIsReported() {
        JobReport report = new BatchJob(new File("absent.mp4"), command, media,
                ProgressObserver.NONE, logger).run();

        assertTrue(report.failure instanceof StreamException);
        assertFalse(report.started);
        assertTrue(command.calls.isEmpty());
        assertEquals(0, media.getSourcesOpened());
    }

    @Test
    public void emptyVideoSucceeds() {
        media.addVideo(video, new ArrayList<>());
        JobReport report = job().run();

        assertTrue(report.isSuccess());
        assertEquals(0, report.framesProcessed);
        assertEquals(Arrays.asList("start movie.mp4", "finish movie.mp4 false"), command.calls);
    }
}
