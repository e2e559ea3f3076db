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
import org.cripac.isee.videobatch.io.InMemoryMedia;
import org.cripac.isee.videobatch.io.RgbFrame;
import org.cripac.isee.videobatch.util.logging.ConsoleLogger;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.junit.Assert.assertEquals;

public class ProgressReporterTest {

    private static String report(int numFrames, int procBy, int sepBy) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, "UTF-8");
        File video = new File("frames.mp4");
        InMemoryMedia media = new InMemoryMedia()
                .addVideo(video, Collections.nCopies(numFrames, new RgbFrame(1, 1)));
        new BatchJob(video, new RecordingCommand(), media, new ProgressReporter(out, procBy, sepBy),
                new ConsoleLogger(Level.INFO)).run();
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void dotsAndSeparators() throws Exception {
        assertEquals("processing: frames.mp4..... ..... ..done (25)." + System.lineSeparator(),
                report(25, 2, 10));
    }

    @Test
    public void defaultIntervals() throws Exception {
        assertEquals("processing: frames.mp4..done (250)." + System.lineSeparator(),
                report(250, ProgressReporter.DEFAULT_PROC_BY_COUNT, ProgressReporter.DEFAULT_SEP_BY_COUNT));
    }

    @Test(expected = IllegalArgumentException.class)
    public void intervalsMustBePositive() {
        new ProgressReporter(System.err, 0, 1000);
    }
}
