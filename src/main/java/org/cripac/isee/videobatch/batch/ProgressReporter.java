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

import javax.annotation.Nonnull;
import java.io.PrintStream;

/**
 * Prints the progress of each file on one line: a dot every <code>procByCount</code> frames and
 * a space every <code>sepByCount</code> frames, e.g. <code>processing: a.mp4..... ..... done (1024).</code>
 */
public class ProgressReporter implements ProgressObserver {

    public static final int DEFAULT_PROC_BY_COUNT = 100;
    public static final int DEFAULT_SEP_BY_COUNT = 1000;

    private final PrintStream out;
    private final int procByCount;
    private final int sepByCount;

    public ProgressReporter(@Nonnull PrintStream out) {
        this(out, DEFAULT_PROC_BY_COUNT, DEFAULT_SEP_BY_COUNT);
    }

    public ProgressReporter(@Nonnull PrintStream out, int procByCount, int sepByCount) {
        if (procByCount <= 0 || sepByCount <= 0) {
            throw new IllegalArgumentException("Progress intervals must be positive, got "
                    + procByCount + " and " + sepByCount);
        }
        this.out = out;
        this.procByCount = procByCount;
        this.sepByCount = sepByCount;
    }

    @Override
    public void onStart(@Nonnull String name) {
        out.print("processing: " + name);
        out.flush();
    }

    @Override
    public void onFrame(int index) {
        if (index > 0 && index % sepByCount == 0) {
            out.print(' ');
        }
        if ((index + 1) % procByCount == 0) {
            out.print('.');
            out.flush();
        }
    }

    @Override
    public void onFinish(@Nonnull String name, int numFrames, boolean error) {
        out.println(error ? " aborted (" + numFrames + ")." : "done (" + numFrames + ").");
        out.flush();
    }
}
