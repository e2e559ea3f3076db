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
import javax.annotation.Nullable;
import java.io.File;

/**
 * Outcome of one {@link BatchJob}.
 */
public class JobReport {

    @Nonnull
    public final File video;
    /**
     * Frames passed to the command without error.
     */
    public final int framesProcessed;
    /**
     * Whether the command was started, so that it also got finished.
     */
    public final boolean started;
    /**
     * The first error that stopped the job, null on success.
     */
    @Nullable
    public final Exception failure;

    public JobReport(@Nonnull File video,
                     int framesProcessed,
                     boolean started,
                     @Nullable Exception failure) {
        this.video = video;
        this.framesProcessed = framesProcessed;
        this.started = started;
        this.failure = failure;
    }

    public boolean isSuccess() {
        return failure == null;
    }

    @Override
    public String toString() {
        return video.getName() + ": " + (isSuccess() ? "done" : "failed (" + failure + ")")
                + ", " + framesProcessed + " frames";
    }
}
