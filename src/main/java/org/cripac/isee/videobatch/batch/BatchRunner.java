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

import org.cripac.isee.videobatch.io.FrameSourceFactory;
import org.cripac.isee.videobatch.util.logging.Logger;

import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one {@link BatchJob} per source video, one after another.
 * A failed video is logged and the batch goes on with the next one.
 */
public class BatchRunner {

    private final SourceExpander sources;
    private final BatchCommand command;
    private final FrameSourceFactory sourceFactory;
    private final ProgressObserver progress;
    private final Logger logger;

    public BatchRunner(@Nonnull SourceExpander sources,
                       @Nonnull BatchCommand command,
                       @Nonnull FrameSourceFactory sourceFactory,
                       @Nonnull ProgressObserver progress,
                       @Nonnull Logger logger) {
        this.sources = sources;
        this.command = command;
        this.sourceFactory = sourceFactory;
        this.progress = progress;
        this.logger = logger;
    }

    /**
     * @return A report for each video, in processing order.
     * @throws IOException If the source patterns cannot be expanded.
     */
    @Nonnull
    public List<JobReport> run() throws IOException {
        final List<File> videos = sources.expand();
        if (videos.isEmpty()) {
            logger.warn("No source video matched");
        }

        final List<JobReport> reports = new ArrayList<>(videos.size());
        for (File video : videos) {
            logger.debug("Starting " + video);
            JobReport report = new BatchJob(video, command, sourceFactory, progress, logger).run();
            if (report.isSuccess()) {
                logger.info(report);
            } else {
                //noinspection ConstantConditions
                logger.error("*** " + video.getName() + " failed after " + report.framesProcessed
                        + " frames", report.failure);
            }
            reports.add(report);
        }
        return reports;
    }
}
