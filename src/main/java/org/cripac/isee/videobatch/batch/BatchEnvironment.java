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

import org.cripac.isee.videobatch.alg.color.ColorSpaceTable;
import org.cripac.isee.videobatch.io.FrameSourceFactory;
import org.cripac.isee.videobatch.io.ImageIOMaskLoader;
import org.cripac.isee.videobatch.io.MaskImageLoader;
import org.cripac.isee.videobatch.io.SinkFactory;
import org.cripac.isee.videobatch.io.ffmpeg.LocalMediaFactory;
import org.cripac.isee.videobatch.util.Factory;
import org.cripac.isee.videobatch.util.LazyReference;
import org.cripac.isee.videobatch.util.logging.Logger;

import javax.annotation.Nonnull;

/**
 * What commands of one process share: the logger, the collaborators that read and write media,
 * and the color space table, which is built when a command first asks for it.
 */
public class BatchEnvironment {

    private final Logger logger;
    private final FrameSourceFactory sourceFactory;
    private final SinkFactory sinkFactory;
    private final MaskImageLoader maskLoader;
    private final LazyReference<ColorSpaceTable> colorSpaceTable;

    public BatchEnvironment(@Nonnull Logger logger,
                            @Nonnull FrameSourceFactory sourceFactory,
                            @Nonnull SinkFactory sinkFactory,
                            @Nonnull MaskImageLoader maskLoader) {
        this(logger, sourceFactory, sinkFactory, maskLoader, ColorSpaceTable::build);
    }

    /**
     * @param tableFactory Produces the color space table on first use.
     */
    public BatchEnvironment(@Nonnull Logger logger,
                            @Nonnull FrameSourceFactory sourceFactory,
                            @Nonnull SinkFactory sinkFactory,
                            @Nonnull MaskImageLoader maskLoader,
                            @Nonnull Factory<ColorSpaceTable> tableFactory) {
        this.logger = logger;
        this.sourceFactory = sourceFactory;
        this.sinkFactory = sinkFactory;
        this.maskLoader = maskLoader;
        this.colorSpaceTable = new LazyReference<>(() -> {
            logger.info("Initializing the hue/luma tables...");
            final long start = System.currentTimeMillis();
            ColorSpaceTable table = tableFactory.produce();
            logger.debug("Hue/luma tables built in " + (System.currentTimeMillis() - start) + "ms");
            return table;
        });
    }

    /**
     * Environment reading and writing videos with FFmpeg and files on the local disk.
     */
    @Nonnull
    public static BatchEnvironment local(@Nonnull Logger logger) {
        LocalMediaFactory media = new LocalMediaFactory();
        return new BatchEnvironment(logger, media, media, new ImageIOMaskLoader());
    }

    @Nonnull
    public Logger getLogger() {
        return logger;
    }

    @Nonnull
    public FrameSourceFactory getSourceFactory() {
        return sourceFactory;
    }

    @Nonnull
    public SinkFactory getSinkFactory() {
        return sinkFactory;
    }

    @Nonnull
    public MaskImageLoader getMaskLoader() {
        return maskLoader;
    }

    /**
     * @return The table shared by every command of this environment, built on the first call.
     */
    @Nonnull
    public ColorSpaceTable getColorSpaceTable() throws Exception {
        return colorSpaceTable.get();
    }

    public boolean isColorSpaceTableBuilt() {
        return colorSpaceTable.isInitialized();
    }
}
