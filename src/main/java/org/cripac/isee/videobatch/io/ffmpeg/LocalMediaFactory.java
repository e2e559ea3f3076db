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

import org.cripac.isee.videobatch.common.SinkOpenException;
import org.cripac.isee.videobatch.common.StreamException;
import org.cripac.isee.videobatch.io.CsvResultSink;
import org.cripac.isee.videobatch.io.FrameSink;
import org.cripac.isee.videobatch.io.FrameSource;
import org.cripac.isee.videobatch.io.FrameSourceFactory;
import org.cripac.isee.videobatch.io.ResultSink;
import org.cripac.isee.videobatch.io.SinkFactory;
import org.cripac.isee.videobatch.io.VideoCodecOptions;

import javax.annotation.Nonnull;
import java.io.File;

/**
 * Videos are decoded and encoded with FFmpeg, results are written as files on the local disk.
 */
public class LocalMediaFactory implements FrameSourceFactory, SinkFactory {

    @Nonnull
    @Override
    public FrameSource open(@Nonnull File video) throws StreamException {
        return new FFmpegFrameSource(video);
    }

    @Nonnull
    @Override
    public ResultSink openResult(@Nonnull File path) throws SinkOpenException {
        return new CsvResultSink(path);
    }

    @Nonnull
    @Override
    public FrameSink openVideo(@Nonnull File path,
                               @Nonnull VideoCodecOptions options) throws SinkOpenException {
        return new FFmpegFrameSink(path, options);
    }
}
