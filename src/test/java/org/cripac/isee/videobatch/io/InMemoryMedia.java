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

package org.cripac.isee.videobatch.io;

import org.cripac.isee.videobatch.common.SinkOpenException;
import org.cripac.isee.videobatch.common.StreamException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Media kept in memory: videos to decode are registered up front, and everything written is
 * recorded for inspection. Failures can be injected per path.
 */
public class InMemoryMedia implements FrameSourceFactory, SinkFactory {

    private final Map<File, List<RgbFrame>> videos = new HashMap<>();
    private final Map<File, Integer> brokenAt = new HashMap<>();
    private final Set<File> unopenable = new HashSet<>();
    private final Set<File> unstartable = new HashSet<>();

    private final Map<File, List<String>> results = new LinkedHashMap<>();
    private final Map<File, List<RgbFrame>> videoOutputs = new LinkedHashMap<>();

    private int sourcesOpened = 0;
    private int sourcesClosed = 0;
    private int sinksOpened = 0;
    private int sinksClosed = 0;

    public InMemoryMedia addVideo(@Nonnull File path, @Nonnull List<RgbFrame> frames) {
        videos.put(path.getAbsoluteFile(), frames);
        return this;
    }

    /**
     * Make decoding of <code>path</code> fail when frame <code>index</code> is reached.
     */
    public InMemoryMedia breakVideoAt(@Nonnull File path, int index) {
        brokenAt.put(path.getAbsoluteFile(), index);
        return this;
    }

    /**
     * Make opening an output at <code>path</code> fail.
     */
    public InMemoryMedia failToOpen(@Nonnull File path) {
        unopenable.add(path.getAbsoluteFile());
        return this;
    }

    /**
     * Make the video output at <code>path</code> open fine but fail to start on its first frame,
     * like an encoder rejecting the frame size.
     */
    public InMemoryMedia failToStart(@Nonnull File path) {
        unstartable.add(path.getAbsoluteFile());
        return this;
    }

    @Nullable
    public List<String> getResult(@Nonnull File path) {
        return results.get(path.getAbsoluteFile());
    }

    @Nonnull
    public Map<File, List<String>> getResults() {
        return Collections.unmodifiableMap(results);
    }

    @Nullable
    public List<RgbFrame> getVideoOutput(@Nonnull File path) {
        return videoOutputs.get(path.getAbsoluteFile());
    }

    public int getSourcesOpened() {
        return sourcesOpened;
    }

    public int getSourcesClosed() {
        return sourcesClosed;
    }

    public int getSinksOpened() {
        return sinksOpened;
    }

    public int getSinksClosed() {
        return sinksClosed;
    }

    @Nonnull
    @Override
    public FrameSource open(@Nonnull File video) throws StreamException {
        final File key = video.getAbsoluteFile();
        final List<RgbFrame> frames = videos.get(key);
        if (frames == null) {
            throw new StreamException("No such video: " + video);
        }
        final int breakIndex = brokenAt.getOrDefault(key, -1);
        ++sourcesOpened;
        return new FrameSource() {
            private int next = 0;
            private boolean closed = false;

            @Nullable
            @Override
            public RgbFrame nextFrame() throws StreamException {
                if (closed) {
                    throw new StreamException("Source already closed");
                }
                if (next == breakIndex) {
                    throw new StreamException("Corrupted frame " + next + " in " + video);
                }
                return next < frames.size() ? frames.get(next++) : null;
            }

            @Override
            public void close() {
                if (!closed) {
                    closed = true;
                    ++sourcesClosed;
                }
            }
        };
    }

    @Nonnull
    @Override
    public ResultSink openResult(@Nonnull File path) throws SinkOpenException {
        final File key = path.getAbsoluteFile();
        if (unopenable.contains(key)) {
            throw new SinkOpenException("Could not open: " + path);
        }
        final List<String> lines = new ArrayList<>();
        results.put(key, lines);
        ++sinksOpened;
        return new ResultSink() {
            private boolean closed = false;

            @Override
            public void writeLine(@Nonnull String line) throws IOException {
                if (closed) {
                    throw new IOException("Sink already closed: " + path);
                }
                lines.add(line);
            }

            @Override
            public void close() {
                if (!closed) {
                    closed = true;
                    ++sinksClosed;
                }
            }
        };
    }

    @Nonnull
    @Override
    public FrameSink openVideo(@Nonnull File path,
                               @Nonnull VideoCodecOptions options) throws SinkOpenException {
        final File key = path.getAbsoluteFile();
        if (unopenable.contains(key)) {
            throw new SinkOpenException("Could not open: " + path);
        }
        final List<RgbFrame> frames = new ArrayList<>();
        final boolean startFails = unstartable.contains(key);
        videoOutputs.put(key, frames);
        ++sinksOpened;
        return new FrameSink() {
            private boolean closed = false;

            @Override
            public void writeFrame(@Nonnull RgbFrame frame) throws IOException {
                if (closed) {
                    throw new IOException("Sink already closed: " + path);
                }
                if (startFails && frames.isEmpty()) {
                    throw new SinkOpenException("Could not start encoding " + path);
                }
                frames.add(frame.copy());
            }

            @Override
            public void close() {
                if (!closed) {
                    closed = true;
                    ++sinksClosed;
                }
            }
        };
    }
}
