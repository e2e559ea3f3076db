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

import org.cripac.isee.videobatch.common.StreamException;

import javax.annotation.Nullable;
import java.io.Closeable;
import java.io.IOException;

/**
 * An opened video, yielding its decoded frames in order. The sequence is finite and
 * cannot be restarted.
 */
public interface FrameSource extends Closeable {

    /**
     * Decode the next frame.
     *
     * @return The next frame, or null at the end of the stream.
     * @throws StreamException On decoding failure.
     */
    @Nullable
    RgbFrame nextFrame() throws StreamException;

    /**
     * Release the decoder. Calling it more than once has no further effect.
     */
    @Override
    void close() throws IOException;
}
