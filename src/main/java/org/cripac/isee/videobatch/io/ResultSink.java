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

import javax.annotation.Nonnull;
import java.io.Closeable;
import java.io.IOException;

/**
 * A line-oriented text output, e.g. one CSV file.
 */
public interface ResultSink extends Closeable {

    /**
     * Append one line. The line terminator is added by the sink.
     */
    void writeLine(@Nonnull String line) throws IOException;
}
