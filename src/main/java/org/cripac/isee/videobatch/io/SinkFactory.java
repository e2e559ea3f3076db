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

import javax.annotation.Nonnull;
import java.io.File;

/**
 * Opens the outputs of a batch command. Parent directories are created as needed.
 */
public interface SinkFactory {

    @Nonnull
    ResultSink openResult(@Nonnull File path) throws SinkOpenException;

    @Nonnull
    FrameSink openVideo(@Nonnull File path,
                        @Nonnull VideoCodecOptions options) throws SinkOpenException;
}
