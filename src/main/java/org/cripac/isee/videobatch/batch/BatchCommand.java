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

import org.cripac.isee.videobatch.io.RgbFrame;

import javax.annotation.Nonnull;

/**
 * The per-file lifecycle of a frame-by-frame batch command. For every source video,
 * {@link BatchJob} calls {@link #start(String)} once, {@link #update(int, RgbFrame)} for each
 * frame in order, and {@link #finish(String, boolean)} once if the start succeeded.
 */
public interface BatchCommand {

    /**
     * Prepare the outputs of one video. Nothing has been decoded yet.
     *
     * @param name File name of the video, without directory.
     * @throws Exception When the video cannot be processed at all. The command must release
     *                   whatever it opened before throwing, as {@link #finish} will not be called.
     */
    void start(@Nonnull String name) throws Exception;

    /**
     * Process one frame.
     *
     * @param index 0-based index of the frame, strictly increasing.
     */
    void update(int index, @Nonnull RgbFrame frame) throws Exception;

    /**
     * Close the outputs of the video.
     *
     * @param error Whether processing stopped because of an error.
     */
    void finish(@Nonnull String name, boolean error) throws Exception;
}
