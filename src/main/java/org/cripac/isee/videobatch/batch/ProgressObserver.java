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

/**
 * Watches the frame loop of a {@link BatchJob}.
 */
public interface ProgressObserver {

    ProgressObserver NONE = new ProgressObserver() {
        @Override
        public void onStart(@Nonnull String name) {
        }

        @Override
        public void onFrame(int index) {
        }

        @Override
        public void onFinish(@Nonnull String name, int numFrames, boolean error) {
        }
    };

    /**
     * Called after the command has started, before the first frame.
     */
    void onStart(@Nonnull String name);

    /**
     * Called after a frame has been processed.
     */
    void onFrame(int index);

    /**
     * Called after the command has been finished.
     */
    void onFinish(@Nonnull String name, int numFrames, boolean error);
}
