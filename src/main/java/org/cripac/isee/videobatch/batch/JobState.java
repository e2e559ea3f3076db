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

/**
 * States of a {@link BatchJob}.
 */
public enum JobState {
    /**
     * Created, nothing opened yet.
     */
    IDLE,
    /**
     * The frame source is open and the command is starting.
     */
    OPENED,
    /**
     * Frames are being pulled and processed.
     */
    STREAMING,
    /**
     * Everything released. Final.
     */
    CLOSED
}
