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

package org.cripac.isee.videobatch.common;

import java.io.IOException;

/**
 * Thrown when a result or video sink cannot be opened.
 */
public class SinkOpenException extends IOException {

    private static final long serialVersionUID = -3367310735611285960L;

    public SinkOpenException(String s) {
        super(s);
    }

    public SinkOpenException(String s, Throwable t) {
        super(s, t);
    }
}
