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

/**
 * Thrown on invalid or missing required configuration: no source files, no color classes,
 * no regions, an unreadable mask image... Nothing of the affected scope has been processed
 * when it is thrown.
 */
public class ConfigurationException extends Exception {

    private static final long serialVersionUID = 2806393135578446721L;

    public ConfigurationException(String s) {
        super(s);
    }

    public ConfigurationException(String s, Throwable t) {
        super(s, t);
    }
}
