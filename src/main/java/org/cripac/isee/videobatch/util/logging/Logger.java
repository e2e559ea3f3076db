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

package org.cripac.isee.videobatch.util.logging;

import org.apache.log4j.Level;

import javax.annotation.Nonnull;
import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Base of the loggers used across the batch tool. Subclasses decide where messages go;
 * the level check is shared through {@link #isEnabled(Level)}.
 */
public abstract class Logger {

    protected Level level;

    protected String localName;

    public Logger(@Nonnull Level level) {
        setLevel(level);

        try {
            localName = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            localName = "Unknown Host";
        }
    }

    public void setLevel(@Nonnull Level level) {
        this.level = level;
    }

    @Nonnull
    public Level getLevel() {
        return level;
    }

    protected boolean isEnabled(@Nonnull Level msgLevel) {
        return msgLevel.isGreaterOrEqual(level);
    }

    public abstract void debug(@Nonnull Object message);

    public abstract void debug(@Nonnull Object message,
                               @Nonnull Throwable t);

    public abstract void info(@Nonnull Object message);

    public abstract void info(@Nonnull Object message,
                              @Nonnull Throwable t);

    public abstract void warn(@Nonnull Object message);

    public abstract void warn(@Nonnull Object message,
                              @Nonnull Throwable t);

    public abstract void error(@Nonnull Object message);

    public abstract void error(@Nonnull Object message,
                               @Nonnull Throwable t);

    public abstract void fatal(@Nonnull Object message);

    public abstract void fatal(@Nonnull Object message,
                               @Nonnull Throwable t);
}
