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
import java.io.PrintStream;

/**
 * A simple logger for output logs to the console only.
 * DEBUG and INFO go to the standard output, the rest to the standard error.
 */
public class ConsoleLogger extends Logger {

    private final PrintStream out;
    private final PrintStream err;

    public ConsoleLogger() {
        this(Level.INFO);
    }

    public ConsoleLogger(@Nonnull Level level) {
        this(level, System.out, System.err);
    }

    public ConsoleLogger(@Nonnull Level level,
                         @Nonnull PrintStream out,
                         @Nonnull PrintStream err) {
        super(level);
        this.out = out;
        this.err = err;
    }

    private void print(PrintStream stream, Level msgLevel, Object msg, Throwable t) {
        if (!isEnabled(msgLevel)) {
            return;
        }
        stream.println("|" + msgLevel + "|localhost\t" + msg);
        if (t != null) {
            t.printStackTrace(stream);
        }
    }

    @Override
    public void debug(@Nonnull Object msg) {
        print(out, Level.DEBUG, msg, null);
    }

    @Override
    public void debug(@Nonnull Object msg,
                      @Nonnull Throwable t) {
        print(out, Level.DEBUG, msg, t);
    }

    @Override
    public void info(@Nonnull Object msg) {
        print(out, Level.INFO, msg, null);
    }

    @Override
    public void info(@Nonnull Object msg,
                     @Nonnull Throwable t) {
        print(out, Level.INFO, msg, t);
    }

    @Override
    public void warn(@Nonnull Object msg) {
        print(err, Level.WARN, msg, null);
    }

    @Override
    public void warn(@Nonnull Object msg,
                     @Nonnull Throwable t) {
        print(err, Level.WARN, msg, t);
    }

    @Override
    public void error(@Nonnull Object msg) {
        print(err, Level.ERROR, msg, null);
    }

    @Override
    public void error(@Nonnull Object msg,
                      @Nonnull Throwable t) {
        print(err, Level.ERROR, msg, t);
    }

    @Override
    public void fatal(@Nonnull Object msg) {
        print(err, Level.FATAL, msg, null);
    }

    @Override
    public void fatal(@Nonnull Object msg,
                      @Nonnull Throwable t) {
        print(err, Level.FATAL, msg, t);
    }
}
