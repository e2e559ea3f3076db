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
import org.apache.log4j.LogManager;
import org.apache.log4j.PropertyConfigurator;

import javax.annotation.Nonnull;
import java.net.URL;
import java.text.SimpleDateFormat;
import java.util.Date;

/**
 * The Log4jLogger class forwards messages to the log4j root logger, configured from
 * <code>log4j.properties</code> on the classpath, and mirrors them on the console.
 * Messages are prefixed with time, host and the name of the logger user.
 */
public class Log4jLogger extends Logger {

    private static final String LOG4J_CONF = "/log4j.properties";

    private final String username;
    private final org.apache.log4j.Logger log4jLogger;
    private final ConsoleLogger consoleLogger;

    private final SimpleDateFormat ft = new SimpleDateFormat("yy.MM.dd HH:mm:ss");

    /**
     * Create a logger. Logs will be print to console and transferred to the default Log4j logger.
     *
     * @param username Name of the logger user, usually the command being run.
     * @param level    Lowest level to output.
     */
    public Log4jLogger(@Nonnull String username,
                       @Nonnull Level level) {
        super(level);
        this.username = username;

        URL conf = Log4jLogger.class.getResource(LOG4J_CONF);
        if (conf != null) {
            PropertyConfigurator.configure(conf);
        }
        log4jLogger = LogManager.getRootLogger();
        log4jLogger.setLevel(level);

        consoleLogger = new ConsoleLogger(level);
    }

    @Override
    public void setLevel(@Nonnull Level level) {
        super.setLevel(level);
        // Called from the super constructor before the delegates exist.
        if (log4jLogger != null) {
            log4jLogger.setLevel(level);
            consoleLogger.setLevel(level);
        }
    }

    private synchronized String wrapMsg(Object msg) {
        return ft.format(new Date()) + "\t" + localName + "\t" + username + ":\t" + msg;
    }

    @Override
    public void debug(@Nonnull Object message) {
        if (isEnabled(Level.DEBUG)) {
            log4jLogger.debug(wrapMsg(message));
            consoleLogger.debug(message);
        }
    }

    @Override
    public void debug(@Nonnull Object message,
                      @Nonnull Throwable t) {
        if (isEnabled(Level.DEBUG)) {
            log4jLogger.debug(wrapMsg(message), t);
            consoleLogger.debug(message, t);
        }
    }

    @Override
    public void info(@Nonnull Object message) {
        if (isEnabled(Level.INFO)) {
            log4jLogger.info(wrapMsg(message));
            consoleLogger.info(message);
        }
    }

    @Override
    public void info(@Nonnull Object message,
                     @Nonnull Throwable t) {
        if (isEnabled(Level.INFO)) {
            log4jLogger.info(wrapMsg(message), t);
            consoleLogger.info(message, t);
        }
    }

    @Override
    public void warn(@Nonnull Object message) {
        if (isEnabled(Level.WARN)) {
            log4jLogger.warn(wrapMsg(message));
            consoleLogger.warn(message);
        }
    }

    @Override
    public void warn(@Nonnull Object message,
                     @Nonnull Throwable t) {
        if (isEnabled(Level.WARN)) {
            log4jLogger.warn(wrapMsg(message), t);
            consoleLogger.warn(message, t);
        }
    }

    @Override
    public void error(@Nonnull Object message) {
        if (isEnabled(Level.ERROR)) {
            log4jLogger.error(wrapMsg(message));
            consoleLogger.error(message);
        }
    }

    @Override
    public void error(@Nonnull Object message,
                      @Nonnull Throwable t) {
        if (isEnabled(Level.ERROR)) {
            log4jLogger.error(wrapMsg(message), t);
            consoleLogger.error(message, t);
        }
    }

    @Override
    public void fatal(@Nonnull Object message) {
        if (isEnabled(Level.FATAL)) {
            log4jLogger.fatal(wrapMsg(message));
            consoleLogger.fatal(message);
        }
    }

    @Override
    public void fatal(@Nonnull Object message,
                      @Nonnull Throwable t) {
        if (isEnabled(Level.FATAL)) {
            log4jLogger.fatal(wrapMsg(message), t);
            consoleLogger.fatal(message, t);
        }
    }
}
