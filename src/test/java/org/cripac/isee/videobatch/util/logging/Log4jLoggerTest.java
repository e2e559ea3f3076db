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
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class Log4jLoggerTest {

    @Test
    public void levelReachesTheRootLogger() {
        Log4jLogger logger = new Log4jLogger("pixylation", Level.WARN);
        assertEquals(Level.WARN, LogManager.getRootLogger().getLevel());
        assertFalse(logger.isEnabled(Level.INFO));
        assertTrue(logger.isEnabled(Level.ERROR));

        logger.setLevel(Level.DEBUG);
        assertEquals(Level.DEBUG, LogManager.getRootLogger().getLevel());
        logger.debug("visible at debug level");
        logger.error("reported", new IllegalStateException("for the test"));
    }
}
