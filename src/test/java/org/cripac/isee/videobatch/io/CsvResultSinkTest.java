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

import org.apache.commons.io.FileUtils;
import org.cripac.isee.videobatch.common.SinkOpenException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;

public class CsvResultSinkTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void createsParentsAndTruncates() throws Exception {
        File path = new File(folder.getRoot(), "out/nested/Results_a_box.csv");
        try (CsvResultSink sink = new CsvResultSink(path)) {
            sink.writeLine("Slice,red_CM_X,red_CM_Y");
            sink.writeLine("0,1.0000,nan");
        }
        assertEquals("Slice,red_CM_X,red_CM_Y\n0,1.0000,nan\n",
                FileUtils.readFileToString(path, StandardCharsets.UTF_8));

        try (CsvResultSink sink = new CsvResultSink(path)) {
            sink.writeLine("Slice");
        }
        assertEquals("Slice\n", FileUtils.readFileToString(path, StandardCharsets.UTF_8));
    }

    @Test(expected = SinkOpenException.class)
    public void directoryInTheWay() throws Exception {
        new CsvResultSink(folder.newFolder("taken.csv"));
    }
}
