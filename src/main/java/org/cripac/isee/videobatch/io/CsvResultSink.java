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

import javax.annotation.Nonnull;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * A result file on the local disk. Lines are terminated by <code>\n</code> whatever the platform.
 */
public class CsvResultSink implements ResultSink {

    private final File path;
    private final Writer writer;

    /**
     * Open (truncate) the file, creating its parent directories if needed.
     *
     * @throws SinkOpenException If the file cannot be created.
     */
    public CsvResultSink(@Nonnull File path) throws SinkOpenException {
        this.path = path;
        try {
            writer = new BufferedWriter(new OutputStreamWriter(
                    FileUtils.openOutputStream(path, false), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SinkOpenException("Could not open: " + path, e);
        }
    }

    @Nonnull
    public File getPath() {
        return path;
    }

    @Override
    public void writeLine(@Nonnull String line) throws IOException {
        writer.write(line);
        writer.write('\n');
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
