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

package org.cripac.isee.videobatch.ctrl;

import org.apache.log4j.Level;
import org.cripac.isee.videobatch.batch.BatchEnvironment;
import org.cripac.isee.videobatch.io.ImageIOMaskLoader;
import org.cripac.isee.videobatch.io.InMemoryMedia;
import org.cripac.isee.videobatch.io.RgbFrame;
import org.cripac.isee.videobatch.util.logging.ConsoleLogger;
import org.cripac.isee.videobatch.util.logging.Logger;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import javax.annotation.Nonnull;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class MainControllerTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final InMemoryMedia media = new InMemoryMedia();
    private MainController controller;

    @Before
    public void setUp() throws IOException {
        controller = new MainController(MainController.defaultRegistry(),
                new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8")) {
            @Nonnull
            @Override
            protected BatchEnvironment createEnvironment(@Nonnull Logger logger) {
                return new BatchEnvironment(logger, media, media, new ImageIOMaskLoader());
            }

            @Nonnull
            @Override
            protected Logger createLogger(@Nonnull String username, @Nonnull Level level) {
                return new ConsoleLogger(level);
            }
        };
    }

    private File writeConfig(String json) throws IOException {
        File file = folder.newFile("config.json");
        Files.write(file.toPath(), json.replace('\'', '"').getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private String profileConfig() {
        return "{'command': 'profile', 'sources': '*.mp4',"
                + " 'sourcedir': '" + folder.getRoot().getPath().replace("\\", "\\\\") + "',"
                + " 'outdir': '" + folder.getRoot().getPath().replace("\\", "\\\\") + "',"
                + " 'ROIs': {'all': {'w': 2, 'h': 2}}}";
    }

    @Test
    public void helpListsCommands() {
        assertEquals(MainController.EXIT_OK, controller.run(new String[]{"-h"}));
        String usage = new String(out.toByteArray(), StandardCharsets.UTF_8);
        assertTrue(usage, usage.contains("pixylation"));
        assertTrue(usage, usage.contains("profile"));
        assertTrue(usage, usage.contains("--time"));
    }

    @Test
    public void missingConfigArgument() {
        assertEquals(MainController.EXIT_USAGE, controller.run(new String[0]));
    }

    @Test
    public void unknownOption() {
        assertEquals(MainController.EXIT_USAGE, controller.run(new String[]{"--frobnicate", "x.json"}));
    }

    @Test
    public void unknownCommand() throws IOException {
        File config = writeConfig("{'command': 'transcode', 'sources': '*.mp4'}");
        assertEquals(MainController.EXIT_USAGE, controller.run(new String[]{config.getPath()}));
    }

    @Test
    public void runsEveryMatchedVideo() throws IOException {
        File a = folder.newFile("a.mp4");
        File b = folder.newFile("b.mp4");
        media.addVideo(a, Collections.nCopies(3, RgbFrame.filled(2, 2, 0x030303)));
        media.addVideo(b, Collections.nCopies(2, RgbFrame.filled(2, 2, 0x060606)));
        File config = writeConfig(profileConfig());

        assertEquals(MainController.EXIT_OK, controller.run(new String[]{"-v", "-t", config.getPath()}));
        assertEquals("Slice,all",
                media.getResult(new File(folder.getRoot(), "Profile_a.csv")).get(0));
        assertEquals("2,3.0000", media.getResult(new File(folder.getRoot(), "Profile_a.csv")).get(3));
        assertNotNull(media.getResult(new File(folder.getRoot(), "Profile_b.csv")));
        String progress = new String(err.toByteArray(), StandardCharsets.UTF_8);
        assertTrue(progress, progress.contains("done (3)."));
    }

    @Test
    public void failedVideoSetsExitStatus() throws IOException {
        File a = folder.newFile("a.mp4");
        media.addVideo(a, Collections.nCopies(3, new RgbFrame(2, 2))).breakVideoAt(a, 1);
        File config = writeConfig(profileConfig());

        assertEquals(MainController.EXIT_FAILED_FILES, controller.run(new String[]{config.getPath()}));
    }
}
