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

import org.apache.commons.cli.BasicParser;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Level;
import org.cripac.isee.videobatch.alg.pixylation.PixylationCommand;
import org.cripac.isee.videobatch.alg.profile.ProfileCommand;
import org.cripac.isee.videobatch.batch.BatchCommand;
import org.cripac.isee.videobatch.batch.BatchEnvironment;
import org.cripac.isee.videobatch.batch.BatchRunner;
import org.cripac.isee.videobatch.batch.JobReport;
import org.cripac.isee.videobatch.batch.ProgressReporter;
import org.cripac.isee.videobatch.batch.SourceExpander;
import org.cripac.isee.videobatch.common.ConfigurationException;
import org.cripac.isee.videobatch.util.logging.Log4jLogger;
import org.cripac.isee.videobatch.util.logging.Logger;

import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.List;

/**
 * The MainController class is the entry of the command line tool. It reads the configuration file,
 * builds the command named in it and runs the command over every source video.
 * <p>
 * Exit status: 0 if every video succeeded, 1 if some failed, 2 on usage or configuration errors.
 */
public class MainController {

    public static final String VERSION = "1.0.0";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED_FILES = 1;
    public static final int EXIT_USAGE = 2;

    private final CommandRegistry registry;
    private final PrintStream out;
    private final PrintStream err;

    public MainController(@Nonnull CommandRegistry registry,
                          @Nonnull PrintStream out,
                          @Nonnull PrintStream err) {
        this.registry = registry;
        this.out = out;
        this.err = err;
    }

    /**
     * @return A registry of every command shipped with the tool.
     */
    @Nonnull
    public static CommandRegistry defaultRegistry() {
        return new CommandRegistry()
                .register(PixylationCommand.NAME, PixylationCommand.DESCRIPTION, PixylationCommand::create)
                .register(ProfileCommand.NAME, ProfileCommand.DESCRIPTION, ProfileCommand::create);
    }

    @Nonnull
    static Options createOptions() {
        Options options = new Options();
        options.addOption("h", "help", false, "Display this help message.");
        options.addOption("v", "verbose", false, "Display debug information.");
        options.addOption("t", "time", false, "Report the time spent on the whole batch.");
        return options;
    }

    public void printUsage() {
        PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH,
                "videobatch [options] <path/to/config-file.json>",
                "VideoBatch " + VERSION, createOptions(),
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.println();
        writer.println("[base parameters]");
        writer.println("The JSON file must consist of an object with the following keys:");
        writer.println(String.format("%15s: %s", "'command'", "(required) the command to run, see below."));
        writer.println(String.format("%15s: %s", "'sources'", "(required) a pattern or a list of patterns of videos."));
        writer.println(String.format("%15s: %s", "'sourcedir'", "(optional) the directory patterns are resolved against."
                + " Defaults to the current directory."));
        writer.println();
        writer.println("[commands]");
        for (String name : registry.names()) {
            try {
                writer.println(String.format("%15s: %s", name, registry.getDescription(name)));
            } catch (ConfigurationException e) {
                throw new IllegalStateException("Registered command " + name + " has no description", e);
            }
        }
        writer.flush();
    }

    /**
     * Build an environment for one run. Overridden in tests to avoid decoding real videos.
     */
    @Nonnull
    protected BatchEnvironment createEnvironment(@Nonnull Logger logger) {
        return BatchEnvironment.local(logger);
    }

    @Nonnull
    protected Logger createLogger(@Nonnull String username, @Nonnull Level level) {
        return new Log4jLogger(username, level);
    }

    /**
     * Run the tool.
     *
     * @param args Command line arguments.
     * @return The exit status.
     */
    public int run(@Nonnull String[] args) {
        CommandLineParser parser = new BasicParser();
        CommandLine commandLine;
        try {
            commandLine = parser.parse(createOptions(), args);
        } catch (ParseException e) {
            err.println(e.getMessage());
            err.println("Try using '-h' for more information.");
            return EXIT_USAGE;
        }
        if (commandLine.hasOption('h')) {
            printUsage();
            return EXIT_OK;
        }
        if (commandLine.getArgs().length != 1) {
            printUsage();
            return EXIT_USAGE;
        }
        final Level level = commandLine.hasOption('v') ? Level.DEBUG : Level.INFO;
        final boolean timed = commandLine.hasOption('t');
        final File configFile = new File(commandLine.getArgs()[0]);

        final long start = System.currentTimeMillis();
        BatchConfig config;
        String commandName;
        try {
            config = BatchConfig.load(configFile);
            commandName = config.getCommand();
        } catch (ConfigurationException e) {
            err.println("*** " + e.getMessage());
            return EXIT_USAGE;
        }

        final Logger logger = createLogger(commandName, level);
        final BatchEnvironment env = createEnvironment(logger);
        final BatchCommand command;
        final SourceExpander sources;
        final ProgressReporter progress;
        try {
            command = registry.create(config, env);
            sources = new SourceExpander(config.getSourceDir(), config.getSources());
            progress = new ProgressReporter(err,
                    config.getLoggingInt("procbycount", ProgressReporter.DEFAULT_PROC_BY_COUNT),
                    config.getLoggingInt("sepbycount", ProgressReporter.DEFAULT_SEP_BY_COUNT));
        } catch (ConfigurationException e) {
            logger.fatal("Invalid configuration " + configFile + ": " + e.getMessage());
            return EXIT_USAGE;
        } catch (Exception e) {
            logger.fatal("Could not prepare command " + commandName, e);
            return EXIT_USAGE;
        }

        final List<JobReport> reports;
        try {
            reports = new BatchRunner(sources, command, env.getSourceFactory(), progress, logger).run();
        } catch (IOException e) {
            logger.fatal("Could not list the source videos", e);
            return EXIT_USAGE;
        }

        int failed = 0;
        for (JobReport report : reports) {
            if (!report.isSuccess()) {
                ++failed;
            }
        }
        if (timed) {
            logger.info(String.format("Processed %d video(s) in %.3f seconds.",
                    reports.size(), (System.currentTimeMillis() - start) / 1000.0));
        }
        if (failed > 0) {
            logger.error(failed + " of " + reports.size() + " video(s) failed.");
            return EXIT_FAILED_FILES;
        }
        return EXIT_OK;
    }

    public static void main(String[] args) {
        System.exit(new MainController(defaultRegistry(), System.out, System.err).run(args));
    }
}
