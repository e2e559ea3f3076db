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

package org.cripac.isee.videobatch.alg.profile;

import org.apache.commons.io.FilenameUtils;
import org.cripac.isee.videobatch.alg.pixylation.ResultFormat;
import org.cripac.isee.videobatch.alg.region.Region;
import org.cripac.isee.videobatch.alg.region.RegionSpec;
import org.cripac.isee.videobatch.batch.BatchCommand;
import org.cripac.isee.videobatch.batch.BatchEnvironment;
import org.cripac.isee.videobatch.common.ConfigurationException;
import org.cripac.isee.videobatch.common.SinkOpenException;
import org.cripac.isee.videobatch.ctrl.BatchConfig;
import org.cripac.isee.videobatch.io.ResultSink;
import org.cripac.isee.videobatch.io.RgbFrame;
import org.cripac.isee.videobatch.util.logging.Logger;

import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generates the Z-profile of regions of interest: for every frame, the mean intensity over all
 * channels of the pixels of each region, written to <code>Profile_{basename}.csv</code>.
 */
public class ProfileCommand implements BatchCommand {

    public static final String NAME = "profile";
    public static final String DESCRIPTION = "generates the Z-profile (mean intensity per frame) of regions of interest";

    public static final String OUT_DIR = "outdir";

    private final Map<String, Region> regions;
    private final File outDir;
    private final BatchEnvironment env;
    private final Logger logger;

    private ResultSink sink = null;

    public ProfileCommand(@Nonnull Map<String, Region> regions,
                          @Nonnull File outDir,
                          @Nonnull BatchEnvironment env) throws ConfigurationException {
        if (regions.isEmpty()) {
            throw new ConfigurationException("No ROI settings found in the configuration;"
                    + " make sure that you have the '" + BatchConfig.ROIS + "' field in it.");
        }
        this.regions = Collections.unmodifiableMap(new LinkedHashMap<>(regions));
        this.outDir = outDir;
        this.env = env;
        this.logger = env.getLogger();
    }

    @Nonnull
    public static ProfileCommand create(@Nonnull BatchConfig config,
                                        @Nonnull BatchEnvironment env) throws ConfigurationException {
        final Map<String, Region> regions = new LinkedHashMap<>();
        for (Map.Entry<String, RegionSpec> entry : config.getRegions().entrySet()) {
            regions.put(entry.getKey(), entry.getValue().build(env.getMaskLoader()));
        }
        ProfileCommand command = new ProfileCommand(regions, config.getDirectory(OUT_DIR), env);
        StringBuilder info = new StringBuilder("<< Profile >>");
        for (Map.Entry<String, Region> entry : regions.entrySet()) {
            info.append('\n').append(entry.getKey()).append('=').append(entry.getValue());
        }
        env.getLogger().info(info);
        return command;
    }

    @Nonnull
    public File resultPath(@Nonnull String basename) {
        return new File(outDir, "Profile_" + basename + ".csv");
    }

    /**
     * Mean of all channel values over the pixels of the region, or NaN for a region without pixels.
     */
    public static double meanIntensity(@Nonnull Region region, @Nonnull RgbFrame frame) {
        if (region.size() == 0) {
            return Double.NaN;
        }
        long sum = 0;
        for (int i = 0; i < region.size(); ++i) {
            sum += frame.channelSum(region.getX(i), region.getY(i));
        }
        return (double) sum / ((long) region.size() * RgbFrame.CHANNELS);
    }

    @Override
    public void start(@Nonnull String name) throws Exception {
        final File path = resultPath(FilenameUtils.getBaseName(name));
        sink = env.getSinkFactory().openResult(path);
        try {
            sink.writeLine("Slice," + String.join(",", regions.keySet()));
        } catch (IOException e) {
            finish(name, true);
            throw new SinkOpenException("Could not write to " + path, e);
        }
        logger.debug("Writing profile of " + name + " to " + path);
    }

    @Override
    public void update(int index, @Nonnull RgbFrame frame) throws Exception {
        StringBuilder row = new StringBuilder().append(index);
        for (Region region : regions.values()) {
            row.append(',').append(ResultFormat.decimal(meanIntensity(region, frame)));
        }
        sink.writeLine(row.toString());
    }

    @Override
    public void finish(@Nonnull String name, boolean error) {
        if (sink == null) {
            return;
        }
        try {
            sink.close();
        } catch (IOException e) {
            logger.warn("Failed to close the profile of " + name, e);
        } finally {
            sink = null;
        }
    }
}
