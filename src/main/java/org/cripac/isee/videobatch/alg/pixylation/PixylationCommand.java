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

package org.cripac.isee.videobatch.alg.pixylation;

import org.apache.commons.io.FilenameUtils;
import org.cripac.isee.videobatch.alg.color.ColorClass;
import org.cripac.isee.videobatch.alg.color.ColorSpaceTable;
import org.cripac.isee.videobatch.alg.color.HueLuminance;
import org.cripac.isee.videobatch.alg.pixylation.CentroidEstimator.Centroid;
import org.cripac.isee.videobatch.alg.region.Region;
import org.cripac.isee.videobatch.alg.region.RegionSpec;
import org.cripac.isee.videobatch.batch.BatchCommand;
import org.cripac.isee.videobatch.batch.BatchEnvironment;
import org.cripac.isee.videobatch.common.ConfigurationException;
import org.cripac.isee.videobatch.common.SinkOpenException;
import org.cripac.isee.videobatch.ctrl.BatchConfig;
import org.cripac.isee.videobatch.io.FrameSink;
import org.cripac.isee.videobatch.io.ResultSink;
import org.cripac.isee.videobatch.io.RgbFrame;
import org.cripac.isee.videobatch.io.SinkFactory;
import org.cripac.isee.videobatch.io.VideoCodecOptions;
import org.cripac.isee.videobatch.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The PixylationCommand class tracks colored objects in every frame of a video.
 * <p>
 * For each region of interest, the pixels whose hue falls in a color class are located, and
 * the luminance-weighted centroid of them is written as one row per frame to
 * <code>Results_{basename}_{region}.csv</code>. Matched pixels are painted in the display color
 * of their class onto a black frame, and these frames form the video
 * <code>MASK_{basename}.mp4</code>.
 */
public class PixylationCommand implements BatchCommand {

    public static final String NAME = "pixylation";
    public static final String DESCRIPTION =
            "tracks hue-defined colors within regions of interest, writing centroids and mask videos";

    public static final String MODE = "mode";
    public static final String CENTER_OF_MASS = "CM";
    public static final String ORIGIN = "origin";
    public static final String MASK_DIR = "maskdir";
    public static final String RESULT_DIR = "resultdir";

    private final List<ColorClass> colors;
    private final Map<String, Region> regions;
    private final int origin;
    private final File maskDir;
    private final File resultDir;
    private final VideoCodecOptions codecOptions;
    private final BatchEnvironment env;
    private final Logger logger;

    // Per-file state.
    private ColorSpaceTable table = null;
    private final Map<String, ResultSink> resultSinks = new LinkedHashMap<>();
    private FrameSink maskSink = null;

    public PixylationCommand(@Nonnull List<ColorClass> colors,
                             @Nonnull Map<String, Region> regions,
                             int origin,
                             @Nonnull File maskDir,
                             @Nonnull File resultDir,
                             @Nonnull VideoCodecOptions codecOptions,
                             @Nonnull BatchEnvironment env) throws ConfigurationException {
        if (colors.isEmpty()) {
            throw new ConfigurationException("No color classes found in the configuration;"
                    + " make sure that you have the '" + BatchConfig.COLORS + "' field in it.");
        }
        if (regions.isEmpty()) {
            throw new ConfigurationException("No ROI settings found in the configuration;"
                    + " make sure that you have the '" + BatchConfig.ROIS + "' field in it.");
        }
        if (origin != 0 && origin != 1) {
            throw new ConfigurationException("'" + ORIGIN + "' must be 0 or 1, got " + origin);
        }
        this.colors = Collections.unmodifiableList(new ArrayList<>(colors));
        this.regions = Collections.unmodifiableMap(new LinkedHashMap<>(regions));
        this.origin = origin;
        this.maskDir = maskDir;
        this.resultDir = resultDir;
        this.codecOptions = codecOptions;
        this.env = env;
        this.logger = env.getLogger();
    }

    /**
     * Build the command from the keys <code>mode</code>, <code>colors</code>, <code>ROIs</code>,
     * <code>origin</code>, <code>maskdir</code> and <code>resultdir</code>.
     *
     * @throws ConfigurationException On missing or invalid settings, or unreadable mask images.
     */
    @Nonnull
    public static PixylationCommand create(@Nonnull BatchConfig config,
                                           @Nonnull BatchEnvironment env) throws ConfigurationException {
        final Logger logger = env.getLogger();
        final String mode = config.getString(MODE, CENTER_OF_MASS);
        if (!CENTER_OF_MASS.equals(mode)) {
            logger.warn("Unknown mode '" + mode + "'; using '" + CENTER_OF_MASS + "' instead.");
        }

        final List<ColorClass> colors = config.getColors();
        final Map<String, Region> regions = new LinkedHashMap<>();
        for (Map.Entry<String, RegionSpec> entry : config.getRegions().entrySet()) {
            regions.put(entry.getKey(), entry.getValue().build(env.getMaskLoader()));
        }

        PixylationCommand command = new PixylationCommand(colors, regions,
                config.getInt(ORIGIN, 1),
                config.getDirectory(MASK_DIR),
                config.getDirectory(RESULT_DIR),
                VideoCodecOptions.H264,
                env);
        logger.info(command.describe());
        return command;
    }

    @Nonnull
    public String describe() {
        StringBuilder info = new StringBuilder("<< Pixylation >>\n[Colors]");
        for (ColorClass color : colors) {
            info.append('\n').append(color.getName())
                    .append("=[").append(color.getOnset()).append(", ").append(color.getOffset()).append(')');
        }
        info.append("\n[ROIs]");
        for (Map.Entry<String, Region> entry : regions.entrySet()) {
            info.append('\n').append(entry.getKey()).append('=').append(entry.getValue());
        }
        return info.toString();
    }

    /**
     * @return The header row of every result file.
     */
    @Nonnull
    public String header() {
        StringBuilder header = new StringBuilder("Slice");
        for (ColorClass color : colors) {
            header.append(',').append(color.getName()).append("_CM_X")
                    .append(',').append(color.getName()).append("_CM_Y");
        }
        return header.toString();
    }

    @Nonnull
    public File resultPath(@Nonnull String basename, @Nonnull String regionName) {
        return new File(resultDir, "Results_" + basename + "_" + regionName + ".csv");
    }

    @Nonnull
    public File maskPath(@Nonnull String basename) {
        return new File(maskDir, "MASK_" + basename + "." + codecOptions.format);
    }

    @Override
    public void start(@Nonnull String name) throws Exception {
        boolean anyRegion = false;
        for (Region region : regions.values()) {
            anyRegion |= !region.isEmpty();
        }
        if (!anyRegion) {
            throw new ConfigurationException("Every region of interest is empty; nothing to track in " + name);
        }
        table = env.getColorSpaceTable();

        final String basename = FilenameUtils.getBaseName(name);
        final SinkFactory sinkFactory = env.getSinkFactory();
        final String header = header();
        for (Map.Entry<String, Region> entry : regions.entrySet()) {
            if (entry.getValue().isEmpty()) {
                logger.debug("Skipping empty region " + entry.getKey());
                continue;
            }
            final File path = resultPath(basename, entry.getKey());
            ResultSink sink = null;
            try {
                sink = sinkFactory.openResult(path);
                sink.writeLine(header);
                resultSinks.put(entry.getKey(), sink);
                logger.debug("Writing results of " + entry.getKey() + " to " + path);
            } catch (IOException e) {
                logger.warn("Could not open: " + path + "; skipping region " + entry.getKey(), e);
                if (sink != null) {
                    close(sink, path.getPath());
                }
            }
        }
        if (resultSinks.isEmpty()) {
            throw new SinkOpenException("Nothing to output for " + name);
        }

        final File path = maskPath(basename);
        try {
            maskSink = sinkFactory.openVideo(path, codecOptions);
        } catch (SinkOpenException e) {
            logger.warn("Could not open: " + path + "; no mask video for " + name, e);
        }
    }

    @Override
    public void update(int index, @Nonnull RgbFrame frame) throws Exception {
        final RgbFrame marks = new RgbFrame(frame.getWidth(), frame.getHeight());
        for (Map.Entry<String, ResultSink> entry : resultSinks.entrySet()) {
            final Region region = regions.get(entry.getKey());
            final HueLuminance hl = table.lookup(region.crop(frame));

            StringBuilder row = new StringBuilder().append(index);
            for (ColorClass color : colors) {
                final boolean[] matched = color.match(hl.hues);
                final Centroid centroid = CentroidEstimator.estimate(region, matched, hl.luminances);
                if (centroid.isDefined()) {
                    row.append(',').append(ResultFormat.decimal(centroid.x + origin))
                            .append(',').append(ResultFormat.decimal(centroid.y + origin));
                    region.mark(marks, matched, color.getDisplayColor());
                } else {
                    row.append(',').append(ResultFormat.NAN)
                            .append(',').append(ResultFormat.NAN);
                }
            }
            entry.getValue().writeLine(row.toString());
        }
        if (maskSink != null) {
            try {
                maskSink.writeFrame(marks);
            } catch (SinkOpenException e) {
                logger.warn("Could not start the mask video; continuing without it", e);
                close(maskSink, "mask video");
                maskSink = null;
            }
        }
    }

    @Override
    public void finish(@Nonnull String name, boolean error) {
        if (maskSink != null) {
            close(maskSink, "mask video of " + name);
            maskSink = null;
        }
        for (Map.Entry<String, ResultSink> entry : resultSinks.entrySet()) {
            close(entry.getValue(), "results of " + entry.getKey() + " for " + name);
        }
        resultSinks.clear();
    }

    private void close(@Nullable Closeable closeable, @Nonnull String what) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            logger.warn("Failed to close " + what, e);
        }
    }

    @Nonnull
    public List<ColorClass> getColors() {
        return colors;
    }

    @Nonnull
    public Map<String, Region> getRegions() {
        return regions;
    }

    public int getOrigin() {
        return origin;
    }
}
