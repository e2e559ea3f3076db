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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.cripac.isee.videobatch.alg.color.ColorClass;
import org.cripac.isee.videobatch.alg.region.RegionSpec;
import org.cripac.isee.videobatch.common.ConfigurationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The BatchConfig class gives typed access to a JSON configuration of a batch.
 * Keys common to all commands have dedicated getters; command-specific keys are read through
 * the generic ones. Object members keep the order they are written in.
 */
public class BatchConfig {

    public static final String COMMAND = "command";
    public static final String SOURCES = "sources";
    public static final String SOURCE_DIR = "sourcedir";
    public static final String LOGGING = "logging";
    public static final String COLORS = "colors";
    public static final String LEGACY_COLORS = "masks";
    public static final String ROIS = "ROIs";

    private final JsonObject root;

    public BatchConfig(@Nonnull JsonObject root) {
        this.root = root;
    }

    @Nonnull
    public static BatchConfig load(@Nonnull File file) throws ConfigurationException {
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            return parse(JsonParser.parseReader(reader), file.getPath());
        } catch (IOException e) {
            throw new ConfigurationException("Could not read configuration file " + file, e);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    @Nonnull
    public static BatchConfig parse(@Nonnull String json) throws ConfigurationException {
        return parse(parseElement(json), "<string>");
    }

    private static JsonElement parseElement(String json) throws ConfigurationException {
        try {
            return JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getMessage(), e);
        }
    }

    private static BatchConfig parse(JsonElement element, String origin) throws ConfigurationException {
        if (element == null || !element.isJsonObject()) {
            throw new ConfigurationException("Configuration " + origin + " must be a JSON object");
        }
        return new BatchConfig(element.getAsJsonObject());
    }

    private static boolean isBlank(@Nullable String s) {
        return s == null || s.trim().isEmpty();
    }

    @Nonnull
    public JsonObject getRoot() {
        return root;
    }

    public boolean has(@Nonnull String key) {
        return root.has(key) && !root.get(key).isJsonNull();
    }

    @Nonnull
    public String getCommand() throws ConfigurationException {
        String command = getString(COMMAND, null);
        if (isBlank(command)) {
            throw new ConfigurationException("Specify the command in the config file, using the '"
                    + COMMAND + "' key.");
        }
        return command;
    }

    /**
     * @return Glob patterns of the videos, from either one string or a list of them.
     * @throws ConfigurationException If none is given.
     */
    @Nonnull
    public List<String> getSources() throws ConfigurationException {
        List<String> sources = new ArrayList<>();
        if (has(SOURCES)) {
            JsonElement element = root.get(SOURCES);
            if (element.isJsonArray()) {
                for (JsonElement item : element.getAsJsonArray()) {
                    sources.add(asString(SOURCES, item));
                }
            } else {
                sources.add(asString(SOURCES, element));
            }
        }
        sources.removeIf(BatchConfig::isBlank);
        if (sources.isEmpty()) {
            throw new ConfigurationException("No source file specified; use the '" + SOURCES + "' key.");
        }
        return sources;
    }

    @Nonnull
    public File getSourceDir() throws ConfigurationException {
        return getDirectory(SOURCE_DIR);
    }

    /**
     * @return The directory under <code>key</code>, or the working directory if it is missing or blank.
     */
    @Nonnull
    public File getDirectory(@Nonnull String key) throws ConfigurationException {
        String dir = getString(key, null);
        return isBlank(dir) ? new File(System.getProperty("user.dir")) : new File(dir);
    }

    @Nullable
    public String getString(@Nonnull String key, @Nullable String defaultValue) throws ConfigurationException {
        return has(key) ? asString(key, root.get(key)) : defaultValue;
    }

    public int getInt(@Nonnull String key, int defaultValue) throws ConfigurationException {
        return has(key) ? asInt(key, root.get(key)) : defaultValue;
    }

    /**
     * @return The object under <code>key</code>, or an empty one if it is missing.
     */
    @Nonnull
    public JsonObject getObject(@Nonnull String key) throws ConfigurationException {
        if (!has(key)) {
            return new JsonObject();
        }
        JsonElement element = root.get(key);
        if (!element.isJsonObject()) {
            throw new ConfigurationException("'" + key + "' must be an object, got " + element);
        }
        return element.getAsJsonObject();
    }

    /**
     * Read an integer setting of the <code>logging</code> section.
     */
    public int getLoggingInt(@Nonnull String key, int defaultValue) throws ConfigurationException {
        JsonObject logging = getObject(LOGGING);
        return logging.has(key) ? asInt(LOGGING + "." + key, logging.get(key)) : defaultValue;
    }

    /**
     * Read the color classes, in declaration order. Configurations of older versions name the
     * section <code>masks</code>, which is read if <code>colors</code> is absent.
     *
     * @return Possibly empty list of classes.
     * @throws ConfigurationException If an entry is not a valid <code>[onset, offset]</code> pair.
     */
    @Nonnull
    public List<ColorClass> getColors() throws ConfigurationException {
        final String key = has(COLORS) || !has(LEGACY_COLORS) ? COLORS : LEGACY_COLORS;
        List<ColorClass> colors = new ArrayList<>();
        for (Map.Entry<String, JsonElement> entry : getObject(key).entrySet()) {
            double[] range = asRange(key + "." + entry.getKey(), entry.getValue());
            colors.add(new ColorClass(entry.getKey(), range[0], range[1]));
        }
        return colors;
    }

    /**
     * Read the regions of interest, in declaration order. An object describes a rectangle
     * (<code>x</code> and <code>y</code> default to 0, <code>w</code> and <code>h</code> to 1);
     * a string is the path of a mask image.
     *
     * @return Possibly empty map from names to region descriptions.
     */
    @Nonnull
    public Map<String, RegionSpec> getRegions() throws ConfigurationException {
        Map<String, RegionSpec> regions = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : getObject(ROIS).entrySet()) {
            final String key = ROIS + "." + entry.getKey();
            final JsonElement value = entry.getValue();
            if (value.isJsonObject()) {
                JsonObject rect = value.getAsJsonObject();
                regions.put(entry.getKey(), RegionSpec.rect(
                        rect.has("x") ? asInt(key + ".x", rect.get("x")) : 0,
                        rect.has("y") ? asInt(key + ".y", rect.get("y")) : 0,
                        rect.has("w") ? asInt(key + ".w", rect.get("w")) : 1,
                        rect.has("h") ? asInt(key + ".h", rect.get("h")) : 1));
            } else {
                regions.put(entry.getKey(), RegionSpec.mask(new File(asString(key, value)).getAbsoluteFile()));
            }
        }
        return regions;
    }

    @Nonnull
    public static String asString(@Nonnull String key, @Nonnull JsonElement element) throws ConfigurationException {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new ConfigurationException("'" + key + "' must be a string, got " + element);
        }
        return element.getAsString();
    }

    public static int asInt(@Nonnull String key, @Nonnull JsonElement element) throws ConfigurationException {
        double value = asDouble(key, element);
        if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
            throw new ConfigurationException("'" + key + "' must be an integer, got " + element);
        }
        return (int) value;
    }

    public static double asDouble(@Nonnull String key, @Nonnull JsonElement element) throws ConfigurationException {
        if (!element.isJsonPrimitive()) {
            throw new ConfigurationException("'" + key + "' must be a number, got " + element);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (!primitive.isNumber()) {
            throw new ConfigurationException("'" + key + "' must be a number, got " + element);
        }
        return primitive.getAsDouble();
    }

    /**
     * @return The two numbers of a <code>[from, to]</code> pair.
     */
    @Nonnull
    public static double[] asRange(@Nonnull String key, @Nonnull JsonElement element) throws ConfigurationException {
        if (!element.isJsonArray() || element.getAsJsonArray().size() != 2) {
            throw new ConfigurationException("'" + key + "' must be a pair of numbers [from, to], got " + element);
        }
        JsonArray pair = element.getAsJsonArray();
        return new double[]{asDouble(key, pair.get(0)), asDouble(key, pair.get(1))};
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
