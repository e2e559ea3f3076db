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

package org.cripac.isee.videobatch.batch;

import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands glob patterns of source videos, resolved against a source directory.
 * Patterns are expanded in the order given, the matches of each one sorted by path;
 * a file matched twice is kept at its first position.
 */
public class SourceExpander {

    private final File sourceDir;
    private final List<String> patterns;

    public SourceExpander(@Nonnull File sourceDir, @Nonnull List<String> patterns) {
        this.sourceDir = sourceDir;
        this.patterns = new ArrayList<>(patterns);
    }

    private static boolean isGlob(String s) {
        return s.indexOf('*') >= 0 || s.indexOf('?') >= 0 || s.indexOf('[') >= 0 || s.indexOf('{') >= 0;
    }

    /**
     * @return Regular files matching any pattern.
     * @throws IOException On failure listing a directory.
     */
    @Nonnull
    public List<File> expand() throws IOException {
        Set<File> files = new LinkedHashSet<>();
        for (String pattern : patterns) {
            files.addAll(expand(pattern));
        }
        return new ArrayList<>(files);
    }

    @Nonnull
    private List<File> expand(@Nonnull String pattern) throws IOException {
        final Path full = sourceDir.getAbsoluteFile().toPath().resolve(pattern).normalize();

        // Walk from the deepest directory that has no wildcard in it.
        Path literal = full.getRoot();
        int depth = 0;
        boolean inGlob = false;
        for (Path part : full) {
            if (!inGlob && !isGlob(part.toString())) {
                literal = literal == null ? part : literal.resolve(part);
            } else {
                inGlob = true;
                ++depth;
            }
        }
        if (depth == 0) {
            return Files.isRegularFile(full) ? singleton(full.toFile()) : new ArrayList<>();
        }
        if (!Files.isDirectory(literal)) {
            return new ArrayList<>();
        }
        if (pattern.contains("**")) {
            depth = Integer.MAX_VALUE;
        }

        final PathMatcher matcher = FileSystems.getDefault().getPathMatcher(
                "glob:" + full);
        try (Stream<Path> paths = Files.walk(literal, depth)) {
            return paths.filter(Files::isRegularFile)
                    .filter(matcher::matches)
                    .sorted()
                    .map(Path::toFile)
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static List<File> singleton(File file) {
        List<File> list = new ArrayList<>();
        list.add(file);
        return list;
    }
}
