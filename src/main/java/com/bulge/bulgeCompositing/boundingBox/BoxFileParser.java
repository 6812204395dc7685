package com.bulge.bulgeCompositing.boundingBox;

import com.bulge.bulgeCompositing.exception.InvalidBoundingBoxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads "min_x min_y max_x max_y" lines (commas or whitespace). Blank and '#' lines are skipped,
 * the first well-formed line wins.
 */
public class BoxFileParser {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    private static final Pattern SEPARATOR = Pattern.compile("[,\\s]+");

    public static Optional<BoundingBox> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            Optional<BoundingBox> box = parseLine(line);
            if (box.isPresent()) {
                return box;
            }
        }
        return Optional.empty();
    }

    /**
     * Absent or unreadable file means no explicit box.
     */
    public static Optional<BoundingBox> read(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.warn("Cannot read box file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<BoundingBox> parseLine(String line) {
        String[] parts = SEPARATOR.split(line);
        if (parts.length != 4) {
            LOG.warn("Skipping malformed box line '{}': expected 4 values, got {}", line, parts.length);
            return Optional.empty();
        }
        int[] v = new int[4];
        try {
            for (int i = 0; i < 4; i++) {
                v[i] = Integer.parseInt(parts[i]);
            }
        } catch (NumberFormatException e) {
            LOG.warn("Skipping malformed box line '{}': {}", line, e.getMessage());
            return Optional.empty();
        }
        try {
            return Optional.of(new BoundingBox(v[0], v[1], v[2], v[3]));
        } catch (InvalidBoundingBoxException e) {
            LOG.warn("Skipping box line '{}': {}", line, e.getMessage());
            return Optional.empty();
        }
    }
}
