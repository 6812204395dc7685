package com.bulge.osDirectoriesCreate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

public class CreateFolderOrFile {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static void createFolder(Path path) throws IOException {
        if (Files.notExists(path)) {
            Files.createDirectories(path);
            LOG.info("Created directory {}", path.toAbsolutePath());
        }
    }

    /**
     * Deletes the regular files directly inside {@code path}. Subdirectories are left alone.
     */
    public static int clearFolder(Path path) throws IOException {
        if (!Files.exists(path)) {
            return 0;
        }
        int deleted = 0;
        try (Stream<Path> files = Files.list(path)) {
            for (Path file : (Iterable<Path>) files.filter(Files::isRegularFile)::iterator) {
                Files.delete(file);
                LOG.debug("Deleted {}", file.getFileName());
                deleted++;
            }
        }
        return deleted;
    }
}
