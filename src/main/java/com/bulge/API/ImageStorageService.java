package com.bulge.API;

import com.bulge.osDirectoriesCreate.CreateFolderOrFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Service
public class ImageStorageService {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Path uploadsPath;

    public ImageStorageService(BulgeProperties properties) {
        this.uploadsPath = properties.uploadPath();
    }

    /**
     * Removes the previous request's uploads.
     */
    public void clearUploadsDirectory() throws IOException {
        int deleted = CreateFolderOrFile.clearFolder(uploadsPath);
        LOG.info("Cleared {} old upload(s) from {}", deleted, uploadsPath);
    }

    /**
     * Saves one upload under {@code name}, keeping the original extension so the codec can pick
     * the format.
     */
    public Path store(MultipartFile file, String name) throws IOException {
        CreateFolderOrFile.createFolder(uploadsPath);
        Path targetPath = uploadsPath.resolve(name + extensionOf(file.getOriginalFilename()));
        Files.copy(file.getInputStream(), targetPath, StandardCopyOption.REPLACE_EXISTING);
        return targetPath;
    }

    /**
     * Checks that the upload claims to be an image.
     */
    public boolean isValidImageFile(MultipartFile file) {
        if (file == null || file.isEmpty()) return false;

        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            return false;
        }

        String originalFilename = file.getOriginalFilename();
        return originalFilename != null &&
                originalFilename.matches("(?i).+\\.(jpg|jpeg|png|bmp|webp|tif|tiff)$");
    }

    private static String extensionOf(String filename) {
        if (filename == null) return ".png";
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? ".png" : filename.substring(dot).toLowerCase();
    }
}
