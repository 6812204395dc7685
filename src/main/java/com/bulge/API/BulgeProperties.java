package com.bulge.API;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;

@Getter
@Setter
@ConfigurationProperties(prefix = "bulge")
public class BulgeProperties {
    /** Default warp strength when a request does not give one. */
    private double strength = 1.0;
    private boolean smooth = true;
    private int threshold = 10;
    private String uploadDir = "src/main/resources/uploads";
    private String outputDir = "src/main/resources/bulge";
    /** Prefix of the URL returned for a stored result. */
    private String publicBaseUrl = "http://localhost:8080/bulge/";

    public Path uploadPath() {
        return Paths.get(uploadDir);
    }

    public Path outputPath() {
        return Paths.get(outputDir);
    }
}
