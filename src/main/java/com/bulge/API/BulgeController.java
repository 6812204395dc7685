package com.bulge.API;

import com.bulge.bulgeCompositing.exception.LayerSizeMismatchException;
import com.bulge.bulgeCompositing.exception.MissingInputException;
import com.bulge.bulgeCompositing.exception.NoSubjectFoundException;
import com.bulge.bulgeCompositing.exception.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class BulgeController {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final BulgeService bulgeService;
    private final ImageStorageService imageStorageService;
    private final BulgeProperties properties;

    public BulgeController(BulgeService bulgeService, ImageStorageService imageStorageService,
                           BulgeProperties properties) {
        this.bulgeService = bulgeService;
        this.imageStorageService = imageStorageService;
        this.properties = properties;
    }

    @PostMapping(value = "/bulge", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> bulge(
            @RequestParam("background") MultipartFile background,
            @RequestParam("reference") MultipartFile reference,
            @RequestParam("layers") List<MultipartFile> layers,
            @RequestParam(value = "box", required = false) String box,
            @RequestParam(value = "strength", required = false) Double strength,
            @RequestParam(value = "smooth", required = false) Boolean smooth,
            @RequestParam(value = "threshold", required = false) Integer threshold,
            @RequestParam(value = "maskedLayers", required = false) List<Integer> maskedLayers) {
        if (layers == null || layers.isEmpty()) {
            return error(HttpStatus.BAD_REQUEST, "At least one layer image is required.", null);
        }
        double s = strength != null ? strength : properties.getStrength();
        if (!(s >= 0.0 && s <= 1.0)) {
            return error(HttpStatus.BAD_REQUEST, "strength must be between 0 and 1.", null);
        }
        if (maskedLayers != null) {
            for (Integer idx : maskedLayers) {
                if (idx == null || idx < 0 || idx >= layers.size()) {
                    return error(HttpStatus.BAD_REQUEST, "Invalid masked layer index: " + idx, null);
                }
            }
        }
        if (!imageStorageService.isValidImageFile(background)) {
            return error(HttpStatus.BAD_REQUEST, "Invalid background file: " + background.getOriginalFilename(), null);
        }
        if (!imageStorageService.isValidImageFile(reference)) {
            return error(HttpStatus.BAD_REQUEST, "Invalid reference file: " + reference.getOriginalFilename(), null);
        }
        for (MultipartFile layer : layers) {
            if (!imageStorageService.isValidImageFile(layer)) {
                return error(HttpStatus.BAD_REQUEST, "Invalid layer file: " + layer.getOriginalFilename(), null);
            }
        }

        try {
            imageStorageService.clearUploadsDirectory();
            BulgeJob.BulgeJobBuilder job = BulgeJob.builder()
                    .background(imageStorageService.store(background, "background"))
                    .reference(imageStorageService.store(reference, "reference"))
                    .box(box)
                    .strength(s)
                    .smooth(smooth != null ? smooth : properties.isSmooth())
                    .threshold(threshold != null ? threshold : properties.getThreshold())
                    .maskedLayers(maskedLayers != null ? new HashSet<>(maskedLayers) : null);
            for (int i = 0; i < layers.size(); i++) {
                job.layer(imageStorageService.store(layers.get(i), "layer_" + i));
            }

            BulgeOutcome outcome = bulgeService.bulge(job.build());

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("imageUrl", outcome.getImageUrl());
            response.put("box", outcome.getBox().toArray());
            response.put("degraded", outcome.isDegraded());
            response.put("message", outcome.isDegraded()
                    ? "Composited without distortion: warp backend unavailable."
                    : "Bulge composite created.");
            return ResponseEntity.ok().body(response);
        } catch (NoSubjectFoundException e) {
            return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), e);
        } catch (LayerSizeMismatchException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (MissingInputException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (PipelineException e) {
            LOG.error("Pipeline failed", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
        } catch (IOException e) {
            LOG.error("Cannot store uploads", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Cannot store uploads: " + e.getMessage(), null);
        }
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, PipelineException cause) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        error.put("error", message);
        if (cause != null) {
            error.put("stage", cause.getStage().name());
        }
        return ResponseEntity.status(status).body(error);
    }
}
