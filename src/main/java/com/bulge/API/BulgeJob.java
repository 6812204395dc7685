package com.bulge.API;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Stored inputs and parameters for one request.
 */
@Getter
@Builder
public class BulgeJob {
    private final Path background;
    private final Path reference;
    @Singular
    private final List<Path> layers;
    private final String box;
    private final double strength;
    private final boolean smooth;
    private final int threshold;
    /** Indices into {@link #layers} that take the subject mask; null means all of them. */
    private final Set<Integer> maskedLayers;

    public boolean isMasked(int layerIndex) {
        return maskedLayers == null || maskedLayers.contains(layerIndex);
    }
}
