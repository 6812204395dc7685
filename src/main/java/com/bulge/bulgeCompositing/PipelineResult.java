package com.bulge.bulgeCompositing;

import com.bulge.bulgeCompositing.boundingBox.BoundingBox;
import com.bulge.bulgeCompositing.mask.AlphaMask;
import com.bulge.imageOperator.Raster;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PipelineResult {
    private final Raster image;
    private final BoundingBox box;
    private final AlphaMask mask;
    /** True when layers were left undistorted because the warp backend is missing. */
    private final boolean degraded;
}
