package com.bulge.bulgeCompositing;

import com.bulge.imageOperator.Raster;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

@Getter
@Builder
public class PipelineRequest {
    private final Raster background;
    /** Subject silhouette: scanned for the box and warped into the shared mask. */
    private final Raster reference;
    /** Box text in the "min_x min_y max_x max_y" format, may be null. */
    private final String explicitBox;
    @Singular
    private final List<LayerSpec> layers;
}
