package com.bulge.API;

import com.bulge.bulgeCompositing.boundingBox.BoundingBox;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BulgeOutcome {
    private final String imageUrl;
    private final BoundingBox box;
    private final boolean degraded;
}
