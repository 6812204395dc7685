package com.bulge.bulgeCompositing;

import com.bulge.bulgeCompositing.blender.Layer;
import com.bulge.bulgeCompositing.blender.LayerCompositor;
import com.bulge.bulgeCompositing.boundingBox.BoundingBox;
import com.bulge.bulgeCompositing.boundingBox.BoundingBoxResolver;
import com.bulge.bulgeCompositing.exception.LayerSizeMismatchException;
import com.bulge.bulgeCompositing.exception.MissingInputException;
import com.bulge.bulgeCompositing.exception.PipelineException;
import com.bulge.bulgeCompositing.exception.Stage;
import com.bulge.bulgeCompositing.mask.AlphaMask;
import com.bulge.bulgeCompositing.mask.AlphaMaskBuilder;
import com.bulge.bulgeCompositing.warper.SphericalWarpEngine;
import com.bulge.imageOperator.Raster;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * resolve box -> bulge every layer with that box -> one mask from the warped reference
 * -> paint layers over the background.
 */
@Getter
@Builder
public class BulgePipeline {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    @Builder.Default
    private final double strength = 1.0;
    @Builder.Default
    private final boolean smooth = true;
    @Builder.Default
    private final int threshold = BoundingBoxResolver.DEFAULT_THRESHOLD;
    @Builder.Default
    private final SphericalWarpEngine warpEngine = new SphericalWarpEngine();

    public PipelineResult run(PipelineRequest request) {
        if (request.getBackground() == null) {
            throw new MissingInputException(Stage.COMPOSITE, "background raster is required");
        }
        if (request.getReference() == null) {
            throw new MissingInputException(Stage.MASK, "reference raster is required");
        }
        if (!(strength >= 0.0 && strength <= 1.0)) {
            throw new IllegalArgumentException("strength must be in [0,1], got " + strength);
        }
        Raster reference = request.getReference();
        for (int i = 0; i < request.getLayers().size(); i++) {
            LayerSpec spec = request.getLayers().get(i);
            if (spec.isUseSharedMask() && !spec.getRaster().sameSize(reference)) {
                throw new LayerSizeMismatchException(i, spec.getRaster().getWidth(), spec.getRaster().getHeight(),
                        reference.getWidth(), reference.getHeight());
            }
        }
        boolean degraded = !warpEngine.isBackendAvailable() && strength > 0.0;
        if (degraded) {
            LOG.warn("Spherical warp backend unavailable: layers are composited undistorted");
        }

        BoundingBox box = stage(Stage.RESOLVE, () ->
                BoundingBoxResolver.resolve(request.getExplicitBox(), request.getReference(), threshold));

        LOG.info("[Warp] {} layer(s), box {}, strength {}", request.getLayers().size(), box, strength);
        Raster warpedReference = stage(Stage.WARP, () -> warpEngine.warp(request.getReference(), box, strength));
        List<Raster> warpedLayers = stage(Stage.WARP, () -> {
            List<Raster> warped = new ArrayList<>();
            for (LayerSpec spec : request.getLayers()) {
                warped.add(warpEngine.warp(spec.getRaster(), box, strength));
            }
            return warped;
        });

        LOG.info("[Mask] smooth={}", smooth);
        AlphaMask mask = stage(Stage.MASK, () -> AlphaMaskBuilder.buildMask(warpedReference, smooth));

        LOG.info("[Blend] Compositing onto {}", request.getBackground());
        Raster result = stage(Stage.COMPOSITE, () -> {
            List<Layer> layers = new ArrayList<>();
            for (int i = 0; i < warpedLayers.size(); i++) {
                boolean masked = request.getLayers().get(i).isUseSharedMask();
                layers.add(new Layer(warpedLayers.get(i), masked ? mask : null));
            }
            return LayerCompositor.composite(request.getBackground(), layers);
        });
        return new PipelineResult(result, box, mask, degraded);
    }

    private static <T> T stage(Stage stage, Supplier<T> body) {
        try {
            return body.get();
        } catch (PipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PipelineException(stage, e.getMessage(), e);
        }
    }
}
