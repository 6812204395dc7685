package com.bulge.bulgeCompositing;

import com.bulge.bulgeCompositing.blender.Layer;
import com.bulge.bulgeCompositing.blender.LayerCompositor;
import com.bulge.bulgeCompositing.boundingBox.BoundingBox;
import com.bulge.bulgeCompositing.exception.LayerSizeMismatchException;
import com.bulge.bulgeCompositing.exception.MissingInputException;
import com.bulge.bulgeCompositing.exception.NoSubjectFoundException;
import com.bulge.bulgeCompositing.exception.Stage;
import com.bulge.bulgeCompositing.mask.AlphaMask;
import com.bulge.bulgeCompositing.mask.AlphaMaskBuilder;
import com.bulge.bulgeCompositing.warper.SphericalWarpEngine;
import com.bulge.bulgeCompositing.warper.WarpCapability;
import com.bulge.imageOperator.Raster;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class BulgePipelineTest {

    private static Raster noise(int w, int h, int channels, long seed) {
        byte[] data = new byte[w * h * channels];
        new Random(seed).nextBytes(data);
        return new Raster(w, h, channels, data);
    }

    /** White disc on black, the subject silhouette. */
    private static Raster disc(int w, int h, int cx, int cy, int r) {
        Raster ref = Raster.blank(w, h, 3);
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++)
                if ((x - cx) * (x - cx) + (y - cy) * (y - cy) <= r * r)
                    for (int c = 0; c < 3; c++) ref.set(x, y, c, 255);
        return ref;
    }

    @Test
    public void degradedRunCompositesUndistortedLayers() {
        Raster background = Raster.filled(40, 40, 255, 255, 255);
        Raster reference = disc(40, 40, 20, 20, 10);
        Raster layer = noise(40, 40, 3, 2);

        BulgePipeline pipeline = BulgePipeline.builder()
                .strength(0.7)
                .smooth(false)
                .warpEngine(new SphericalWarpEngine(false))
                .build();
        PipelineResult result = pipeline.run(PipelineRequest.builder()
                .background(background)
                .reference(reference)
                .layer(LayerSpec.masked(layer))
                .build());

        assertTrue(result.isDegraded());
        assertEquals(new BoundingBox(10, 10, 30, 30), result.getBox());
        AlphaMask expectedMask = AlphaMaskBuilder.buildMask(reference, false);
        assertEquals(expectedMask.getRaster(), result.getMask().getRaster());
        assertEquals(LayerCompositor.composite(background, List.of(new Layer(layer, expectedMask))), result.getImage());
    }

    @Test
    public void sharedMaskOnlyOnFlaggedLayers() {
        Raster background = Raster.filled(20, 20, 0, 0, 0);
        Raster reference = disc(20, 20, 10, 10, 4);
        Raster masked = Raster.filled(20, 20, 0, 255, 0);
        Raster unmasked = Raster.filled(20, 20, 255, 0, 0);

        PipelineResult result = BulgePipeline.builder()
                .strength(0.0)
                .smooth(false)
                .build()
                .run(PipelineRequest.builder()
                        .background(background)
                        .reference(reference)
                        .explicitBox("2,2,18,18")
                        .layer(LayerSpec.unmasked(unmasked))
                        .layer(LayerSpec.masked(masked))
                        .build());

        assertFalse(result.isDegraded());
        assertEquals(new BoundingBox(2, 2, 18, 18), result.getBox());
        // outside the disc only the unmasked layer shows
        assertEquals(255, result.getImage().get(0, 0, 0));
        assertEquals(0, result.getImage().get(0, 0, 1));
        // inside it the masked layer covers it
        assertEquals(0, result.getImage().get(10, 10, 0));
        assertEquals(255, result.getImage().get(10, 10, 1));
    }

    @Test
    public void fullStrengthKeepsBackgroundOutsideEllipse() {
        assumeTrue(WarpCapability.isAvailable());
        Raster background = Raster.filled(100, 100, 255, 255, 255);
        Raster reference = disc(100, 100, 50, 50, 40);
        Raster layer = noise(100, 100, 3, 5);

        PipelineResult result = BulgePipeline.builder().build().run(PipelineRequest.builder()
                .background(background)
                .reference(reference)
                .layer(LayerSpec.masked(layer))
                .build());

        assertFalse(result.isDegraded());
        assertEquals(new BoundingBox(10, 10, 90, 90), result.getBox());
        assertEquals(255, result.getImage().get(2, 2, 0));
        assertEquals(layer.get(50, 50, 1), result.getImage().get(50, 50, 1));
    }

    @Test
    public void noSubjectAbortsBeforeWarping() {
        BulgePipeline pipeline = BulgePipeline.builder().warpEngine(new SphericalWarpEngine(false)).build();
        PipelineRequest request = PipelineRequest.builder()
                .background(Raster.filled(10, 10, 255, 255, 255))
                .reference(Raster.filled(10, 10, 5, 5, 5))
                .layer(LayerSpec.masked(Raster.blank(10, 10, 3)))
                .build();
        NoSubjectFoundException e = assertThrows(NoSubjectFoundException.class, () -> pipeline.run(request));
        assertEquals(Stage.RESOLVE, e.getStage());
    }

    @Test
    public void missingRastersAreReported() {
        BulgePipeline pipeline = BulgePipeline.builder().build();
        assertThrows(MissingInputException.class, () -> pipeline.run(PipelineRequest.builder()
                .reference(Raster.blank(4, 4, 3)).build()));
        assertThrows(MissingInputException.class, () -> pipeline.run(PipelineRequest.builder()
                .background(Raster.blank(4, 4, 3)).build()));
    }

    @Test
    public void layerSizeMismatchFailsInCompositeStage() {
        BulgePipeline pipeline = BulgePipeline.builder()
                .strength(0.0)
                .warpEngine(new SphericalWarpEngine(false))
                .build();
        PipelineRequest request = PipelineRequest.builder()
                .background(Raster.blank(10, 10, 3))
                .reference(Raster.filled(10, 10, 200, 200, 200))
                .layer(LayerSpec.unmasked(Raster.blank(10, 10, 3)))
                .layer(LayerSpec.masked(Raster.blank(8, 10, 3)))
                .build();
        LayerSizeMismatchException e = assertThrows(LayerSizeMismatchException.class, () -> pipeline.run(request));
        assertEquals(Stage.COMPOSITE, e.getStage());
        assertEquals(1, e.getLayerIndex());
    }

    @Test
    public void unmaskedLayerMayDifferInSize() {
        BulgePipeline pipeline = BulgePipeline.builder()
                .strength(0.0)
                .warpEngine(new SphericalWarpEngine(false))
                .build();
        PipelineResult result = pipeline.run(PipelineRequest.builder()
                .background(Raster.filled(10, 10, 0, 0, 0))
                .reference(Raster.filled(10, 10, 200, 200, 200))
                .layer(LayerSpec.unmasked(Raster.filled(4, 4, 9, 9, 9)))
                .build());
        assertEquals(9, result.getImage().get(3, 3, 0));
        assertEquals(0, result.getImage().get(4, 4, 0));
    }

    @Test
    public void defaultsMatchFullProjection() {
        BulgePipeline pipeline = BulgePipeline.builder().build();
        assertEquals(1.0, pipeline.getStrength());
        assertTrue(pipeline.isSmooth());
        assertEquals(10, pipeline.getThreshold());
    }
}
