package com.bulge.API;

import com.bulge.bulgeCompositing.BulgePipeline;
import com.bulge.bulgeCompositing.LayerSpec;
import com.bulge.bulgeCompositing.PipelineRequest;
import com.bulge.bulgeCompositing.PipelineResult;
import com.bulge.bulgeCompositing.warper.SphericalWarpEngine;
import com.bulge.imageOperator.RasterIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;

/**
 * Runs the pipeline over stored uploads. Decoding and encoding go through the same OpenCV natives
 * as the warp: without them a request fails at DECODE with a 500, so a degraded result is only
 * reachable when rasters come from somewhere other than {@link RasterIO}.
 */
@Service
public class BulgeService {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final String OUTPUT_NAME = "bulge_composite.png";

    private final BulgeProperties properties;
    private final SphericalWarpEngine warpEngine = new SphericalWarpEngine();

    public BulgeService(BulgeProperties properties) {
        this.properties = properties;
        if (!warpEngine.isBackendAvailable()) {
            LOG.warn("Started without OpenCV natives: uploads cannot be decoded, requests will fail at DECODE");
        }
    }

    public BulgeOutcome bulge(BulgeJob job) {
        PipelineRequest.PipelineRequestBuilder request = PipelineRequest.builder()
                .background(RasterIO.read(job.getBackground()))
                .reference(RasterIO.read(job.getReference()))
                .explicitBox(job.getBox());
        for (int i = 0; i < job.getLayers().size(); i++) {
            request.layer(new LayerSpec(RasterIO.read(job.getLayers().get(i)), job.isMasked(i)));
        }

        BulgePipeline pipeline = BulgePipeline.builder()
                .strength(job.getStrength())
                .smooth(job.isSmooth())
                .threshold(job.getThreshold())
                .warpEngine(warpEngine)
                .build();
        PipelineResult result = pipeline.run(request.build());

        Path out = properties.outputPath().resolve(OUTPUT_NAME);
        RasterIO.write(out, result.getImage());
        LOG.info(">>> DONE: {} (box {}, degraded {})", out, result.getBox(), result.isDegraded());
        return new BulgeOutcome(properties.getPublicBaseUrl() + OUTPUT_NAME, result.getBox(), result.isDegraded());
    }
}
