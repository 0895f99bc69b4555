package org.terrain.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrain.core.generation.stages.BiomeStage;
import org.terrain.core.generation.stages.CityStage;
import org.terrain.core.generation.stages.HeightMapStage;
import org.terrain.core.generation.stages.RiverStage;
import org.terrain.core.generation.stages.RoadStage;
import org.terrain.core.generation.stages.SeaStage;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.Terrain;
import org.terrain.core.model.config.GeneratorSettings;

import java.util.ArrayList;
import java.util.List;

public class GenerationPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationPipeline.class);

    public static final int MAX_DIMENSION = 4096;

    private final List<GenerationStage> stages = new ArrayList<>();
    private final StageProfile profile;
    private final boolean enableValidation;
    private final StageListener listener;

    public GenerationPipeline(StageProfile profile, boolean enableValidation, StageListener listener) {
        this.profile = profile;
        this.enableValidation = enableValidation;
        this.listener = (listener != null) ? listener : new LoggingStageListener();

        // Fixed stage order; each stage only reads what earlier stages published
        stages.add(new HeightMapStage());
        stages.add(new SeaStage());
        stages.add(new RiverStage());
        stages.add(new BiomeStage());
        stages.add(new CityStage());
        stages.add(new RoadStage());
    }

    /**
     * Full profile, validation on, stage timings logged.
     */
    public GenerationPipeline() {
        this(StageProfile.full(), true, new LoggingStageListener());
    }

    public Terrain run(long seed, int dimension, GeneratorSettings settings) {
        if (dimension <= 0 || dimension > MAX_DIMENSION) {
            throw new InvalidDimensionException(dimension, MAX_DIMENSION);
        }
        profile.checkRequirements();

        TerrainContext ctx = new TerrainContext(seed, dimension, settings.copy());

        for (GenerationStage stage : stages) {
            if (!profile.isEnabled(stage.id())) {
                LOGGER.debug("[STAGE SKIP]  {} - {}", stage.id(), stage.name());
                continue;
            }

            long start = System.currentTimeMillis();
            listener.onStageStart(stage.id(), stage.name());

            try {
                try {
                    stage.apply(ctx);
                } catch (LayerConstraintUnsatisfiedException e) {
                    LOGGER.warn("[WARN] Layer left empty - {}", e.getMessage());
                    ctx.installEmptyLayer(e.kind(), e.getMessage());
                }

                if (enableValidation) {
                    runValidation(stage.id(), ctx);
                }

            } catch (RuntimeException e) {
                throw new IllegalStateException("Generation failed at stage: " + stage.id() + " - " + stage.name(), e);
            } finally {
                long elapsed = System.currentTimeMillis() - start;
                listener.onStageEnd(stage.id(), stage.name(), elapsed);
            }
        }

        Terrain terrain = ctx.toTerrain();
        TerrainStatsReport.print(TerrainStats.compute(terrain));
        return terrain;
    }

    private void runValidation(StageId id, TerrainContext ctx) {
        LayerKind layer = id.layer();
        if (layer == null) {
            Validation.afterHeightMap(ctx);
        } else {
            Validation.afterLayer(ctx, layer);
        }
    }
}
