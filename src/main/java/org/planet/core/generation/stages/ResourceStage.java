package org.planet.core.generation.stages;

import org.planet.core.generation.GenerationStage;
import org.planet.core.generation.Parallel;
import org.planet.core.generation.StageId;
import org.planet.core.generation.WorldContext;
import org.planet.core.geometry.SurfaceGeometry;
import org.planet.core.mapping.FloatGrid;
import org.planet.core.model.config.GeneratorSettings;
import org.planet.core.model.config.ResourceLayer;
import org.planet.core.terrain.ResourceField;

import java.util.List;

/**
 * Richness grid in [0, 1] for each configured resource layer.
 */
public class ResourceStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.RESOURCES;
    }

    @Override
    public String name() {
        return "Resources";
    }

    @Override
    public void apply(WorldContext ctx) {
        List<ResourceLayer> layers = ctx.settings.resources.isEmpty()
                ? GeneratorSettings.defaultResources()
                : ctx.settings.resources;
        SurfaceGeometry geometry = ctx.planet.geometry();
        int w = ctx.width();

        for (ResourceLayer layer : layers) {
            if (ctx.resources.containsKey(layer.name())) {
                throw new IllegalArgumentException("Duplicate resource layer: " + layer.name());
            }
            ResourceField field = new ResourceField(layer.name(), layer.seedFor(ctx.planet.seed(0)),
                    layer.proportion(), layer.vein(), layer.perturbed());
            FloatGrid grid = ctx.newGrid();
            Parallel.forEachRow(ctx, y -> {
                double lat = ctx.projection.latitudeOf(y);
                for (int x = 0; x < w; x++) {
                    grid.set(x, y, field.richnessAt(geometry.latLonToVector(lat, ctx.projection.longitudeOf(x))));
                }
            });
            ctx.resources.put(layer.name(), grid);
        }
    }
}
