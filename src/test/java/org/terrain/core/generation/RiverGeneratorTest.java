package org.terrain.core.generation;

import org.junit.jupiter.api.Test;
import org.terrain.core.model.GridPath;
import org.terrain.core.model.GridPoint;
import org.terrain.core.model.HeightMap;
import org.terrain.core.model.LayerKind;
import org.terrain.core.model.PathEnd;
import org.terrain.core.model.RiverCategory;
import org.terrain.core.model.SeaCategory;
import org.terrain.core.model.TerrainLayer;
import org.terrain.core.model.config.GeneratorSettings;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RiverGeneratorTest {

    private final GeneratorSettings settings = GeneratorSettings.defaults();
    private final RiverGenerator generator = new RiverGenerator(settings);

    @Test
    void riversRunDownhillIntoTheSea() {
        // rises eastward: x <= 3 is sea, x >= 7 is mountain
        HeightMap h = TerrainFixtures.heightMap(10, (x, y) -> x / 9.0);
        TerrainLayer sea = new SeaGenerator(settings).generate(h, Map.of(), RandomSource.seed(1));
        sea.normalize();

        TerrainLayer river = generator.generate(h, Map.of(LayerKind.SEA, sea), RandomSource.seed(11));

        assertEquals(4, river.paths().size());
        for (GridPath p : river.paths()) {
            GridPoint src = p.start();
            boolean interior = src.x() < 9 && src.y() > 0 && src.y() < 9;
            assertEquals(interior ? PathEnd.SEA : PathEnd.MAP_EDGE, p.end(), "river from " + src);
            if (interior) {
                assertEquals(new GridPoint(4, src.y()), p.last());
            }
            for (GridPoint c : p.cells()) {
                assertEquals(RiverCategory.WATER, river.category(c.x(), c.y()));
                assertEquals(SeaCategory.LAND, sea.category(c.x(), c.y()));
            }
        }
    }

    @Test
    void traceStopsInAPit() {
        HeightMap h = TerrainFixtures.heightMap(5, (x, y) -> {
            if (x == 2 && y == 2) return 1.0;
            if (x == 2 && y == 1) return 0.5;
            return 0.8;
        });
        TerrainLayer sea = TerrainFixtures.layer(LayerKind.SEA, 5, (x, y) -> SeaCategory.LAND);

        GridPath fromPeak = generator.trace(new GridPoint(2, 2), h, sea.categories());
        assertEquals(List.of(new GridPoint(2, 2), new GridPoint(2, 1)), fromPeak.cells());
        assertEquals(PathEnd.LOCAL_MINIMUM, fromPeak.end());

        GridPath fromBorder = generator.trace(new GridPoint(0, 2), h, sea.categories());
        assertEquals(1, fromBorder.length());
        assertEquals(PathEnd.MAP_EDGE, fromBorder.end());
    }

    @Test
    void equalDropsFollowNorthEastSouthWestOrder() {
        HeightMap h = TerrainFixtures.heightMap(5, (x, y) -> {
            if (x == 2 && y == 2) return 0.9;
            if ((x == 2 && y == 1) || (x == 3 && y == 2) || (x == 1 && y == 2)) return 0.2;
            return 0.5;
        });
        assertEquals(new GridPoint(2, 1), RiverGenerator.steepestDescent(new GridPoint(2, 2), h));

        HeightMap eastOnly = TerrainFixtures.heightMap(5, (x, y) -> {
            if (x == 2 && y == 2) return 0.9;
            if ((x == 3 && y == 2) || (x == 1 && y == 2)) return 0.2;
            return 0.5;
        });
        assertEquals(new GridPoint(3, 2), RiverGenerator.steepestDescent(new GridPoint(2, 2), eastOnly));

        HeightMap flat = TerrainFixtures.heightMap(3, (x, y) -> 0.4);
        assertNull(RiverGenerator.steepestDescent(new GridPoint(1, 1), flat));
    }

    @Test
    void noMountainsIsAConstraintFailure() {
        HeightMap h = TerrainFixtures.heightMap(6, (x, y) -> 0.5);
        TerrainLayer sea = TerrainFixtures.layer(LayerKind.SEA, 6, (x, y) -> SeaCategory.LAND);
        LayerConstraintUnsatisfiedException e = assertThrows(LayerConstraintUnsatisfiedException.class,
                () -> generator.generate(h, Map.of(LayerKind.SEA, sea), RandomSource.seed(1)));
        assertEquals(LayerKind.RIVER, e.kind());
    }

    @Test
    void sourceCountHonorsMinimumAndMaximum() {
        assertEquals(2, generator.sourceCount(2));
        assertEquals(4, generator.sourceCount(10));
        assertEquals(10, generator.sourceCount(400));
        assertEquals(255, generator.sourceCount(100_000));
    }

    @Test
    void generatedRiversTerminateWithoutRevisiting() {
        for (long seed = 0; seed < 20; seed++) {
            TerrainContext ctx = new TerrainContext(seed, 33, settings);
            ctx.heightMap = new HeightMapGenerator(settings).generate(33, ctx.random);
            ctx.buildLayer(new SeaGenerator(settings));
            TerrainLayer river;
            try {
                river = ctx.buildLayer(generator);
            } catch (LayerConstraintUnsatisfiedException e) {
                continue;
            }
            HeightMap h = ctx.heightMap();
            TerrainLayer sea = ctx.layer(LayerKind.SEA);
            for (GridPath p : river.paths()) {
                Set<GridPoint> seen = new HashSet<>();
                for (int i = 0; i < p.length(); i++) {
                    GridPoint c = p.cells().get(i);
                    assertTrue(seen.add(c), "seed " + seed + " revisits " + c);
                    if (i > 0) {
                        assertTrue(h.elevation(c) < h.elevation(p.cells().get(i - 1)));
                    }
                }
                GridPoint last = p.last();
                switch (p.end()) {
                    case SEA -> assertTrue(GridSegments.touches4(sea.categories(), last.x(), last.y(), SeaCategory.WATER));
                    case MAP_EDGE -> assertTrue(GridSegments.isBorder(33, last.x(), last.y()));
                    case LOCAL_MINIMUM -> assertNull(RiverGenerator.steepestDescent(last, h));
                    default -> assertFalse(true, "unexpected end " + p.end());
                }
            }
        }
    }
}
