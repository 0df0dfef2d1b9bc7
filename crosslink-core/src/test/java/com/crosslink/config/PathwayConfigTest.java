package com.crosslink.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PathwayConfigTest {

    @Test
    void testDefaults() {
        PathwayConfig config = new PathwayConfig();

        assertEquals(PathwayConfig.DEFAULT_CAPACITY, config.getCapacity());
        assertEquals(PathwayType.LINKED, config.getPathwayType());
    }

    @Test
    void testFluentSetters() {
        PathwayConfig config = new PathwayConfig()
                .setCapacity(0)
                .setPathwayType(PathwayType.MPSC);

        assertEquals(0, config.getCapacity());
        assertEquals(PathwayType.MPSC, config.getPathwayType());
    }

    @Test
    void testNegativeCapacityRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PathwayConfig().setCapacity(-1));
    }

    @Test
    void testNullTypeFallsBackToDefault() {
        assertEquals(PathwayConfig.DEFAULT_PATHWAY_TYPE, new PathwayConfig().setPathwayType(null).getPathwayType());
    }

    @Test
    void testWithCapacityCopiesType() {
        PathwayConfig original = new PathwayConfig(4).setPathwayType(PathwayType.MPSC);
        PathwayConfig copy = original.withCapacity(16);

        assertEquals(4, original.getCapacity());
        assertEquals(16, copy.getCapacity());
        assertEquals(PathwayType.MPSC, copy.getPathwayType());
    }
}
