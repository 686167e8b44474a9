package com.edge.fieldline.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.edge.fieldline.TestGeometry;
import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.geometry.model.Polyline;

class HardwareGeometryCacheTest
{
    private HardwareGeometrySource source;
    private HardwareGeometryCache cache;

    private final Polyline tile = TestGeometry.line("tile", new Point3(0.6, 0, -0.4), new Point3(0.7, 0, -0.4));
    private final Polyline ramp = TestGeometry.line("ramp", new Point3(0.6, 0.1, -0.4), new Point3(0.7, 0.1, -0.4));

    @BeforeEach
    void setUp()
    {
        source = mock(HardwareGeometrySource.class);
        when(source.loadHardwareGeometry("divertor", false)).thenReturn(List.of(tile));
        when(source.loadHardwareGeometry("divertor", true)).thenReturn(List.of(tile));
        when(source.loadRampedTileGeometry(2)).thenReturn(List.of(ramp));
        cache = new HardwareGeometryCache(source);
    }

    @Test
    void testLoadsOncePerKey()
    {
        GeometryKey key = new GeometryKey("divertor", false, 0);
        List<Polyline> first = cache.get(key);
        List<Polyline> second = cache.get(new GeometryKey("divertor", false, 0));

        assertSame(first, second);
        assertEquals(1, first.size());
        verify(source, times(1)).loadHardwareGeometry("divertor", false);
        verify(source, never()).loadRampedTileGeometry(anyInt());
        assertThrows(UnsupportedOperationException.class, () -> first.add(ramp));
    }

    @Test
    void testRampVersionAppendsRampedTiles()
    {
        List<Polyline> polylines = cache.get(new GeometryKey("divertor", true, 2));
        assertEquals(2, polylines.size());
        assertSame(tile, polylines.get(0));
        assertSame(ramp, polylines.get(1));
    }

    @Test
    void testInvalidation()
    {
        GeometryKey a = new GeometryKey("divertor", false, 0);
        GeometryKey b = new GeometryKey("divertor", true, 2);
        cache.get(a);
        cache.get(b);
        assertEquals(2, cache.size());

        cache.invalidate(a);
        assertFalse(cache.contains(a));
        assertTrue(cache.contains(b));

        cache.get(a);
        verify(source, times(2)).loadHardwareGeometry("divertor", false);

        cache.invalidateAll();
        assertEquals(0, cache.size());
    }
}
