package com.edge.fieldline.core.fieldline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.edge.fieldline.core.fieldline.model.TraceResult;
import com.edge.fieldline.core.geometry.model.PointCyl;

class AnalyticFieldLineTracerTest
{
    private final AnalyticFieldLineTracer tracer = new AnalyticFieldLineTracer(0.85, 0.0, 3.0, 120.0);

    @Test
    void testStaysOnFluxSurface()
    {
        TraceResult result = tracer.trace(30000, 0.25, 0.60, -0.39, 180.0, 1.0, 20.0);
        assertFalse(result.isError());
        assertEquals(121, result.size());

        double rho = Math.hypot(0.60 - 0.85, -0.39);
        for (PointCyl p : result.getCurve())
        {
            assertEquals(rho, Math.hypot(p.r - 0.85, p.z), 1e-12);
        }
        assertEquals(20.0, result.getCurve().get(0).phi, 1e-12);
    }

    @Test
    void testDirectionFollowsStartAzimuth()
    {
        assertEquals(-1, tracer.trace(1, 1, 0.6, -0.39, 180.0, 1.0, 0.0).phiSense());
        assertEquals(1, tracer.trace(1, 1, 0.6, -0.39, 0.0, 1.0, 0.0).phiSense());
    }

    @Test
    void testSeedOnAxisIsAnError()
    {
        assertTrue(tracer.trace(1, 1, 0.85, 0.0, 0.0, 1.0, 0.0).isError());
        assertTrue(tracer.trace(1, 1, 0.6, -0.39, 0.0, 0.0, 0.0).isError());
    }

    @Test
    void testPhiSenseWrapsAcrossZero()
    {
        TraceResult wrapped = new TraceResult(Arrays.asList(new PointCyl(0.6, 0, 350), new PointCyl(0.6, 0, 355),
                new PointCyl(0.6, 0, 2), new PointCyl(0.6, 0, 8)), false);
        assertEquals(1, wrapped.phiSense());
    }

    @Test
    void testInvalidConfiguration()
    {
        assertThrows(IllegalArgumentException.class, () -> new AnalyticFieldLineTracer(0.85, 0, 0, 120));
        assertThrows(IllegalArgumentException.class, () -> new AnalyticFieldLineTracer(0.85, 0, 3, 0));
    }
}
