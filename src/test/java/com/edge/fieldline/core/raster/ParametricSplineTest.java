package com.edge.fieldline.core.raster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.edge.fieldline.core.geometry.model.Point;

class ParametricSplineTest
{
    @Test
    void testStraightLineIsResampledAtInterval()
    {
        List<Point> points = ParametricSpline.resample(new double[] { 0, 4, 10 }, new double[] { 0, 0, 0 }, 1.0);
        assertEquals(11, points.size());
        for (int i = 0; i < points.size(); i++)
        {
            assertEquals(i, points.get(i).x, 1e-9);
            assertEquals(0.0, points.get(i).y, 1e-9);
        }
    }

    @Test
    void testPassesThroughKnotsAndEndsAtLastPoint()
    {
        double[] xs = { 0, 3, 5, 9.5 };
        double[] ys = { 0, 4, 2, 6 };
        List<Point> points = ParametricSpline.resample(xs, ys, 1.0);

        assertEquals(0.0, points.get(0).x, 1e-12);
        Point last = points.get(points.size() - 1);
        assertEquals(9.5, last.x, 1e-12);
        assertEquals(6.0, last.y, 1e-12);
        // 第一段弦长为 5，参数 5 处恰为第二个节点
        assertEquals(3.0, points.get(5).x, 1e-9);
        assertEquals(4.0, points.get(5).y, 1e-9);
    }

    @Test
    void testDuplicatePointsAreIgnored()
    {
        List<Point> points = ParametricSpline.resample(new double[] { 1, 1, 1 }, new double[] { 2, 2, 2 }, 1.0);
        assertEquals(1, points.size());
        assertTrue(ParametricSpline.resample(new double[0], new double[0], 1.0).isEmpty());
    }

    @Test
    void testInvalidInput()
    {
        assertThrows(IllegalArgumentException.class,
                () -> ParametricSpline.resample(new double[2], new double[3], 1.0));
        assertThrows(IllegalArgumentException.class,
                () -> ParametricSpline.resample(new double[2], new double[2], 0.0));
    }
}
