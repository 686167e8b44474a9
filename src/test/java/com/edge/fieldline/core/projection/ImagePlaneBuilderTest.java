package com.edge.fieldline.core.projection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.edge.fieldline.TestGeometry;
import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.transform.CoordinateTransform;

class ImagePlaneBuilderTest
{
    private static final double TOL = 1e-9;

    private final ImagePlaneBuilder builder = new ImagePlaneBuilder();

    private static ImagePlaneParameters params()
    {
        return new ImagePlaneParameters(0.3, 64, 64, 1.0, 0.0, 0.0);
    }

    private static void assertOrthonormal(ImagePlane plane)
    {
        assertEquals(1.0, plane.getXAxis().norm(), TOL);
        assertEquals(1.0, plane.getYAxis().norm(), TOL);
        assertEquals(1.0, plane.getZAxis().norm(), TOL);
        assertEquals(0.0, plane.getXAxis().dot(plane.getYAxis()), TOL);
        assertEquals(0.0, plane.getXAxis().dot(plane.getZAxis()), TOL);
        assertEquals(0.0, plane.getYAxis().dot(plane.getZAxis()), TOL);
    }

    @Test
    void testAxesAreOrthonormal()
    {
        Point3[][] pairs = {
                { TestGeometry.eye(), CoordinateTransform.cylToCart(0.607, -0.40, 44.2) },
                { new Point3(1.2, 0.0, 0.0), new Point3(0.3, 0.1, -0.5) },
                { new Point3(-0.5, 0.9, 0.4), new Point3(0.2, -0.3, -0.1) } };
        for (Point3[] pair : pairs)
        {
            assertOrthonormal(builder.build(pair[0], pair[1], params()));
        }
    }

    @Test
    void testOriginLiesOnSightlineAtFocalDistance()
    {
        Point3 eye = TestGeometry.eye();
        Point3 spot = CoordinateTransform.cylToCart(0.607, -0.40, 44.2);
        ImagePlane plane = builder.build(eye, spot, params());

        assertEquals(0.3, eye.minus(plane.getOrigin()).norm(), TOL);
        Point3 toSpot = spot.minus(eye).normalize();
        Point3 toOrigin = plane.getOrigin().minus(eye).normalize();
        assertEquals(1.0, toSpot.dot(toOrigin), TOL);
    }

    @Test
    void testDegenerateHintFallsBack()
    {
        // 竖直视线且原点在中心轴上
        ImagePlane plane = builder.build(new Point3(0, 0, 1), new Point3(0, 0, 0), params());
        assertOrthonormal(plane);
    }

    @Test
    void testRectangleSize()
    {
        ImagePlane plane = builder.build(TestGeometry.eye(), new Point3(0, 0, -0.4),
                new ImagePlaneParameters(0.3, 64, 32, 2.0, 1.0, 0.0));
        assertEquals(0.025, plane.getHalfWidth(), TOL);
        assertEquals(0.0125, plane.getHalfHeight(), TOL);
        assertEquals(0.025, plane.getShiftX(), TOL);

        List<Point3> corners = plane.getSceneCorners();
        assertEquals(4, corners.size());
        assertEquals(0.05, corners.get(1).minus(corners.get(0)).norm(), TOL);
        assertEquals(0.025, corners.get(2).minus(corners.get(1)).norm(), TOL);
    }

    @Test
    void testInvalidParameters()
    {
        assertThrows(IllegalArgumentException.class, () -> new ImagePlaneParameters(0, 64, 64, 1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new ImagePlaneParameters(0.3, 64, 64, 0, 0, 0));
        Point3 p = new Point3(1, 1, 1);
        assertThrows(IllegalArgumentException.class, () -> builder.build(p, p, params()));
    }
}
