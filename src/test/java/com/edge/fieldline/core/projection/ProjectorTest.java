package com.edge.fieldline.core.projection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.edge.fieldline.TestGeometry;
import com.edge.fieldline.core.culling.CulledView;
import com.edge.fieldline.core.culling.CullingParameters;
import com.edge.fieldline.core.culling.FieldOfViewCuller;
import com.edge.fieldline.core.geometry.model.Point;
import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.geometry.model.SegmentStore;
import com.edge.fieldline.core.sightline.ApertureLocator;
import com.edge.fieldline.core.sightline.SightlineSpot;

class ProjectorTest
{
    private static final double TOL = 1e-9;

    private final Projector projector = new Projector();

    private Point3 eye;
    private ImagePlane plane;

    @BeforeEach
    void setUp()
    {
        eye = TestGeometry.eye();
        Point3 spot = new Point3(0.435, 0.423, -0.40);
        plane = new ImagePlaneBuilder().build(eye, spot, new ImagePlaneParameters(0.3, 64, 64, 1.0, 0, 0));
    }

    @Test
    void testPointOnPlaneProjectsToItself()
    {
        for (Point local : Arrays.asList(new Point(0, 0), new Point(0.01, -0.02), new Point(-0.05, 0.05)))
        {
            Point projected = projector.projectPoint(plane.toScene(local), eye, plane, 0.0);
            assertEquals(local.x, projected.x, TOL);
            assertEquals(local.y, projected.y, TOL);
        }
    }

    @Test
    void testPointsAlongARayShareProjection()
    {
        Point3 onPlane = plane.toScene(new Point(0.02, 0.01));
        Point3 direction = onPlane.minus(eye);
        Point a = projector.projectPoint(eye.plus(direction.scale(2.0)), eye, plane, 0.0);
        Point b = projector.projectPoint(eye.plus(direction.scale(5.0)), eye, plane, 0.0);
        assertEquals(0.02, a.x, TOL);
        assertEquals(0.01, a.y, TOL);
        assertEquals(a.x, b.x, TOL);
        assertEquals(a.y, b.y, TOL);
    }

    @Test
    void testRotationAboutPlaneNormal()
    {
        Point3 scene = plane.toScene(new Point(0.02, 0.0));
        Point rotated = projector.projectPoint(scene, eye, plane, 90.0);
        assertEquals(0.0, rotated.x, TOL);
        assertEquals(0.02, rotated.y, TOL);
    }

    @Test
    void testRayParallelToPlaneIsNaN()
    {
        Point3 sideways = eye.plus(plane.getXAxis().scale(0.1));
        Point projected = projector.projectPoint(sideways, eye, plane, 0.0);
        assertFalse(projected.isFinite());
    }

    @Test
    void testProjectedViewIsIndexAligned()
    {
        SegmentStore store = TestGeometry.floorStore();
        SightlineSpot spot = new ApertureLocator().locate(eye, TestGeometry.ALPHA, TestGeometry.BETA,
                store.getSegments());
        ImagePlane spotPlane = new ImagePlaneBuilder().build(eye, spot.getPoint(),
                new ImagePlaneParameters(0.3, 64, 64, 1.0, 0, 0));
        CulledView culled = new FieldOfViewCuller().cull(store.getSegments(), eye, spot,
                new CullingParameters(15, 60, 60));

        ProjectedView view = projector.project(culled, eye, spotPlane, 0.0);
        assertEquals(culled.size(), view.size());
        for (int i = 0; i < culled.size(); i++)
        {
            List<Point> points = view.getSegment(i);
            assertEquals(culled.getSegments().get(i).size(), points.size());
        }
        // spot 在视线上，投影到像平面中心
        Point center = view.getSpotProjection();
        assertTrue(center.isFinite());
        assertEquals(0.0, center.x, 1e-9);
        assertEquals(0.0, center.y, 1e-9);
    }
}
