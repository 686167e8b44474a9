package com.edge.fieldline.core.projection;

import com.edge.fieldline.core.culling.CulledSegment;
import com.edge.fieldline.core.culling.CulledView;
import com.edge.fieldline.core.geometry.model.Point;
import com.edge.fieldline.core.geometry.model.Point3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 投影器
 * <p>
 * 对每个场景点 P 构造射线 P → eye，与像平面求交：
 * I = P + t * (eye - P)，t = ((origin - P) · n) / ((eye - P) · n)。
 * t 允许为负（像平面可能位于任一端点之后）。
 * 交点经逆变换得到局部坐标，再绕局部 Z 轴旋转 rotation 度，使图像轴与像素行列对齐。
 */
@Component
public class Projector {
    private static final Logger logger = LoggerFactory.getLogger(Projector.class);

    private static final double EPS = 1e-12;

    public ProjectedView project(CulledView culled, Point3 eye, ImagePlane plane, double rotationDeg) {
        List<List<Point>> segments = new ArrayList<>(culled.size());
        int degenerate = 0;
        for (CulledSegment segment : culled.getSegments()) {
            List<Point> projected = project(segment.getPoints(), eye, plane, rotationDeg);
            for (Point p : projected) {
                if (!p.isFinite()) {
                    degenerate++;
                }
            }
            segments.add(projected);
        }
        if (degenerate > 0) {
            logger.debug("{} points had rays parallel to the image plane", degenerate);
        }
        return new ProjectedView(culled, segments);
    }

    public List<Point> project(List<Point3> points, Point3 eye, ImagePlane plane, double rotationDeg) {
        List<Point> result = new ArrayList<>(points.size());
        for (Point3 p : points) {
            result.add(projectPoint(p, eye, plane, rotationDeg));
        }
        return result;
    }

    /**
     * 单点投影
     *
     * @return 局部二维坐标；射线与平面平行时为 (NaN, NaN)
     */
    public Point projectPoint(Point3 p, Point3 eye, ImagePlane plane, double rotationDeg) {
        Point3 normal = plane.getZAxis();
        Point3 direction = eye.minus(p);
        double denominator = direction.dot(normal);
        if (Math.abs(denominator) < EPS) {
            return new Point(Double.NaN, Double.NaN);
        }
        double t = plane.getOrigin().minus(p).dot(normal) / denominator;
        Point3 intersection = p.plus(direction.scale(t));

        Point3 local = plane.toLocal(intersection);
        Point point = new Point(local.x, local.y);
        if (rotationDeg != 0.0) {
            point = point.rotate(rotationDeg);
        }
        return point;
    }
}
