package com.edge.fieldline.core.projection;

import com.edge.fieldline.core.geometry.model.Point;
import com.edge.fieldline.core.geometry.model.Point3;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 像平面
 * <p>
 * 原点 + 正交右手坐标系 (X, Y, Z)，Z 从 spot 指向眼点。
 * 局部矩形位于局部 XY 平面内，提供局部 ↔ 场景的正逆变换。
 */
public class ImagePlane {
    private final Point3 origin;
    private final Point3 xAxis;
    private final Point3 yAxis;
    private final Point3 zAxis;
    private final double halfWidth;
    private final double halfHeight;
    private final double shiftX;
    private final double shiftY;

    public ImagePlane(Point3 origin, Point3 xAxis, Point3 yAxis, Point3 zAxis,
                      double halfWidth, double halfHeight, double shiftX, double shiftY) {
        this.origin = origin;
        this.xAxis = xAxis;
        this.yAxis = yAxis;
        this.zAxis = zAxis;
        this.halfWidth = halfWidth;
        this.halfHeight = halfHeight;
        this.shiftX = shiftX;
        this.shiftY = shiftY;
    }

    /**
     * 局部 → 场景
     */
    public Point3 toScene(double lx, double ly, double lz) {
        return origin
            .plus(xAxis.scale(lx))
            .plus(yAxis.scale(ly))
            .plus(zAxis.scale(lz));
    }

    public Point3 toScene(Point local) {
        return toScene(local.x, local.y, 0.0);
    }

    /**
     * 场景 → 局部（正交基，逆变换即转置）
     */
    public Point3 toLocal(Point3 scene) {
        Point3 d = scene.minus(origin);
        return new Point3(d.dot(xAxis), d.dot(yAxis), d.dot(zAxis));
    }

    /**
     * 局部矩形四角 [BL, BR, TR, TL]
     */
    public List<Point> getLocalCorners() {
        return Collections.unmodifiableList(Arrays.asList(
            new Point(-halfWidth + shiftX, -halfHeight + shiftY),
            new Point(halfWidth + shiftX, -halfHeight + shiftY),
            new Point(halfWidth + shiftX, halfHeight + shiftY),
            new Point(-halfWidth + shiftX, halfHeight + shiftY)
        ));
    }

    /**
     * 场景空间中的矩形四角 [BL, BR, TR, TL]
     */
    public List<Point3> getSceneCorners() {
        List<Point> local = getLocalCorners();
        return Collections.unmodifiableList(Arrays.asList(
            toScene(local.get(0)), toScene(local.get(1)), toScene(local.get(2)), toScene(local.get(3))
        ));
    }

    public Point3 getOrigin() { return origin; }
    public Point3 getXAxis() { return xAxis; }
    public Point3 getYAxis() { return yAxis; }
    public Point3 getZAxis() { return zAxis; }
    public double getHalfWidth() { return halfWidth; }
    public double getHalfHeight() { return halfHeight; }
    public double getShiftX() { return shiftX; }
    public double getShiftY() { return shiftY; }

    @Override
    public String toString() {
        return String.format("ImagePlane[origin=%s, X=%s, Y=%s, Z=%s, half=(%.4f x %.4f)]",
            origin, xAxis, yAxis, zAxis, halfWidth, halfHeight);
    }
}
