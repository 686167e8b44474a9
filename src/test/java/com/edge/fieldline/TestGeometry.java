package com.edge.fieldline;

import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.geometry.model.Polyline;
import com.edge.fieldline.core.geometry.model.SegmentKind;
import com.edge.fieldline.core.geometry.model.SegmentStore;
import com.edge.fieldline.core.transform.CoordinateTransform;

import java.util.ArrayList;
import java.util.List;

/**
 * 测试用合成几何：Z = -0.40 处的水平偏滤器地板，由同心圆环组成
 */
public final class TestGeometry {

    public static final double FLOOR_Z = -0.40;

    // 孔径（R=1.00, Z=-0.252, phi=11°）与视线角度
    public static final double EYE_R = 1.00;
    public static final double EYE_Z = -0.252;
    public static final double EYE_PHI = 11.0;
    public static final double ALPHA = -34.0;
    public static final double BETA = -14.0;

    private TestGeometry() {
    }

    public static Point3 eye() {
        return CoordinateTransform.cylToCart(EYE_R, EYE_Z, EYE_PHI);
    }

    /**
     * R 从 0.44 到 0.90（步长 0.01），每环 phi 从 0 到 359.5（步长 0.5°）
     */
    public static List<Polyline> floorRings() {
        List<Polyline> rings = new ArrayList<>();
        for (int i = 0; i <= 46; i++) {
            double r = 0.44 + 0.01 * i;
            List<Point3> points = new ArrayList<>(720);
            for (int k = 0; k < 720; k++) {
                points.add(CoordinateTransform.cylToCart(r, FLOOR_Z, 0.5 * k));
            }
            rings.add(new Polyline(String.format("floor-%.2f", r), SegmentKind.HARDWARE, "grey", points));
        }
        return rings;
    }

    public static SegmentStore floorStore() {
        SegmentStore store = new SegmentStore();
        store.appendAll(floorRings());
        return store;
    }

    public static Polyline line(String label, Point3... points) {
        List<Point3> list = new ArrayList<>();
        for (Point3 p : points) {
            list.add(p);
        }
        return new Polyline(label, SegmentKind.HARDWARE, "grey", list);
    }
}
