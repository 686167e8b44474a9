package com.edge.fieldline.core.transform;

import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.geometry.model.PointCyl;

import java.util.ArrayList;
import java.util.List;

/**
 * 坐标转换
 * 柱坐标 (R, Z, phi) 与笛卡尔坐标 (X, Y, Z) 之间的互相转换
 * <p>
 * X = R cos(phi), Y = R sin(phi)，phi 为度，逆变换结果归一化到 [0, 360)。
 * 输入 NaN 时输出 NaN。
 */
public final class CoordinateTransform {

    private CoordinateTransform() {
    }

    public static Point3 cylToCart(double r, double z, double phiDeg) {
        double phi = Math.toRadians(phiDeg);
        return new Point3(r * Math.cos(phi), r * Math.sin(phi), z);
    }

    public static Point3 cylToCart(PointCyl p) {
        return cylToCart(p.r, p.z, p.phi);
    }

    public static PointCyl cartToCyl(Point3 p) {
        double r = Math.sqrt(p.x * p.x + p.y * p.y);
        double phi = normalizeDegrees(Math.toDegrees(Math.atan2(p.y, p.x)));
        return new PointCyl(r, p.z, phi);
    }

    /**
     * 批量转换（柱坐标 → 笛卡尔）
     */
    public static List<Point3> cylToCart(List<PointCyl> points) {
        List<Point3> result = new ArrayList<>(points.size());
        for (PointCyl p : points) {
            result.add(cylToCart(p));
        }
        return result;
    }

    /**
     * 批量转换（笛卡尔 → 柱坐标）
     */
    public static List<PointCyl> cartToCyl(List<Point3> points) {
        List<PointCyl> result = new ArrayList<>(points.size());
        for (Point3 p : points) {
            result.add(cartToCyl(p));
        }
        return result;
    }

    /**
     * 并行数组形式的批量转换
     *
     * @return 长度相同的 x, y, z 三个数组
     */
    public static double[][] cylToCart(double[] r, double[] z, double[] phiDeg) {
        if (r.length != z.length || r.length != phiDeg.length) {
            throw new IllegalArgumentException(
                "R, Z and phi arrays must have equal length: " + r.length + ", " + z.length + ", " + phiDeg.length);
        }
        double[][] xyz = new double[3][r.length];
        for (int i = 0; i < r.length; i++) {
            Point3 p = cylToCart(r[i], z[i], phiDeg[i]);
            xyz[0][i] = p.x;
            xyz[1][i] = p.y;
            xyz[2][i] = p.z;
        }
        return xyz;
    }

    /**
     * 角度归一化到 [0, 360)
     */
    public static double normalizeDegrees(double deg) {
        double result = deg % 360.0;
        if (result < 0) {
            result += 360.0;
        }
        // -1e-15 + 360 会舍入为 360
        if (result >= 360.0) {
            result = 0.0;
        }
        return result;
    }
}
