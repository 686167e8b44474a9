package com.edge.fieldline.core.geometry.model;

/**
 * 三维笛卡尔点（同时作为三维向量使用）
 */
public class Point3 {
    public final double x;
    public final double y;
    public final double z;

    public Point3(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public Point3 plus(Point3 other) {
        return new Point3(x + other.x, y + other.y, z + other.z);
    }

    public Point3 minus(Point3 other) {
        return new Point3(x - other.x, y - other.y, z - other.z);
    }

    public Point3 scale(double factor) {
        return new Point3(x * factor, y * factor, z * factor);
    }

    public double dot(Point3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public Point3 cross(Point3 other) {
        return new Point3(
            y * other.z - z * other.y,
            z * other.x - x * other.z,
            x * other.y - y * other.x
        );
    }

    public double norm() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    /**
     * 水平面 (XY) 内的长度
     */
    public double normXY() {
        return Math.sqrt(x * x + y * y);
    }

    /**
     * 单位向量；长度接近 0 时返回 null
     */
    public Point3 normalize() {
        double n = norm();
        if (n < 1e-12 || Double.isNaN(n)) {
            return null;
        }
        return scale(1.0 / n);
    }

    public double distanceTo(Point3 other) {
        return minus(other).norm();
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }

    @Override
    public String toString() {
        return String.format("(%.4f, %.4f, %.4f)", x, y, z);
    }
}
