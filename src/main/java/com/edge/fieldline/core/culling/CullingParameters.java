package com.edge.fieldline.core.culling;

/**
 * 视场裁剪参数（角度均为度）
 */
public class CullingParameters {
    private final double halfFov;
    private final double shadowAngle1;   // 直接方位差胜出时使用
    private final double shadowAngle2;   // 跨 0/360 回绕方位差胜出时使用

    public CullingParameters(double halfFov, double shadowAngle1, double shadowAngle2) {
        this.halfFov = halfFov;
        this.shadowAngle1 = shadowAngle1;
        this.shadowAngle2 = shadowAngle2;
    }

    public double getHalfFov() { return halfFov; }
    public double getShadowAngle1() { return shadowAngle1; }
    public double getShadowAngle2() { return shadowAngle2; }

    @Override
    public String toString() {
        return String.format("Culling[halfFov=%.1f°, shadow=(%.1f°, %.1f°)]", halfFov, shadowAngle1, shadowAngle2);
    }
}
