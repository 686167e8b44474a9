package com.edge.fieldline.core.geometry.model;

/**
 * 柱坐标点 (R, Z, phi)，phi 单位为度
 */
public class PointCyl {
    public final double r;
    public final double z;
    public final double phi;

    public PointCyl(double r, double z, double phi) {
        this.r = r;
        this.z = z;
        this.phi = phi;
    }

    @Override
    public String toString() {
        return String.format("(R=%.4f, Z=%.4f, phi=%.2f°)", r, z, phi);
    }
}
