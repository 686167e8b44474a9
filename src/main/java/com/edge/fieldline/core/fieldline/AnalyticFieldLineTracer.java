package com.edge.fieldline.core.fieldline;

import com.edge.fieldline.core.fieldline.model.TraceResult;
import com.edge.fieldline.core.geometry.model.PointCyl;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析磁力线追踪器
 * <p>
 * 大环径比圆截面平衡位形，安全因子 q 为常数：
 * 极向角 theta 随环向角 phi 变化 dtheta/dphi = 1/q，磁面是以磁轴为圆心的圆。
 * 追踪方向由 cos(startAzimuth) 的符号决定；种子点位于磁轴上时返回错误。
 */
public class AnalyticFieldLineTracer implements FieldLineTracer {
    private final double axisR;
    private final double axisZ;
    private final double safetyFactor;
    private final double traceLength;   // 环向追踪总长度（度）

    public AnalyticFieldLineTracer(double axisR, double axisZ, double safetyFactor, double traceLength) {
        if (safetyFactor == 0) {
            throw new IllegalArgumentException("Safety factor must be non-zero");
        }
        if (traceLength <= 0) {
            throw new IllegalArgumentException("Trace length must be positive: " + traceLength);
        }
        this.axisR = axisR;
        this.axisZ = axisZ;
        this.safetyFactor = safetyFactor;
        this.traceLength = traceLength;
    }

    @Override
    public TraceResult trace(long shot, double time, double r, double z,
                             double startAzimuth, double step, double phiOffset) {
        double rho = Math.hypot(r - axisR, z - axisZ);
        if (rho < 1e-6 || r <= 0 || step <= 0) {
            return TraceResult.failed();
        }
        double direction = Math.cos(Math.toRadians(startAzimuth)) >= 0 ? 1.0 : -1.0;
        double theta0 = Math.atan2(z - axisZ, r - axisR);
        int steps = (int) Math.ceil(traceLength / step);

        List<PointCyl> curve = new ArrayList<>(steps + 1);
        for (int k = 0; k <= steps; k++) {
            double dphi = direction * k * step;
            double theta = theta0 + Math.toRadians(dphi) / safetyFactor;
            curve.add(new PointCyl(
                axisR + rho * Math.cos(theta),
                axisZ + rho * Math.sin(theta),
                phiOffset + dphi));
        }
        return new TraceResult(curve, false);
    }

    public double getAxisR() { return axisR; }
    public double getAxisZ() { return axisZ; }
    public double getSafetyFactor() { return safetyFactor; }
    public double getTraceLength() { return traceLength; }
}
