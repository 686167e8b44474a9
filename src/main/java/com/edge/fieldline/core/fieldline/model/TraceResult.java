package com.edge.fieldline.core.fieldline.model;

import com.edge.fieldline.core.geometry.model.PointCyl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 磁力线追踪结果：按追踪参数递增排列的 (R, Z, phi) 曲线和错误标志
 */
public class TraceResult {
    private final List<PointCyl> curve;
    private final boolean error;

    public TraceResult(List<PointCyl> curve, boolean error) {
        this.curve = Collections.unmodifiableList(new ArrayList<>(curve));
        this.error = error;
    }

    public static TraceResult failed() {
        return new TraceResult(Collections.emptyList(), true);
    }

    public List<PointCyl> getCurve() { return curve; }
    public boolean isError() { return error; }

    public int size() {
        return curve.size();
    }

    /**
     * phi 的总体走向：+1 递增，-1 递减，0 无变化
     * <p>
     * 相邻点的差值先归一化到 (-180, 180]，再累加
     */
    public int phiSense() {
        double total = 0;
        for (int i = 1; i < curve.size(); i++) {
            double d = curve.get(i).phi - curve.get(i - 1).phi;
            d = d % 360.0;
            if (d > 180.0) {
                d -= 360.0;
            } else if (d <= -180.0) {
                d += 360.0;
            }
            total += d;
        }
        return (int) Math.signum(total);
    }
}
