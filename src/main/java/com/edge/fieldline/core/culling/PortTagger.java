package com.edge.fieldline.core.culling;

import com.edge.fieldline.core.geometry.model.PointCyl;
import com.edge.fieldline.core.geometry.model.Segment;
import com.edge.fieldline.core.transform.CoordinateTransform;

/**
 * 窗口端口标记
 * <p>
 * 前两个点的方位角都恰好是端口间距 (36°) 整数倍的线段，标记端口颜色编号
 * (方位角 / 36，从 1 开始)。仅用于显示。
 */
public final class PortTagger {
    public static final double PORT_SPACING = 36.0;

    private static final double TOLERANCE = 1e-6;

    private PortTagger() {
    }

    /**
     * @return 端口编号（1 起），不在端口上返回 0
     */
    public static int portIndex(Segment segment) {
        if (segment.size() < 2) {
            return 0;
        }
        PointCyl first = CoordinateTransform.cartToCyl(segment.getPoint(0));
        PointCyl second = CoordinateTransform.cartToCyl(segment.getPoint(1));
        int firstPort = portOf(first.phi);
        if (firstPort == 0 || portOf(second.phi) != firstPort) {
            return 0;
        }
        return firstPort;
    }

    private static int portOf(double phi) {
        double ratio = phi / PORT_SPACING;
        long nearest = Math.round(ratio);
        if (Math.abs(ratio - nearest) * PORT_SPACING > TOLERANCE) {
            return 0;
        }
        return (int) (nearest % 10) + 1;
    }
}
