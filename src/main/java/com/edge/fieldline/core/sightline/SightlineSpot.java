package com.edge.fieldline.core.sightline;

import com.edge.fieldline.core.geometry.model.Point3;

/**
 * 视线目标点 (spot)
 * <p>
 * 记录所选硬件点及其在原始线段存储中的位置，供后续作为画面视觉中心标记
 */
public class SightlineSpot {
    private final Point3 point;
    private final int segmentIndex;   // 线段索引
    private final int pointIndex;     // 段内点索引
    private final double alpha;       // 实测 alpha (度)
    private final double beta;        // 实测 beta (度)

    public SightlineSpot(Point3 point, int segmentIndex, int pointIndex, double alpha, double beta) {
        this.point = point;
        this.segmentIndex = segmentIndex;
        this.pointIndex = pointIndex;
        this.alpha = alpha;
        this.beta = beta;
    }

    public Point3 getPoint() { return point; }
    public int getSegmentIndex() { return segmentIndex; }
    public int getPointIndex() { return pointIndex; }
    public double getAlpha() { return alpha; }
    public double getBeta() { return beta; }

    @Override
    public String toString() {
        return String.format("Spot[%s seg=%d pt=%d alpha=%.2f° beta=%.2f°]",
            point, segmentIndex, pointIndex, alpha, beta);
    }
}
