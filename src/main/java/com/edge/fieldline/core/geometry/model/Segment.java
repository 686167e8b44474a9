package com.edge.fieldline.core.geometry.model;

import com.edge.fieldline.core.transform.CoordinateTransform;

import java.util.List;

/**
 * 带索引、标签和颜色的折线
 * <p>
 * 索引由 {@link SegmentStore} 单调分配，存储变更后保持不变；标签唯一标识来源
 */
public class Segment {
    private final int index;
    private final String label;
    private final SegmentKind kind;
    private final String color;
    private final List<Point3> points;

    Segment(int index, Polyline polyline) {
        this.index = index;
        this.label = polyline.getLabel();
        this.kind = polyline.getKind();
        this.color = polyline.getColor();
        this.points = polyline.getPoints();
    }

    public int getIndex() { return index; }
    public String getLabel() { return label; }
    public SegmentKind getKind() { return kind; }
    public String getColor() { return color; }
    public List<Point3> getPoints() { return points; }

    public int size() {
        return points.size();
    }

    public Point3 getPoint(int i) {
        return points.get(i);
    }

    /**
     * 柱坐标形式
     */
    public List<PointCyl> toCylindrical() {
        return CoordinateTransform.cartToCyl(points);
    }

    @Override
    public String toString() {
        return String.format("Segment[%d '%s' %s, %d points]", index, label, kind, points.size());
    }
}
