package com.edge.fieldline.core.geometry.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 待加入 {@link SegmentStore} 的折线（尚未分配索引）
 * <p>
 * 由硬件加载器、标定角点生成器和磁力线生成器产生
 */
public class Polyline {
    private final String label;
    private final SegmentKind kind;
    private final String color;
    private final List<Point3> points;

    public Polyline(String label, SegmentKind kind, String color, List<Point3> points) {
        if (label == null || label.isEmpty()) {
            throw new IllegalArgumentException("Polyline label must not be empty");
        }
        this.label = label;
        this.kind = kind;
        this.color = color;
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public String getLabel() { return label; }
    public SegmentKind getKind() { return kind; }
    public String getColor() { return color; }
    public List<Point3> getPoints() { return points; }

    public int size() {
        return points.size();
    }
}
