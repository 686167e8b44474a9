package com.edge.fieldline.core.culling;

import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.geometry.model.Segment;

import java.util.Collections;
import java.util.List;

/**
 * 裁剪后保留的线段：只含可见点，保持原始顺序
 */
public class CulledSegment {
    private final Segment source;
    private final List<Point3> points;
    private final int[] sourcePointIndices;   // 每个保留点在原线段中的索引
    private final int portIndex;              // 窗口端口颜色编号，0 表示无

    public CulledSegment(Segment source, List<Point3> points, int[] sourcePointIndices, int portIndex) {
        this.source = source;
        this.points = Collections.unmodifiableList(points);
        this.sourcePointIndices = sourcePointIndices;
        this.portIndex = portIndex;
    }

    public Segment getSource() { return source; }
    public List<Point3> getPoints() { return points; }
    public int[] getSourcePointIndices() { return sourcePointIndices; }
    public int getPortIndex() { return portIndex; }

    public int getSourceIndex() {
        return source.getIndex();
    }

    public String getLabel() {
        return source.getLabel();
    }

    public int size() {
        return points.size();
    }
}
