package com.edge.fieldline.core.culling;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 裁剪结果
 * <p>
 * 稠密的线段列表（索引即简化后索引），原索引到简化索引的映射，
 * 以及 spot 点在简化结果中的位置（若仍可见）
 */
public class CulledView {
    private final List<CulledSegment> segments;
    private final Map<Integer, Integer> reducedIndexBySource;
    private final int spotSegment;   // 简化后线段索引，-1 表示 spot 不可见
    private final int spotPoint;     // 简化后段内点索引

    public CulledView(List<CulledSegment> segments, Map<Integer, Integer> reducedIndexBySource,
                      int spotSegment, int spotPoint) {
        this.segments = Collections.unmodifiableList(segments);
        this.reducedIndexBySource = Collections.unmodifiableMap(reducedIndexBySource);
        this.spotSegment = spotSegment;
        this.spotPoint = spotPoint;
    }

    public List<CulledSegment> getSegments() { return segments; }
    public Map<Integer, Integer> getReducedIndexBySource() { return reducedIndexBySource; }
    public int getSpotSegment() { return spotSegment; }
    public int getSpotPoint() { return spotPoint; }

    public boolean hasSpot() {
        return spotSegment >= 0;
    }

    /**
     * 原始线段索引对应的简化索引，不存在返回 -1
     */
    public int reducedIndexOf(int sourceIndex) {
        Integer reduced = reducedIndexBySource.get(sourceIndex);
        return reduced == null ? -1 : reduced;
    }

    public int size() {
        return segments.size();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public int pointCount() {
        int count = 0;
        for (CulledSegment segment : segments) {
            count += segment.size();
        }
        return count;
    }
}
