package com.edge.fieldline.core.geometry.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 线段存储
 * <p>
 * 按插入顺序保存所有 {@link Segment}。唯一的修改操作是追加一批新折线，
 * 已有线段不会被原地修改。索引单调递增，从不复用。
 * <p>
 * 追加顺序：硬件 → 标定角点 → 磁力线。单写者，不做并发控制。
 */
public class SegmentStore {
    private final Map<Integer, Segment> segments = new LinkedHashMap<>();
    private final Set<String> labels = new HashSet<>();
    private int nextIndex = 0;

    public SegmentStore() {
    }

    /**
     * 追加一条折线
     *
     * @return 分配了索引的线段
     */
    public Segment append(Polyline polyline) {
        if (!labels.add(polyline.getLabel())) {
            throw new IllegalArgumentException("Duplicate segment label: " + polyline.getLabel());
        }
        Segment segment = new Segment(nextIndex++, polyline);
        segments.put(segment.getIndex(), segment);
        return segment;
    }

    /**
     * 追加一批折线
     *
     * @return 新加入的线段，顺序与输入一致
     */
    public List<Segment> appendAll(Collection<Polyline> polylines) {
        List<Segment> added = new ArrayList<>(polylines.size());
        for (Polyline polyline : polylines) {
            added.add(append(polyline));
        }
        return added;
    }

    public Segment get(int index) {
        return segments.get(index);
    }

    public List<Segment> getSegments() {
        return Collections.unmodifiableList(new ArrayList<>(segments.values()));
    }

    public List<Segment> getSegments(SegmentKind kind) {
        List<Segment> result = new ArrayList<>();
        for (Segment segment : segments.values()) {
            if (segment.getKind() == kind) {
                result.add(segment);
            }
        }
        return result;
    }

    public Segment findByLabel(String label) {
        for (Segment segment : segments.values()) {
            if (segment.getLabel().equals(label)) {
                return segment;
            }
        }
        return null;
    }

    public int size() {
        return segments.size();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public int pointCount() {
        int count = 0;
        for (Segment segment : segments.values()) {
            count += segment.size();
        }
        return count;
    }

    @Override
    public String toString() {
        return String.format("SegmentStore[%d segments, %d points]", size(), pointCount());
    }
}
