package com.edge.fieldline.core.projection;

import com.edge.fieldline.core.culling.CulledView;
import com.edge.fieldline.core.geometry.model.Point;

import java.util.Collections;
import java.util.List;

/**
 * 投影结果：与 {@link CulledView} 的线段和点一一对应的局部二维点
 * <p>
 * 局部 Z 恒为 0，不单独保存。退化的射线对应 NaN 点。
 */
public class ProjectedView {
    private final CulledView culled;
    private final List<List<Point>> segments;

    public ProjectedView(CulledView culled, List<List<Point>> segments) {
        this.culled = culled;
        this.segments = Collections.unmodifiableList(segments);
    }

    public CulledView getCulled() { return culled; }
    public List<List<Point>> getSegments() { return segments; }

    public List<Point> getSegment(int reducedIndex) {
        return segments.get(reducedIndex);
    }

    /**
     * spot 点的投影，spot 不可见时返回 null
     */
    public Point getSpotProjection() {
        if (!culled.hasSpot()) {
            return null;
        }
        return segments.get(culled.getSpotSegment()).get(culled.getSpotPoint());
    }

    public int size() {
        return segments.size();
    }
}
