package com.edge.fieldline.core.culling;

import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.geometry.model.Segment;
import com.edge.fieldline.core.sightline.SightlineSpot;
import com.edge.fieldline.core.transform.CoordinateTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 视场裁剪器
 * <p>
 * 对每条线段的每个点做两步筛选：
 * <ol>
 *   <li>视场锥：(P - eye) 与视线向量夹角 &lt;= 半视场角</li>
 *   <li>阴影规则：P 与 spot 的方位差取直接差 |Δφ| 与回绕差 360 - |Δφ| 中较小者；
 *       直接差胜出（含相等）用阈值 1，回绕差胜出用阈值 2，超过阈值即丢弃</li>
 * </ol>
 * 没有保留点的线段整体丢弃。阴影规则是针对标定图像的经验规则，不保证适用于其他相机几何。
 */
@Component
public class FieldOfViewCuller {
    private static final Logger logger = LoggerFactory.getLogger(FieldOfViewCuller.class);

    private static final double EPS = 1e-12;

    /**
     * 裁剪整个线段集合
     *
     * @param segments 输入线段（按存储顺序）
     * @param eye      眼点
     * @param spot     视线目标点，其线段/点索引用于定位简化后的 spot
     * @param params   视场与阴影参数
     */
    public CulledView cull(List<Segment> segments, Point3 eye, SightlineSpot spot, CullingParameters params) {
        return cull(segments, eye, spot.getPoint(), spot.getSegmentIndex(), spot.getPointIndex(), params);
    }

    /**
     * 裁剪线段集合（spot 不属于输入线段时 spotSegment 传 -1）
     */
    public CulledView cull(List<Segment> segments, Point3 eye, Point3 spotPoint,
                           int spotSegment, int spotPointIndex, CullingParameters params) {
        Point3 sight = spotPoint.minus(eye);
        double sightLength = sight.norm();
        if (sightLength < EPS) {
            throw new IllegalArgumentException("Eye and spot coincide, sightline is undefined");
        }
        double spotPhi = CoordinateTransform.cartToCyl(spotPoint).phi;

        List<CulledSegment> kept = new ArrayList<>();
        Map<Integer, Integer> reducedIndex = new LinkedHashMap<>();
        int reducedSpotSegment = -1;
        int reducedSpotPoint = -1;

        for (Segment segment : segments) {
            List<Point3> survivors = new ArrayList<>();
            int[] indices = new int[segment.size()];
            int count = 0;

            for (int i = 0; i < segment.size(); i++) {
                Point3 p = segment.getPoint(i);
                if (isVisible(p, eye, sight, sightLength, spotPhi, params)) {
                    survivors.add(p);
                    indices[count++] = i;
                }
            }
            if (count == 0) {
                continue;
            }

            int reduced = kept.size();
            int[] trimmed = new int[count];
            System.arraycopy(indices, 0, trimmed, 0, count);
            kept.add(new CulledSegment(segment, survivors, trimmed, PortTagger.portIndex(segment)));
            reducedIndex.put(segment.getIndex(), reduced);

            if (segment.getIndex() == spotSegment) {
                for (int k = 0; k < count; k++) {
                    if (trimmed[k] == spotPointIndex) {
                        reducedSpotSegment = reduced;
                        reducedSpotPoint = k;
                        break;
                    }
                }
            }
        }

        CulledView view = new CulledView(kept, reducedIndex, reducedSpotSegment, reducedSpotPoint);
        logger.debug("Culled {} segments to {} ({} points) with {}",
            segments.size(), view.size(), view.pointCount(), params);
        return view;
    }

    /**
     * 单点可见性判断
     */
    boolean isVisible(Point3 p, Point3 eye, Point3 sight, double sightLength,
                      double spotPhi, CullingParameters params) {
        Point3 v = p.minus(eye);
        double len = v.norm();
        if (len < EPS || !Double.isFinite(len)) {
            return false;
        }
        double cosAngle = v.dot(sight) / (len * sightLength);
        double angle = Math.toDegrees(Math.acos(Math.max(-1.0, Math.min(1.0, cosAngle))));
        if (angle > params.getHalfFov()) {
            return false;
        }

        double phi = CoordinateTransform.cartToCyl(p).phi;
        double direct = Math.abs(phi - spotPhi);
        double wrapped = 360.0 - direct;
        if (direct <= wrapped) {
            return direct <= params.getShadowAngle1();
        }
        return wrapped <= params.getShadowAngle2();
    }
}
