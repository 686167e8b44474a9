package com.edge.fieldline.core.fieldline;

import com.edge.fieldline.core.culling.CulledView;
import com.edge.fieldline.core.culling.FieldOfViewCuller;
import com.edge.fieldline.core.fieldline.model.FieldLineMappingRequest;
import com.edge.fieldline.core.fieldline.model.FieldLineMappingResult;
import com.edge.fieldline.core.fieldline.model.FieldLineViewContext;
import com.edge.fieldline.core.fieldline.model.SeedGrid;
import com.edge.fieldline.core.fieldline.model.TraceResult;
import com.edge.fieldline.core.geometry.model.Point;
import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.geometry.model.PointCyl;
import com.edge.fieldline.core.geometry.model.Polyline;
import com.edge.fieldline.core.geometry.model.Segment;
import com.edge.fieldline.core.geometry.model.SegmentKind;
import com.edge.fieldline.core.geometry.model.SegmentStore;
import com.edge.fieldline.core.projection.ImagePlane;
import com.edge.fieldline.core.projection.ProjectedView;
import com.edge.fieldline.core.projection.Projector;
import com.edge.fieldline.core.transform.CoordinateTransform;
import com.edge.fieldline.core.transform.PixelTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 磁力线像素映射器
 * <p>
 * 对网格中的每个种子点：
 * <ol>
 *   <li>追踪模式下调用外部追踪器（起始方位 180°）；phi 走向不对时从 0° 重试，
 *       仍不对则退化为纯环向弧；追踪器报错则跳过该种子</li>
 *   <li>解析模式下直接生成纯环向弧</li>
 *   <li>转换为笛卡尔坐标，以 "fieldline&lt;k&gt;" 追加到线段存储</li>
 *   <li>视场裁剪 → 投影 → 像素映射，只保留画面窗口内的点</li>
 *   <li>画面内少于 minInFramePoints 个点的磁力线丢弃</li>
 * </ol>
 */
@Component
public class FieldLinePixelMapper {
    private static final Logger logger = LoggerFactory.getLogger(FieldLinePixelMapper.class);

    public static final String LABEL_PREFIX = "fieldline";
    public static final double START_AZIMUTH = 180.0;
    public static final double RETRY_AZIMUTH = 0.0;

    private final FieldLineTracer tracer;
    private final FieldOfViewCuller culler;
    private final Projector projector;

    public FieldLinePixelMapper(FieldLineTracer tracer, FieldOfViewCuller culler, Projector projector) {
        this.tracer = tracer;
        this.culler = culler;
        this.projector = projector;
    }

    /**
     * 由左下角、右上角标定线段计算像素变换
     *
     * @param store      含标定角点线段的存储
     * @param eye        眼点
     * @param plane      像平面
     * @param rotation   像平面内旋转（度），与磁力线投影一致
     * @param resolution 像素分辨率
     */
    public PixelTransform calibrate(SegmentStore store, Point3 eye, ImagePlane plane, double rotation, int resolution) {
        Segment bottomLeft = store.findByLabel(CalibrationCornerGenerator.BOTTOM_LEFT);
        Segment topRight = store.findByLabel(CalibrationCornerGenerator.TOP_RIGHT);
        if (bottomLeft == null || topRight == null) {
            throw new IllegalStateException("Calibration corner segments are missing from the segment store");
        }
        Point bl = projector.projectPoint(bottomLeft.getPoint(CalibrationCornerGenerator.VERTEX_INDEX), eye, plane, rotation);
        Point tr = projector.projectPoint(topRight.getPoint(CalibrationCornerGenerator.VERTEX_INDEX), eye, plane, rotation);
        PixelTransform transform = PixelTransform.fromCorners(bl, tr, resolution);
        logger.info("Pixel calibration from corners {} - {}: {}", bl, tr, transform);
        return transform;
    }

    public FieldLineMappingResult map(FieldLineMappingRequest request, FieldLineViewContext context) {
        boolean tracerMode = request.isTracerMode();
        int sense = request.expectedSense();
        FieldLineRecordBuilder builder = new FieldLineRecordBuilder();
        int attempted = 0;
        int tracerErrors = 0;
        int fallbacks = 0;
        int emptyFrames = 0;

        logger.info("Mapping {} seeds in {} mode (shot={}, time={})", request.getGrid().size(),
            tracerMode ? "tracer" : "toroidal", request.getShot(), request.getTime());

        for (SeedGrid.Seed seed : request.getGrid().seeds()) {
            attempted++;
            List<PointCyl> curve;

            if (tracerMode) {
                TraceResult result = trace(request, seed, START_AZIMUTH);
                if (result.isError()) {
                    tracerErrors++;
                    logger.debug("Tracer error for seed {} (R={}, Z={}), skipped", seed.getIndex(), seed.getR(), seed.getZ());
                    continue;
                }
                if (result.phiSense() != sense) {
                    result = trace(request, seed, RETRY_AZIMUTH);
                    if (result.isError()) {
                        tracerErrors++;
                        logger.debug("Tracer error on retry for seed {}, skipped", seed.getIndex());
                        continue;
                    }
                }
                if (result.phiSense() != sense) {
                    fallbacks++;
                    logger.warn("Both trace directions have the wrong phi sense for seed {}, using toroidal arc",
                        seed.getIndex());
                    curve = toroidalArc(seed.getR(), seed.getZ(), request.getCalibrationPhi(),
                        sense * request.getSpan(), request.getArcPoints());
                } else {
                    curve = result.getCurve();
                }
            } else {
                curve = toroidalArc(seed.getR(), seed.getZ(), request.getCalibrationPhi(),
                    sense * request.getSpan(), request.getArcPoints());
            }

            String label = LABEL_PREFIX + seed.getIndex();
            Segment segment = context.getStore().append(
                new Polyline(label, SegmentKind.FIELD_LINE, "red", CoordinateTransform.cylToCart(curve)));

            List<Point> pixels = toPixels(segment, context);
            List<Point> inFrame = new ArrayList<>();
            double center = request.getResolution() / 2.0;
            for (Point p : pixels) {
                if (Math.abs(p.x - center) <= request.getFrameWindow()
                    && Math.abs(p.y - center) <= request.getFrameWindow()) {
                    inFrame.add(p);
                }
            }
            if (inFrame.size() < request.getMinInFramePoints()) {
                emptyFrames++;
                logger.debug("{} has {} in-frame points, dropped", label, inFrame.size());
                continue;
            }

            double[] x = new double[inFrame.size()];
            double[] y = new double[inFrame.size()];
            for (int i = 0; i < inFrame.size(); i++) {
                x[i] = inFrame.get(i).x;
                y[i] = inFrame.get(i).y;
            }
            builder.add(label, request.getShot(), request.getTime(), seed.getR(), seed.getZ(),
                request.getCalibrationPhi(), curve.size(), x, y);
        }

        FieldLineMappingResult result = new FieldLineMappingResult(builder.build(), attempted, tracerErrors,
            fallbacks, emptyFrames);
        logger.info("Field line mapping finished: {}", result);
        return result;
    }

    private TraceResult trace(FieldLineMappingRequest request, SeedGrid.Seed seed, double startAzimuth) {
        TraceResult result = tracer.trace(request.getShot(), request.getTime(), seed.getR(), seed.getZ(),
            startAzimuth, request.getTraceStep(), request.getCalibrationPhi());
        return result == null ? TraceResult.failed() : result;
    }

    /**
     * 单条线段：裁剪 → 投影 → 像素坐标
     */
    private List<Point> toPixels(Segment segment, FieldLineViewContext context) {
        CulledView culled = culler.cull(Collections.singletonList(segment), context.getEye(), context.getSpot(),
            -1, -1, context.getCulling());
        if (culled.isEmpty()) {
            return Collections.emptyList();
        }
        ProjectedView projected = projector.project(culled, context.getEye(), context.getPlane(), context.getRotation());
        return context.getPixelTransform().toPixel(projected.getSegment(0));
    }

    /**
     * 固定 R, Z 的纯环向弧，从 phiStart 到 phiStart + span
     */
    static List<PointCyl> toroidalArc(double r, double z, double phiStart, double span, int points) {
        int n = Math.max(points, 2);
        List<PointCyl> arc = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            arc.add(new PointCyl(r, z, phiStart + span * i / (n - 1)));
        }
        return arc;
    }
}
