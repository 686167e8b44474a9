package com.edge.fieldline.core.fieldline;

import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.geometry.model.PointCyl;
import com.edge.fieldline.core.geometry.model.Polyline;
import com.edge.fieldline.core.geometry.model.SegmentKind;
import com.edge.fieldline.core.projection.ImagePlane;
import com.edge.fieldline.core.transform.CoordinateTransform;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 标定角点生成器
 * <p>
 * 生成四条 L 形角点标记线段，顶点（索引 {@link #VERTEX_INDEX}）即角点锚点。
 * 锚点取配置的 (R, Z, phi) 角点，未配置时取像平面矩形的四角。
 * 标记两臂沿像平面 X / Y 轴指向画面内部。
 */
@Component
public class CalibrationCornerGenerator {

    public static final String BOTTOM_LEFT = "corner-bl";
    public static final String BOTTOM_RIGHT = "corner-br";
    public static final String TOP_RIGHT = "corner-tr";
    public static final String TOP_LEFT = "corner-tl";

    public static final int VERTEX_INDEX = 1;

    // 臂长占矩形宽度的比例
    private static final double ARM_FRACTION = 0.1;

    private static final List<String> LABELS = Arrays.asList(BOTTOM_LEFT, BOTTOM_RIGHT, TOP_RIGHT, TOP_LEFT);
    // 每个角的臂方向 (X 符号, Y 符号)
    private static final int[][] ARM_SIGNS = {{1, 1}, {-1, 1}, {-1, -1}, {1, -1}};

    /**
     * 以像平面矩形四角为锚点
     */
    public List<Polyline> generate(ImagePlane plane) {
        return markers(plane.getSceneCorners(), plane);
    }

    /**
     * 以配置的角点为锚点
     *
     * @param corners 顺序 [BL, BR, TR, TL]
     */
    public List<Polyline> generate(List<PointCyl> corners, ImagePlane plane) {
        if (corners == null || corners.isEmpty()) {
            return generate(plane);
        }
        if (corners.size() != 4) {
            throw new IllegalArgumentException("Exactly 4 calibration corners are required, got " + corners.size());
        }
        return markers(CoordinateTransform.cylToCart(corners), plane);
    }

    private List<Polyline> markers(List<Point3> anchors, ImagePlane plane) {
        double arm = 2 * plane.getHalfWidth() * ARM_FRACTION;
        List<Polyline> markers = new ArrayList<>(4);
        for (int i = 0; i < 4; i++) {
            Point3 anchor = anchors.get(i);
            Point3 armX = plane.getXAxis().scale(ARM_SIGNS[i][0] * arm);
            Point3 armY = plane.getYAxis().scale(ARM_SIGNS[i][1] * arm);
            markers.add(new Polyline(LABELS.get(i), SegmentKind.CALIBRATION, "yellow",
                Arrays.asList(anchor.plus(armX), anchor, anchor.plus(armY))));
        }
        return markers;
    }
}
