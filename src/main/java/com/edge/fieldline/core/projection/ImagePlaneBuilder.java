package com.edge.fieldline.core.projection;

import com.edge.fieldline.core.geometry.model.Point3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 像平面构建器
 * <p>
 * 原点 = eye - f * unit(eye - spot)，即沿视线从眼点向 spot 方向偏移焦距，
 * 像平面位于眼点前方，成像不倒置。
 * <p>
 * 坐标轴由两个独立约束确定：
 * <ul>
 *   <li>Z 轴：spot → eye 方向（精确满足）</li>
 *   <li>X 轴提示：原点在水平面上的径向方向 (ox, oy, 0)（近似，不要求与 Z 正交）</li>
 * </ul>
 * Gram-Schmidt 正交化：Y = normalize(Z × X_hint)，X = Y × Z。
 * <p>
 * 局部矩形半宽 = 0.05 / magnification，半高 = 半宽 * pixelHeight / pixelWidth。
 */
@Component
public class ImagePlaneBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ImagePlaneBuilder.class);

    public static final double BASE_HALF_WIDTH = 0.05;

    private static final Point3 VERTICAL = new Point3(0, 0, 1);

    public ImagePlane build(Point3 eye, Point3 spot, ImagePlaneParameters params) {
        Point3 zAxis = eye.minus(spot).normalize();
        if (zAxis == null) {
            throw new IllegalArgumentException("Eye and spot coincide, image plane is undefined");
        }
        Point3 origin = eye.minus(zAxis.scale(params.getFocalDistance()));

        Point3 xHint = new Point3(origin.x, origin.y, 0).normalize();
        Point3 yAxis = xHint == null ? null : zAxis.cross(xHint).normalize();
        if (yAxis == null) {
            // 视线与径向平行或原点在中心轴上，改用竖直方向作提示
            logger.warn("Radial axis hint is degenerate for sightline {}, using vertical hint", zAxis);
            yAxis = zAxis.cross(VERTICAL).normalize();
            if (yAxis == null) {
                yAxis = zAxis.cross(new Point3(1, 0, 0)).normalize();
            }
        }
        Point3 xAxis = yAxis.cross(zAxis);

        double scale = BASE_HALF_WIDTH / params.getMagnification();
        double halfWidth = scale;
        double halfHeight = scale * params.getPixelHeight() / params.getPixelWidth();

        ImagePlane plane = new ImagePlane(origin, xAxis, yAxis, zAxis, halfWidth, halfHeight,
            params.getShiftX() * scale, params.getShiftY() * scale);
        logger.info("Image plane built: {}", plane);
        return plane;
    }
}
