package com.edge.fieldline.core.transform;

import com.edge.fieldline.core.geometry.model.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * 像素变换
 * 表示从像平面局部二维坐标到标定像素坐标的线性变换
 * <p>
 * 左下角标定点映射到 (0, 0)，右上角映射到 (n-1, n-1)。
 * 要求像平面旋转已调好，使标定框的边与像素轴对齐。
 */
public class PixelTransform {
    private final double originX;   // 左下角 X
    private final double originY;   // 左下角 Y
    private final double scaleX;    // X 缩放 (像素 / 局部单位)
    private final double scaleY;    // Y 缩放

    public PixelTransform(double originX, double originY, double scaleX, double scaleY) {
        this.originX = originX;
        this.originY = originY;
        this.scaleX = scaleX;
        this.scaleY = scaleY;
    }

    /**
     * 从左下角和右上角标定点计算变换
     *
     * @param bottomLeft 左下角（局部坐标，已旋转）
     * @param topRight   右上角（局部坐标，已旋转）
     * @param resolution 像素分辨率，如 64
     */
    public static PixelTransform fromCorners(Point bottomLeft, Point topRight, int resolution) {
        double width = topRight.x - bottomLeft.x;
        double height = topRight.y - bottomLeft.y;
        if (Math.abs(width) < 1e-15 || Math.abs(height) < 1e-15
            || !Double.isFinite(width) || !Double.isFinite(height)) {
            throw new IllegalArgumentException(
                "Calibration corners do not span a rectangle: " + bottomLeft + " - " + topRight);
        }
        double span = resolution - 1;
        return new PixelTransform(bottomLeft.x, bottomLeft.y, span / width, span / height);
    }

    /**
     * 局部坐标 → 像素坐标
     */
    public Point toPixel(Point local) {
        return new Point((local.x - originX) * scaleX, (local.y - originY) * scaleY);
    }

    /**
     * 像素坐标 → 局部坐标（逆变换）
     */
    public Point fromPixel(Point pixel) {
        return new Point(pixel.x / scaleX + originX, pixel.y / scaleY + originY);
    }

    /**
     * 批量转换局部坐标到像素坐标
     */
    public List<Point> toPixel(List<Point> localPoints) {
        List<Point> result = new ArrayList<>(localPoints.size());
        for (Point p : localPoints) {
            result.add(toPixel(p));
        }
        return result;
    }

    public double getOriginX() { return originX; }
    public double getOriginY() { return originY; }
    public double getScaleX() { return scaleX; }
    public double getScaleY() { return scaleY; }

    @Override
    public String toString() {
        return String.format("PixelTransform[origin=(%.5f,%.5f), scale=(%.2f,%.2f)]",
            originX, originY, scaleX, scaleY);
    }
}
