package com.edge.fieldline.core.projection;

/**
 * 像平面参数
 */
public class ImagePlaneParameters {
    private final double focalDistance;
    private final int pixelWidth;
    private final int pixelHeight;
    private final double magnification;
    private final double shiftX;   // 像平面平移（与半宽同一缩放单位）
    private final double shiftY;

    public ImagePlaneParameters(double focalDistance, int pixelWidth, int pixelHeight,
                                double magnification, double shiftX, double shiftY) {
        if (focalDistance <= 0) {
            throw new IllegalArgumentException("Focal distance must be positive: " + focalDistance);
        }
        if (pixelWidth <= 0 || pixelHeight <= 0) {
            throw new IllegalArgumentException("Pixel dimensions must be positive: " + pixelWidth + "x" + pixelHeight);
        }
        if (magnification <= 0) {
            throw new IllegalArgumentException("Magnification must be positive: " + magnification);
        }
        this.focalDistance = focalDistance;
        this.pixelWidth = pixelWidth;
        this.pixelHeight = pixelHeight;
        this.magnification = magnification;
        this.shiftX = shiftX;
        this.shiftY = shiftY;
    }

    public double getFocalDistance() { return focalDistance; }
    public int getPixelWidth() { return pixelWidth; }
    public int getPixelHeight() { return pixelHeight; }
    public double getMagnification() { return magnification; }
    public double getShiftX() { return shiftX; }
    public double getShiftY() { return shiftY; }
}
