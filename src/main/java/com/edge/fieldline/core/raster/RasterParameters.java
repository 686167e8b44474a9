package com.edge.fieldline.core.raster;

/**
 * 栅格化参数
 */
public class RasterParameters {
    private final int resolution;
    private final int smoothingWindow;
    private final double kernelRadius;
    private final double maxIntensity;
    private final double splineInterval;

    public RasterParameters(int resolution, int smoothingWindow, double kernelRadius,
                            double maxIntensity, double splineInterval) {
        if (resolution < 1) {
            throw new IllegalArgumentException("Resolution must be positive: " + resolution);
        }
        if (smoothingWindow < 1) {
            throw new IllegalArgumentException("Smoothing window must be at least 1: " + smoothingWindow);
        }
        if (kernelRadius < 0 || splineInterval <= 0) {
            throw new IllegalArgumentException(
                "Invalid kernel radius / spline interval: " + kernelRadius + " / " + splineInterval);
        }
        this.resolution = resolution;
        this.smoothingWindow = smoothingWindow;
        this.kernelRadius = kernelRadius;
        this.maxIntensity = maxIntensity;
        this.splineInterval = splineInterval;
    }

    /**
     * 默认参数：64×64，平滑窗口 7，核半径 2 像素，强度上限 1000，样条间隔 1.0
     */
    public static RasterParameters defaults() {
        return new RasterParameters(64, 7, 2.0, 1000.0, 1.0);
    }

    public int getResolution() { return resolution; }
    public int getSmoothingWindow() { return smoothingWindow; }
    public double getKernelRadius() { return kernelRadius; }
    public double getMaxIntensity() { return maxIntensity; }
    public double getSplineInterval() { return splineInterval; }
}
