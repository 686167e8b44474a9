package com.edge.fieldline.core.raster;

import com.edge.fieldline.config.NativeLibraryLoader;
import com.edge.fieldline.core.fieldline.model.FieldLineRecord;
import com.edge.fieldline.core.geometry.model.Point;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 磁力线栅格化
 * <p>
 * 每条记录：
 * <ol>
 *   <li>对有效像素点做参数样条重采样（间隔 1.0）</li>
 *   <li>对每个重采样点，距离 &lt;= 核半径的像素赋值 min(上限, 上限 / max(d, 1))，
 *       后写覆盖先写，不累加</li>
 *   <li>均值滤波（窗口 w×w，边缘复制截断，不回绕）</li>
 * </ol>
 * 无随机性，同样输入得到逐位相同的结果。
 */
@Component
public class FieldLineRasterizer {
    private static final Logger logger = LoggerFactory.getLogger(FieldLineRasterizer.class);

    public FieldLineRasterizer() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    public ImageStack rasterize(List<FieldLineRecord> records, RasterParameters params) {
        int n = params.getResolution();
        double[][][] images = new double[records.size()][][];
        for (int i = 0; i < records.size(); i++) {
            double[][] accumulated = accumulate(records.get(i), params);
            images[i] = smooth(accumulated, params.getSmoothingWindow());
        }
        logger.info("Rasterized {} field lines to {}x{} images (window={})",
            records.size(), n, n, params.getSmoothingWindow());
        return new ImageStack(images, records, params.getSmoothingWindow());
    }

    /**
     * 曲线重采样并写入像素
     */
    double[][] accumulate(FieldLineRecord record, RasterParameters params) {
        int n = params.getResolution();
        double radius = params.getKernelRadius();
        double max = params.getMaxIntensity();
        double[][] image = new double[n][n];

        List<Point> curve = ParametricSpline.resample(record.getPixelX(), record.getPixelY(),
            params.getSplineInterval());
        for (Point p : curve) {
            int rowMin = Math.max(0, (int) Math.floor(p.y - radius));
            int rowMax = Math.min(n - 1, (int) Math.ceil(p.y + radius));
            int colMin = Math.max(0, (int) Math.floor(p.x - radius));
            int colMax = Math.min(n - 1, (int) Math.ceil(p.x + radius));
            for (int row = rowMin; row <= rowMax; row++) {
                for (int col = colMin; col <= colMax; col++) {
                    double d = Math.hypot(col - p.x, row - p.y);
                    if (d <= radius) {
                        image[row][col] = Math.min(max, max / Math.max(d, 1.0));
                    }
                }
            }
        }
        return image;
    }

    /**
     * 均值滤波，边缘复制
     */
    double[][] smooth(double[][] image, int window) {
        int rows = image.length;
        int cols = rows == 0 ? 0 : image[0].length;
        if (window <= 1 || rows == 0) {
            return image;
        }

        Mat src = new Mat(rows, cols, CvType.CV_64FC1);
        Mat dst = new Mat();
        try {
            double[] flat = new double[rows * cols];
            for (int r = 0; r < rows; r++) {
                System.arraycopy(image[r], 0, flat, r * cols, cols);
            }
            src.put(0, 0, flat);

            Imgproc.blur(src, dst, new Size(window, window), new org.opencv.core.Point(-1, -1),
                Core.BORDER_REPLICATE);

            dst.get(0, 0, flat);
            double[][] smoothed = new double[rows][cols];
            for (int r = 0; r < rows; r++) {
                System.arraycopy(flat, r * cols, smoothed[r], 0, cols);
            }
            return smoothed;
        } finally {
            src.release();
            dst.release();
        }
    }
}
