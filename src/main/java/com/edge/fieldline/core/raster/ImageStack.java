package com.edge.fieldline.core.raster;

import com.edge.fieldline.core.fieldline.model.FieldLineRecord;

import java.util.Collections;
import java.util.List;

/**
 * 磁力线强度图像堆栈 (N × res × res)
 * <p>
 * 第 n 张图像对应第 n 条记录，images[n][row][col]，row 对应像素 y，col 对应像素 x
 */
public class ImageStack {
    private final double[][][] images;
    private final List<FieldLineRecord> records;
    private final int smoothingWindow;

    public ImageStack(double[][][] images, List<FieldLineRecord> records, int smoothingWindow) {
        if (images.length != records.size()) {
            throw new IllegalArgumentException("Image count " + images.length + " != record count " + records.size());
        }
        this.images = images;
        this.records = Collections.unmodifiableList(records);
        this.smoothingWindow = smoothingWindow;
    }

    public double[][] getImage(int n) {
        return images[n];
    }

    public double[][][] getImages() {
        return images;
    }

    public double getVoxel(int row, int col, int n) {
        return images[n][row][col];
    }

    /**
     * 第 n 张图像按行展开
     */
    public double[] flatten(int n) {
        double[][] image = images[n];
        int rows = image.length;
        int cols = rows == 0 ? 0 : image[0].length;
        double[] flat = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(image[r], 0, flat, r * cols, cols);
        }
        return flat;
    }

    public List<FieldLineRecord> getRecords() { return records; }
    public int getSmoothingWindow() { return smoothingWindow; }

    public int size() {
        return images.length;
    }

    public int getResolution() {
        return images.length == 0 ? 0 : images[0].length;
    }
}
