package com.edge.fieldline.core.fieldline.model;

import java.util.Arrays;

/**
 * 单条磁力线的像素记录
 * <p>
 * 创建后不可变。x / y 为固定容量数组，超出 count 的部分补 0。
 */
public class FieldLineRecord {
    private final String label;
    private final long shot;
    private final double time;
    private final double seedR;
    private final double seedZ;
    private final double startPhi;
    private final int tracedCount;   // 追踪曲线点数
    private final int count;         // 画面内点数
    private final double[] x;
    private final double[] y;

    public FieldLineRecord(String label, long shot, double time, double seedR, double seedZ, double startPhi,
                           int tracedCount, int count, double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Pixel arrays must have equal length: " + x.length + " vs " + y.length);
        }
        if (count > x.length) {
            throw new IllegalArgumentException("Point count " + count + " exceeds capacity " + x.length);
        }
        this.label = label;
        this.shot = shot;
        this.time = time;
        this.seedR = seedR;
        this.seedZ = seedZ;
        this.startPhi = startPhi;
        this.tracedCount = tracedCount;
        this.count = count;
        this.x = x.clone();
        this.y = y.clone();
    }

    public String getLabel() { return label; }
    public long getShot() { return shot; }
    public double getTime() { return time; }
    public double getSeedR() { return seedR; }
    public double getSeedZ() { return seedZ; }
    public double getStartPhi() { return startPhi; }
    public int getTracedCount() { return tracedCount; }
    public int getCount() { return count; }

    public int getCapacity() {
        return x.length;
    }

    public double[] getX() {
        return x.clone();
    }

    public double[] getY() {
        return y.clone();
    }

    /**
     * 只含有效点的 x（不含补零）
     */
    public double[] getPixelX() {
        return Arrays.copyOf(x, count);
    }

    public double[] getPixelY() {
        return Arrays.copyOf(y, count);
    }

    @Override
    public String toString() {
        return String.format("FieldLineRecord[%s seed=(%.4f, %.4f) traced=%d inFrame=%d]",
            label, seedR, seedZ, tracedCount, count);
    }
}
