package com.edge.fieldline.core.fieldline.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 偏滤器上的种子点矩形网格 (R × Z)
 * <p>
 * 网格索引 k = i * zCount + j，i 为 R 方向序号，j 为 Z 方向序号
 */
public class SeedGrid {
    private final double rMin;
    private final double rMax;
    private final int rCount;
    private final double zMin;
    private final double zMax;
    private final int zCount;

    public SeedGrid(double rMin, double rMax, int rCount, double zMin, double zMax, int zCount) {
        if (rCount < 1 || zCount < 1) {
            throw new IllegalArgumentException("Seed grid dimensions must be positive: " + rCount + "x" + zCount);
        }
        this.rMin = rMin;
        this.rMax = rMax;
        this.rCount = rCount;
        this.zMin = zMin;
        this.zMax = zMax;
        this.zCount = zCount;
    }

    public List<Seed> seeds() {
        List<Seed> seeds = new ArrayList<>(size());
        for (int i = 0; i < rCount; i++) {
            for (int j = 0; j < zCount; j++) {
                seeds.add(new Seed(i * zCount + j, i, j, linspace(rMin, rMax, rCount, i), linspace(zMin, zMax, zCount, j)));
            }
        }
        return seeds;
    }

    public int size() {
        return rCount * zCount;
    }

    private static double linspace(double min, double max, int count, int i) {
        if (count == 1) {
            return min;
        }
        return min + (max - min) * i / (count - 1);
    }

    public int getRCount() { return rCount; }
    public int getZCount() { return zCount; }

    /**
     * 单个种子点
     */
    public static class Seed {
        private final int index;
        private final int row;
        private final int column;
        private final double r;
        private final double z;

        public Seed(int index, int row, int column, double r, double z) {
            this.index = index;
            this.row = row;
            this.column = column;
            this.r = r;
            this.z = z;
        }

        public int getIndex() { return index; }
        public int getRow() { return row; }
        public int getColumn() { return column; }
        public double getR() { return r; }
        public double getZ() { return z; }
    }
}
