package com.edge.fieldline.core.reconstruct;

/**
 * 单条磁力线图像与相机帧的相关系数
 */
public class CorrelationScore {
    private final int index;       // 在图像堆栈中的序号
    private final String label;
    private final double seedR;
    private final double seedZ;
    private final double score;

    public CorrelationScore(int index, String label, double seedR, double seedZ, double score) {
        this.index = index;
        this.label = label;
        this.seedR = seedR;
        this.seedZ = seedZ;
        this.score = score;
    }

    public int getIndex() { return index; }
    public String getLabel() { return label; }
    public double getSeedR() { return seedR; }
    public double getSeedZ() { return seedZ; }
    public double getScore() { return score; }

    @Override
    public String toString() {
        return String.format("%s(R=%.4f, Z=%.4f): %.4f", label, seedR, seedZ, score);
    }
}
