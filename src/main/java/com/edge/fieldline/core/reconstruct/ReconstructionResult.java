package com.edge.fieldline.core.reconstruct;

/**
 * 发射率重建结果
 */
public class ReconstructionResult {
    private final double[] emissivity;       // 每条磁力线的相对发射率 (>= 0)
    private final double[][] reconstructed;  // G · x
    private final double[][] residual;       // 原始帧 - 重建
    private final double smoothing;

    public ReconstructionResult(double[] emissivity, double[][] reconstructed, double[][] residual, double smoothing) {
        this.emissivity = emissivity;
        this.reconstructed = reconstructed;
        this.residual = residual;
        this.smoothing = smoothing;
    }

    public double[] getEmissivity() { return emissivity; }
    public double[][] getReconstructed() { return reconstructed; }
    public double[][] getResidual() { return residual; }
    public double getSmoothing() { return smoothing; }

    /**
     * 残差的均方根
     */
    public double residualRms() {
        double sum = 0;
        int count = 0;
        for (double[] row : residual) {
            for (double v : row) {
                sum += v * v;
                count++;
            }
        }
        return count == 0 ? 0.0 : Math.sqrt(sum / count);
    }
}
