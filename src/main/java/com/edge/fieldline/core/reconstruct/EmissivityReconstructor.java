package com.edge.fieldline.core.reconstruct;

import com.edge.fieldline.core.raster.ImageStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 发射率重建
 * <p>
 * 几何矩阵 G 的每一列是一张展开的磁力线图像，f 为展开的相机帧。
 * 求解带正则化的非负最小二乘：
 * <pre>
 *   min || [G; λI] x - [f; 0] ||,  x &gt;= 0
 * </pre>
 * 法方程为 (GᵀG + λ²I) x = Gᵀf。λ = 0 即普通 NNLS。
 */
@Component
public class EmissivityReconstructor {
    private static final Logger logger = LoggerFactory.getLogger(EmissivityReconstructor.class);

    public ReconstructionResult reconstruct(double[][] frame, ImageStack stack, double smoothing) {
        int n = stack.size();
        int rows = frame.length;
        int cols = rows == 0 ? 0 : frame[0].length;
        if (n > 0 && (stack.getResolution() != rows || stack.getImage(0)[0].length != cols)) {
            throw new IllegalArgumentException(String.format("Frame size %dx%d does not match image size %dx%d",
                rows, cols, stack.getResolution(), stack.getResolution()));
        }
        if (smoothing < 0) {
            throw new IllegalArgumentException("Smoothing parameter must be non-negative: " + smoothing);
        }

        double[][] columns = new double[n][];
        for (int j = 0; j < n; j++) {
            columns[j] = stack.flatten(j);
        }
        double[] f = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(frame[r], 0, f, r * cols, cols);
        }

        // GᵀG + λ²I, Gᵀf
        double[][] ata = new double[n][n];
        double[] atb = new double[n];
        for (int i = 0; i < n; i++) {
            atb[i] = dot(columns[i], f);
            for (int j = i; j < n; j++) {
                double v = dot(columns[i], columns[j]);
                ata[i][j] = v;
                ata[j][i] = v;
            }
            ata[i][i] += smoothing * smoothing;
        }

        double[] x = NonNegativeLeastSquares.solveNormal(ata, atb);

        double[][] reconstructed = new double[rows][cols];
        double[][] residual = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int k = r * cols + c;
                double sum = 0;
                for (int j = 0; j < n; j++) {
                    sum += columns[j][k] * x[j];
                }
                reconstructed[r][c] = sum;
                residual[r][c] = frame[r][c] - sum;
            }
        }

        ReconstructionResult result = new ReconstructionResult(x, reconstructed, residual, smoothing);
        logger.info("Reconstructed frame from {} field lines (smoothing={}), residual rms={}",
            n, smoothing, String.format("%.4f", result.residualRms()));
        return result;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
