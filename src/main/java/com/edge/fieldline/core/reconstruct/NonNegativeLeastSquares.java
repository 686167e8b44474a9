package com.edge.fieldline.core.reconstruct;

/**
 * 非负最小二乘 (Lawson-Hanson 主动集法)
 * <p>
 * 求解 min ||A x - b||，约束 x &gt;= 0。内部只使用法方程 AᵀA、Aᵀb，
 * 子问题用部分主元高斯消元求解。
 */
public final class NonNegativeLeastSquares {

    private static final double TOLERANCE = 1e-10;

    private NonNegativeLeastSquares() {
    }

    /**
     * 直接由 A、b 求解
     */
    public static double[] solve(double[][] a, double[] b) {
        int m = a.length;
        if (m != b.length) {
            throw new IllegalArgumentException("Row count " + m + " != rhs length " + b.length);
        }
        int n = m == 0 ? 0 : a[0].length;
        double[][] ata = new double[n][n];
        double[] atb = new double[n];
        for (int r = 0; r < m; r++) {
            double[] row = a[r];
            for (int i = 0; i < n; i++) {
                if (row[i] == 0) {
                    continue;
                }
                atb[i] += row[i] * b[r];
                for (int j = i; j < n; j++) {
                    ata[i][j] += row[i] * row[j];
                }
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < i; j++) {
                ata[i][j] = ata[j][i];
            }
        }
        return solveNormal(ata, atb);
    }

    /**
     * 由法方程求解
     *
     * @param ata AᵀA (n×n，对称)
     * @param atb Aᵀb
     */
    public static double[] solveNormal(double[][] ata, double[] atb) {
        int n = atb.length;
        double[] x = new double[n];
        boolean[] passive = new boolean[n];
        int maxIterations = 3 * n + 10;

        double[] w = gradient(ata, atb, x);
        int iterations = 0;
        while (iterations++ < maxIterations) {
            int t = -1;
            double best = TOLERANCE;
            for (int j = 0; j < n; j++) {
                if (!passive[j] && w[j] > best) {
                    best = w[j];
                    t = j;
                }
            }
            if (t < 0) {
                break;
            }
            passive[t] = true;

            double[] s = solvePassive(ata, atb, passive);
            // 内循环：把变为非正的变量移回零集
            while (true) {
                double alpha = Double.POSITIVE_INFINITY;
                for (int j = 0; j < n; j++) {
                    if (passive[j] && s[j] <= TOLERANCE) {
                        double denom = x[j] - s[j];
                        double ratio = denom > 0 ? x[j] / denom : 0.0;
                        alpha = Math.min(alpha, ratio);
                    }
                }
                if (alpha == Double.POSITIVE_INFINITY) {
                    break;
                }
                for (int j = 0; j < n; j++) {
                    x[j] += alpha * (s[j] - x[j]);
                    if (passive[j] && x[j] <= TOLERANCE) {
                        passive[j] = false;
                        x[j] = 0.0;
                    }
                }
                s = solvePassive(ata, atb, passive);
            }
            System.arraycopy(s, 0, x, 0, n);
            w = gradient(ata, atb, x);
        }
        return x;
    }

    /**
     * w = Aᵀb - AᵀA x
     */
    private static double[] gradient(double[][] ata, double[] atb, double[] x) {
        int n = atb.length;
        double[] w = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = atb[i];
            for (int j = 0; j < n; j++) {
                sum -= ata[i][j] * x[j];
            }
            w[i] = sum;
        }
        return w;
    }

    /**
     * 在主动（正）集上求无约束最小二乘，零集分量为 0
     */
    private static double[] solvePassive(double[][] ata, double[] atb, boolean[] passive) {
        int n = atb.length;
        int[] index = new int[n];
        int k = 0;
        for (int j = 0; j < n; j++) {
            if (passive[j]) {
                index[k++] = j;
            }
        }
        double[][] m = new double[k][k + 1];
        for (int i = 0; i < k; i++) {
            for (int j = 0; j < k; j++) {
                m[i][j] = ata[index[i]][index[j]];
            }
            m[i][k] = atb[index[i]];
        }
        double[] solution = gaussianElimination(m, k);
        double[] s = new double[n];
        for (int i = 0; i < k; i++) {
            s[index[i]] = solution[i];
        }
        return s;
    }

    /**
     * 部分主元高斯消元，增广矩阵 m (k × k+1)；主元过小的变量置 0
     */
    private static double[] gaussianElimination(double[][] m, int k) {
        double scale = 0;
        for (int i = 0; i < k; i++) {
            scale = Math.max(scale, Math.abs(m[i][i]));
        }
        double pivotFloor = Math.max(scale, 1.0) * 1e-14;
        boolean[] singular = new boolean[k];

        for (int col = 0; col < k; col++) {
            int pivot = col;
            for (int r = col + 1; r < k; r++) {
                if (Math.abs(m[r][col]) > Math.abs(m[pivot][col])) {
                    pivot = r;
                }
            }
            double[] tmp = m[col];
            m[col] = m[pivot];
            m[pivot] = tmp;

            if (Math.abs(m[col][col]) < pivotFloor) {
                singular[col] = true;
                continue;
            }
            for (int r = col + 1; r < k; r++) {
                double factor = m[r][col] / m[col][col];
                if (factor == 0) {
                    continue;
                }
                for (int c = col; c <= k; c++) {
                    m[r][c] -= factor * m[col][c];
                }
            }
        }

        double[] x = new double[k];
        for (int i = k - 1; i >= 0; i--) {
            if (singular[i]) {
                x[i] = 0.0;
                continue;
            }
            double sum = m[i][k];
            for (int j = i + 1; j < k; j++) {
                sum -= m[i][j] * x[j];
            }
            x[i] = sum / m[i][i];
        }
        return x;
    }
}
