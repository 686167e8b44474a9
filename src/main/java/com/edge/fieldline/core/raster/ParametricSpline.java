package com.edge.fieldline.core.raster;

import com.edge.fieldline.core.geometry.model.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * 参数化三次样条
 * <p>
 * 以累计弦长为参数，对 x(t)、y(t) 分别做自然三次样条插值，
 * 再按固定参数间隔重采样。相邻重复点先去除。
 */
public final class ParametricSpline {

    private ParametricSpline() {
    }

    /**
     * 重采样
     *
     * @param xs       原始 x
     * @param ys       原始 y
     * @param interval 参数间隔（像素）
     * @return 重采样点，包含首尾两点
     */
    public static List<Point> resample(double[] xs, double[] ys, double interval) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("x and y must have equal length: " + xs.length + " vs " + ys.length);
        }
        if (interval <= 0) {
            throw new IllegalArgumentException("Resampling interval must be positive: " + interval);
        }

        // 去除相邻重复点
        List<double[]> unique = new ArrayList<>(xs.length);
        for (int i = 0; i < xs.length; i++) {
            if (unique.isEmpty()) {
                unique.add(new double[]{xs[i], ys[i]});
                continue;
            }
            double[] last = unique.get(unique.size() - 1);
            if (Math.hypot(xs[i] - last[0], ys[i] - last[1]) > 1e-12) {
                unique.add(new double[]{xs[i], ys[i]});
            }
        }

        List<Point> result = new ArrayList<>();
        int n = unique.size();
        if (n == 0) {
            return result;
        }
        if (n == 1) {
            result.add(new Point(unique.get(0)[0], unique.get(0)[1]));
            return result;
        }

        double[] t = new double[n];
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = unique.get(i)[0];
            y[i] = unique.get(i)[1];
            if (i > 0) {
                t[i] = t[i - 1] + Math.hypot(x[i] - x[i - 1], y[i] - y[i - 1]);
            }
        }

        double[] mx = secondDerivatives(t, x);
        double[] my = secondDerivatives(t, y);

        double end = t[n - 1];
        int samples = (int) Math.floor(end / interval);
        int k = 0;
        for (int s = 0; s <= samples; s++) {
            double tt = s * interval;
            while (k < n - 2 && tt > t[k + 1]) {
                k++;
            }
            result.add(new Point(evaluate(t, x, mx, k, tt), evaluate(t, y, my, k, tt)));
        }
        if (end - samples * interval > 1e-9) {
            result.add(new Point(x[n - 1], y[n - 1]));
        }
        return result;
    }

    /**
     * 自然边界条件下的二阶导数（三对角方程，Thomas 算法）
     */
    private static double[] secondDerivatives(double[] t, double[] v) {
        int n = t.length;
        double[] m = new double[n];
        if (n < 3) {
            return m;
        }
        double[] c = new double[n];
        double[] d = new double[n];
        for (int i = 1; i < n - 1; i++) {
            double h0 = t[i] - t[i - 1];
            double h1 = t[i + 1] - t[i];
            double a = h0;
            double b = 2 * (h0 + h1);
            double rhs = 6 * ((v[i + 1] - v[i]) / h1 - (v[i] - v[i - 1]) / h0);
            double denom = b - a * c[i - 1];
            c[i] = h1 / denom;
            d[i] = (rhs - a * d[i - 1]) / denom;
        }
        for (int i = n - 2; i >= 1; i--) {
            m[i] = d[i] - c[i] * m[i + 1];
        }
        return m;
    }

    private static double evaluate(double[] t, double[] v, double[] m, int k, double tt) {
        double h = t[k + 1] - t[k];
        double a = (t[k + 1] - tt) / h;
        double b = (tt - t[k]) / h;
        return a * v[k] + b * v[k + 1]
            + ((a * a * a - a) * m[k] + (b * b * b - b) * m[k + 1]) * h * h / 6.0;
    }
}
