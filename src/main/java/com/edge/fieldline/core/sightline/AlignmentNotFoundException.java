package com.edge.fieldline.core.sightline;

import com.edge.fieldline.core.geometry.model.Point3;

/**
 * 没有任何硬件点在容差内匹配所需的 alpha / beta
 * <p>
 * 对整个视图构建是致命错误，不产生任何部分结果
 */
public class AlignmentNotFoundException extends RuntimeException {
    private final Point3 eye;
    private final double alpha;
    private final double beta;
    private final int candidatesExamined;

    public AlignmentNotFoundException(Point3 eye, double alpha, double beta, int candidatesExamined) {
        super(String.format(
            "Sightline alignment failed: no aligning hardware point found for alpha=%.2f°, beta=%.2f° "
                + "from eye %s (%d candidates examined)",
            alpha, beta, eye, candidatesExamined));
        this.eye = eye;
        this.alpha = alpha;
        this.beta = beta;
        this.candidatesExamined = candidatesExamined;
    }

    public Point3 getEye() { return eye; }
    public double getAlpha() { return alpha; }
    public double getBeta() { return beta; }
    public int getCandidatesExamined() { return candidatesExamined; }
}
