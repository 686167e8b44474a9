package com.edge.fieldline.core.sightline;

import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.geometry.model.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 孔径与视线定位器
 * <p>
 * 在硬件几何中查找从孔径（眼点）看去与目标角度最接近的场景点：
 * <ul>
 *   <li>alpha: 水平面内相对径向（指向中心轴）方向的方位角</li>
 *   <li>beta: 相对水平面的仰角</li>
 * </ul>
 * 角度在孔径坐标系中计算：世界绕竖直轴旋转，使眼点位于 +Y 轴上。
 * 该坐标系中 X &gt; 0 的一侧 alpha 为正。
 * <p>
 * 首个匹配即返回（不是全局最优），结果依赖硬件集合的遍历顺序。
 */
@Component
public class ApertureLocator {
    private static final Logger logger = LoggerFactory.getLogger(ApertureLocator.class);

    // alpha 容差（度）
    public static final double ALPHA_TOLERANCE = 1.0;
    // beta 容差（度）
    public static final double BETA_TOLERANCE = 0.3;
    // 候选点距离上限 = 系数 * 眼点在孔径坐标系中的 Y
    public static final double RANGE_FACTOR = 1.5;

    private static final double EPS = 1e-9;

    /**
     * 查找视线目标点
     *
     * @param eye      眼点（笛卡尔）
     * @param alpha    目标 alpha（度）
     * @param beta     目标 beta（度）
     * @param hardware 硬件线段，按给定顺序遍历
     * @return 第一个满足容差的点
     * @throws AlignmentNotFoundException 遍历结束仍无匹配
     */
    public SightlineSpot locate(Point3 eye, double alpha, double beta, List<Segment> hardware) {
        double eyeRadius = eye.normXY();
        // 旋转到孔径坐标系：眼点方位角 -> 90°
        double theta = Math.PI / 2 - Math.atan2(eye.y, eye.x);
        double cos = Math.cos(theta);
        double sin = Math.sin(theta);
        double maxRange = RANGE_FACTOR * eyeRadius;

        int examined = 0;
        for (Segment segment : hardware) {
            List<Point3> points = segment.getPoints();
            for (int i = 0; i < points.size(); i++) {
                Point3 p = points.get(i);
                examined++;

                Point3 v = p.minus(eye);
                double lenXY = v.normXY();
                double len = v.norm();
                if (lenXY < EPS || len < EPS || eyeRadius < EPS || len > maxRange) {
                    continue;
                }

                // -eye_xy · v_xy
                double inward = -(eye.x * v.x + eye.y * v.y) / (lenXY * eyeRadius);
                double side = Math.signum(p.x * cos - p.y * sin);
                double alphaTest = side * Math.toDegrees(Math.acos(clamp(inward)));
                double betaTest = Math.toDegrees(Math.asin(clamp(v.z / len)));

                if (Math.abs(alpha - alphaTest) < ALPHA_TOLERANCE
                    && Math.abs(beta - betaTest) < BETA_TOLERANCE) {
                    SightlineSpot spot = new SightlineSpot(p, segment.getIndex(), i, alphaTest, betaTest);
                    logger.info("Sightline spot located after {} candidates: {}", examined, spot);
                    return spot;
                }
            }
        }

        throw new AlignmentNotFoundException(eye, alpha, beta, examined);
    }

    private static double clamp(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }
}
