package com.edge.fieldline.core.fieldline;

import com.edge.fieldline.core.fieldline.model.TraceResult;

/**
 * 磁力线追踪器（外部协作者）
 * <p>
 * 阻塞调用；每个种子点调用一次
 */
public interface FieldLineTracer {
    /**
     * 从种子点追踪一条磁力线
     *
     * @param shot         放电炮号
     * @param time         时刻（秒）
     * @param r            种子 R
     * @param z            种子 Z
     * @param startAzimuth 起始方位（度），决定追踪方向
     * @param step         追踪步长（度）
     * @param phiOffset    种子点所在环向角（度）
     * @return 追踪曲线和错误标志
     */
    TraceResult trace(long shot, double time, double r, double z,
                      double startAzimuth, double step, double phiOffset);
}
