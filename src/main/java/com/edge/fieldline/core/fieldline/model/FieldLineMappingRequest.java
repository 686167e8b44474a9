package com.edge.fieldline.core.fieldline.model;

import lombok.Data;

/**
 * 磁力线像素映射请求
 * <p>
 * shot 和 time 都非零时为追踪模式，否则为纯环向解析模式
 */
@Data
public class FieldLineMappingRequest {
    private long shot;
    private double time;
    private SeedGrid grid;
    private double alpha;                  // 视线 alpha，决定期望的 phi 走向
    private double span = 120.0;           // 环向弧跨度（度）
    private double calibrationPhi;         // 种子点所在环向角（度）
    private double traceStep = 1.0;        // 追踪步长（度）
    private int arcPoints = 121;           // 环向弧点数
    private int resolution = 64;           // 像素分辨率
    private double frameWindow = 36.0;     // 画面中心两侧的窗口（像素）
    private int minInFramePoints = 4;

    public boolean isTracerMode() {
        return shot != 0 && time != 0;
    }

    /**
     * 期望的 phi 走向：alpha 的符号，alpha 为 0 时取 +1
     */
    public int expectedSense() {
        return alpha < 0 ? -1 : 1;
    }
}
