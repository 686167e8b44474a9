package com.edge.fieldline.core.geometry.model;

/**
 * 线段来源分类
 */
public enum SegmentKind {
    HARDWARE,       // 壁面瓦片 / 硬件
    CALIBRATION,    // 标定角点标记
    FIELD_LINE      // 磁力线
}
