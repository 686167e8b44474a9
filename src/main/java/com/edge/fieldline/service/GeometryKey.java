package com.edge.fieldline.service;

import lombok.Data;

/**
 * 硬件几何缓存键：视图类型 + 偏滤器位形 + 斜坡瓦片版本
 */
@Data
public class GeometryKey {
    private final String viewKind;
    private final boolean continuousDivertor;
    private final int rampVersion;
}
