package com.edge.fieldline.service;

import com.edge.fieldline.core.geometry.model.Polyline;

import java.util.List;

/**
 * 硬件几何来源
 * 返回笛卡尔坐标的瓦片折线，顺序即线段存储中的索引顺序
 */
public interface HardwareGeometrySource {

    /**
     * 加载指定视图的第一壁/偏滤器瓦片几何
     *
     * @param viewKind           相机视图类型
     * @param continuousDivertor 是否为连续偏滤器位形
     */
    List<Polyline> loadHardwareGeometry(String viewKind, boolean continuousDivertor);

    /**
     * 加载斜坡瓦片几何；该版本不存在时返回空列表
     */
    List<Polyline> loadRampedTileGeometry(int version);
}
