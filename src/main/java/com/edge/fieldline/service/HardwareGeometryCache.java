package com.edge.fieldline.service;

import com.edge.fieldline.core.geometry.model.Polyline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 硬件几何缓存
 * <p>
 * 按 {@link GeometryKey} 缓存加载好的折线（不可变），未命中时从 {@link HardwareGeometrySource} 加载。
 * rampVersion &gt; 0 时斜坡瓦片追加在硬件瓦片之后。
 */
@Component
public class HardwareGeometryCache {
    private static final Logger logger = LoggerFactory.getLogger(HardwareGeometryCache.class);

    private final Map<GeometryKey, List<Polyline>> cache = new ConcurrentHashMap<>();

    @Autowired
    private HardwareGeometrySource source;

    public HardwareGeometryCache() {
    }

    public HardwareGeometryCache(HardwareGeometrySource source) {
        this.source = source;
    }

    public List<Polyline> get(GeometryKey key) {
        return cache.computeIfAbsent(key, this::load);
    }

    public boolean contains(GeometryKey key) {
        return cache.containsKey(key);
    }

    public void invalidate(GeometryKey key) {
        if (cache.remove(key) != null) {
            logger.info("Hardware geometry cache entry invalidated: {}", key);
        }
    }

    public void invalidateAll() {
        cache.clear();
        logger.info("Hardware geometry cache cleared");
    }

    public int size() {
        return cache.size();
    }

    private List<Polyline> load(GeometryKey key) {
        logger.info("Hardware geometry cache miss, loading {}", key);
        List<Polyline> polylines = new ArrayList<>(
            source.loadHardwareGeometry(key.getViewKind(), key.isContinuousDivertor()));
        if (key.getRampVersion() > 0) {
            polylines.addAll(source.loadRampedTileGeometry(key.getRampVersion()));
        }
        return Collections.unmodifiableList(polylines);
    }
}
