package com.edge.fieldline.core.fieldline.model;

import com.edge.fieldline.core.culling.CullingParameters;
import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.geometry.model.SegmentStore;
import com.edge.fieldline.core.projection.ImagePlane;
import com.edge.fieldline.core.transform.PixelTransform;

/**
 * 磁力线投影所需的视图上下文（由已构建的视图提供）
 */
public class FieldLineViewContext {
    private final SegmentStore store;
    private final Point3 eye;
    private final Point3 spot;
    private final ImagePlane plane;
    private final CullingParameters culling;
    private final double rotation;
    private final PixelTransform pixelTransform;

    public FieldLineViewContext(SegmentStore store, Point3 eye, Point3 spot, ImagePlane plane,
                                CullingParameters culling, double rotation, PixelTransform pixelTransform) {
        this.store = store;
        this.eye = eye;
        this.spot = spot;
        this.plane = plane;
        this.culling = culling;
        this.rotation = rotation;
        this.pixelTransform = pixelTransform;
    }

    public SegmentStore getStore() { return store; }
    public Point3 getEye() { return eye; }
    public Point3 getSpot() { return spot; }
    public ImagePlane getPlane() { return plane; }
    public CullingParameters getCulling() { return culling; }
    public double getRotation() { return rotation; }
    public PixelTransform getPixelTransform() { return pixelTransform; }
}
