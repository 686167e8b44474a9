package com.edge.fieldline.service;

import com.edge.fieldline.core.culling.CulledView;
import com.edge.fieldline.core.culling.CullingParameters;
import com.edge.fieldline.core.fieldline.model.FieldLineViewContext;
import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.geometry.model.SegmentStore;
import com.edge.fieldline.core.projection.ImagePlane;
import com.edge.fieldline.core.projection.ProjectedView;
import com.edge.fieldline.core.sightline.SightlineSpot;
import com.edge.fieldline.core.transform.PixelTransform;

/**
 * 一次视图构建的结果
 */
public class ViewGeometry {
    private final SegmentStore store;
    private final Point3 eye;
    private final SightlineSpot spot;
    private final ImagePlane plane;
    private final CullingParameters culling;
    private final double rotation;
    private final CulledView culled;
    private final ProjectedView projected;
    private final PixelTransform pixelTransform;

    public ViewGeometry(SegmentStore store, Point3 eye, SightlineSpot spot, ImagePlane plane,
                        CullingParameters culling, double rotation, CulledView culled,
                        ProjectedView projected, PixelTransform pixelTransform) {
        this.store = store;
        this.eye = eye;
        this.spot = spot;
        this.plane = plane;
        this.culling = culling;
        this.rotation = rotation;
        this.culled = culled;
        this.projected = projected;
        this.pixelTransform = pixelTransform;
    }

    /**
     * 供磁力线映射使用的上下文
     */
    public FieldLineViewContext toFieldLineContext() {
        return new FieldLineViewContext(store, eye, spot.getPoint(), plane, culling, rotation, pixelTransform);
    }

    public SegmentStore getStore() { return store; }
    public Point3 getEye() { return eye; }
    public SightlineSpot getSpot() { return spot; }
    public ImagePlane getPlane() { return plane; }
    public CullingParameters getCulling() { return culling; }
    public double getRotation() { return rotation; }
    public CulledView getCulled() { return culled; }
    public ProjectedView getProjected() { return projected; }
    public PixelTransform getPixelTransform() { return pixelTransform; }
}
