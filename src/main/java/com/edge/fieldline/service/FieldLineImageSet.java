package com.edge.fieldline.service;

import com.edge.fieldline.core.fieldline.model.FieldLineMappingResult;
import com.edge.fieldline.core.raster.ImageStack;

/**
 * 磁力线合成图像：视图、映射统计和图像堆栈
 */
public class FieldLineImageSet {
    private final long shot;
    private final double time;
    private final double startPhi;
    private final ViewGeometry view;
    private final FieldLineMappingResult mapping;
    private final ImageStack stack;

    public FieldLineImageSet(long shot, double time, double startPhi, ViewGeometry view,
                             FieldLineMappingResult mapping, ImageStack stack) {
        this.shot = shot;
        this.time = time;
        this.startPhi = startPhi;
        this.view = view;
        this.mapping = mapping;
        this.stack = stack;
    }

    public long getShot() { return shot; }
    public double getTime() { return time; }
    public double getStartPhi() { return startPhi; }
    public ViewGeometry getView() { return view; }
    public FieldLineMappingResult getMapping() { return mapping; }
    public ImageStack getStack() { return stack; }

    public int getAttempted() {
        return mapping.getAttempted();
    }

    public int getAccepted() {
        return mapping.getAccepted();
    }
}
