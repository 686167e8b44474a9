package com.edge.fieldline.service;

import com.edge.fieldline.config.FieldlineProperties;
import com.edge.fieldline.core.culling.CulledView;
import com.edge.fieldline.core.culling.CullingParameters;
import com.edge.fieldline.core.culling.FieldOfViewCuller;
import com.edge.fieldline.core.fieldline.CalibrationCornerGenerator;
import com.edge.fieldline.core.fieldline.FieldLinePixelMapper;
import com.edge.fieldline.core.fieldline.model.FieldLineMappingRequest;
import com.edge.fieldline.core.fieldline.model.FieldLineMappingResult;
import com.edge.fieldline.core.fieldline.model.SeedGrid;
import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.geometry.model.PointCyl;
import com.edge.fieldline.core.geometry.model.SegmentKind;
import com.edge.fieldline.core.geometry.model.SegmentStore;
import com.edge.fieldline.core.projection.ImagePlane;
import com.edge.fieldline.core.projection.ImagePlaneBuilder;
import com.edge.fieldline.core.projection.ImagePlaneParameters;
import com.edge.fieldline.core.projection.ProjectedView;
import com.edge.fieldline.core.projection.Projector;
import com.edge.fieldline.core.raster.FieldLineRasterizer;
import com.edge.fieldline.core.raster.ImageStack;
import com.edge.fieldline.core.raster.RasterParameters;
import com.edge.fieldline.core.sightline.ApertureLocator;
import com.edge.fieldline.core.sightline.SightlineSpot;
import com.edge.fieldline.core.transform.CoordinateTransform;
import com.edge.fieldline.core.transform.PixelTransform;
import com.edge.fieldline.model.FieldLineImageArchive;
import com.edge.fieldline.repository.FieldLineImageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 合成视图服务
 * <p>
 * 流程：硬件几何 → 视线定位 → 像平面 → 标定角点 → 视场裁剪 → 投影 → 磁力线映射 → 栅格化 → 存档。
 * 视线定位失败（AlignmentNotFoundException）时直接抛出，不产生任何输出。
 */
@Service
public class SyntheticViewService {
    private static final Logger logger = LoggerFactory.getLogger(SyntheticViewService.class);

    @Autowired
    private FieldlineProperties properties;

    @Autowired
    private HardwareGeometryCache geometryCache;

    @Autowired
    private ApertureLocator locator;

    @Autowired
    private ImagePlaneBuilder planeBuilder;

    @Autowired
    private CalibrationCornerGenerator cornerGenerator;

    @Autowired
    private FieldOfViewCuller culler;

    @Autowired
    private Projector projector;

    @Autowired
    private FieldLinePixelMapper pixelMapper;

    @Autowired
    private FieldLineRasterizer rasterizer;

    @Autowired
    private FieldLineImageRepository repository;

    /**
     * 构建相机视图（不含磁力线）
     */
    public ViewGeometry buildView() {
        FieldlineProperties.ViewConfig view = properties.getView();
        FieldlineProperties.GeometryConfig geometry = properties.getGeometry();

        GeometryKey key = new GeometryKey(geometry.getViewKind(), geometry.isContinuousDivertor(),
            geometry.getRampVersion());
        SegmentStore store = new SegmentStore();
        store.appendAll(geometryCache.get(key));

        Point3 eye = CoordinateTransform.cylToCart(view.getR(), view.getZ(), view.getPhi());
        SightlineSpot spot = locator.locate(eye, view.getAlpha(), view.getBeta(),
            store.getSegments(SegmentKind.HARDWARE));

        ImagePlaneParameters planeParams = new ImagePlaneParameters(view.getFocalDistance(),
            view.getPixelWidth(), view.getPixelHeight(), view.getMagnification(),
            view.getShiftX(), view.getShiftY());
        ImagePlane plane = planeBuilder.build(eye, spot.getPoint(), planeParams);

        store.appendAll(cornerGenerator.generate(configuredCorners(view), plane));

        CullingParameters culling = new CullingParameters(view.getHalfFov(),
            view.getShadowAngle1(), view.getShadowAngle2());
        CulledView culled = culler.cull(store.getSegments(), eye, spot, culling);
        ProjectedView projected = projector.project(culled, eye, plane, view.getRotation());

        PixelTransform pixelTransform = pixelMapper.calibrate(store, eye, plane, view.getRotation(),
            properties.getRaster().getResolution());

        logger.info("View built: {} segments in store, {} segments / {} points in view",
            store.size(), culled.size(), culled.pointCount());
        return new ViewGeometry(store, eye, spot, plane, culling, view.getRotation(), culled, projected,
            pixelTransform);
    }

    /**
     * 构建视图并生成磁力线图像堆栈
     */
    public FieldLineImageSet synthesize() {
        ViewGeometry view = buildView();
        FieldLineMappingRequest request = buildRequest();
        FieldLineMappingResult mapping = pixelMapper.map(request, view.toFieldLineContext());

        ImageStack stack = rasterizer.rasterize(mapping.getRecords(), rasterParameters());
        logger.info("Synthesized {} field line images ({} attempted)", stack.size(), mapping.getAttempted());
        return new FieldLineImageSet(request.getShot(), request.getTime(), request.getCalibrationPhi(),
            view, mapping, stack);
    }

    /**
     * 合成并写入存档
     *
     * @return 存档路径；output.save 为 false 时返回 null
     */
    public Path synthesizeAndSave() throws IOException {
        FieldLineImageSet images = synthesize();
        if (!properties.getOutput().isSave()) {
            logger.info("Archive saving disabled, {} images not written", images.getStack().size());
            return null;
        }
        FieldLineImageArchive archive = FieldLineImageArchive.of(images.getShot(), images.getTime(),
            images.getStartPhi(), images.getStack());
        return repository.save(archive);
    }

    FieldLineMappingRequest buildRequest() {
        FieldlineProperties.FieldlineConfig config = properties.getFieldline();
        FieldLineMappingRequest request = new FieldLineMappingRequest();
        request.setShot(config.getShot());
        request.setTime(config.getTime());
        request.setAlpha(properties.getView().getAlpha());
        request.setSpan(config.getSpan());
        request.setCalibrationPhi(config.getCalibrationPhi());
        request.setTraceStep(config.getTraceStep());
        request.setArcPoints(config.getArcPoints());
        request.setResolution(properties.getRaster().getResolution());
        request.setFrameWindow(config.getFrameWindow());
        request.setMinInFramePoints(config.getMinInFramePoints());

        // 追踪模式与环向模式使用不同尺寸的种子网格
        int rows = request.isTracerMode() ? config.getTracedRows() : config.getToroidalRows();
        int cols = request.isTracerMode() ? config.getTracedCols() : config.getToroidalCols();
        request.setGrid(new SeedGrid(config.getRMin(), config.getRMax(), rows,
            config.getZMin(), config.getZMax(), cols));
        return request;
    }

    RasterParameters rasterParameters() {
        FieldlineProperties.RasterConfig raster = properties.getRaster();
        return new RasterParameters(raster.getResolution(), raster.getSmoothingWindow(),
            raster.getKernelRadius(), raster.getMaxIntensity(), raster.getSplineInterval());
    }

    private static List<PointCyl> configuredCorners(FieldlineProperties.ViewConfig view) {
        List<PointCyl> corners = new ArrayList<>();
        if (view.getCalibrationCorners() != null) {
            for (FieldlineProperties.CornerConfig corner : view.getCalibrationCorners()) {
                corners.add(new PointCyl(corner.getR(), corner.getZ(), corner.getPhi()));
            }
        }
        return corners;
    }
}
