package com.edge.fieldline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "edge-fieldline")
public class FieldlineProperties {
    private ViewConfig view = new ViewConfig();
    private GeometryConfig geometry = new GeometryConfig();
    private FieldlineConfig fieldline = new FieldlineConfig();
    private RasterConfig raster = new RasterConfig();
    private TracerConfig tracer = new TracerConfig();
    private ReconstructionConfig reconstruction = new ReconstructionConfig();
    private OutputConfig output = new OutputConfig();
    private boolean runOnStartup = false;

    @Data
    public static class ViewConfig {
        // 孔径位置（柱坐标，phi 为度）
        private double r = 1.0;
        private double z = -0.252;
        private double phi = 11.0;
        // 视线角度（度）
        private double alpha = -34.0;
        private double beta = -14.0;
        private double halfFov = 15.0;
        private double shadowAngle1 = 60.0;
        private double shadowAngle2 = 60.0;
        private double focalDistance = 0.3;
        private double magnification = 1.0;
        private int pixelWidth = 64;
        private int pixelHeight = 64;
        private double rotation = 0.0;     // 像平面内旋转（度）
        private double shiftX = 0.0;
        private double shiftY = 0.0;
        // 可选的标定角点（左下、右下、右上、左上），为空时使用像平面四角
        private List<CornerConfig> calibrationCorners = new ArrayList<>();
    }

    @Data
    public static class CornerConfig {
        private double r;
        private double z;
        private double phi;
    }

    @Data
    public static class GeometryConfig {
        private String viewKind = "divertor";
        private boolean continuousDivertor = false;
        private int rampVersion = 0;               // 0 表示不加载斜坡瓦片
        private String hardwareFile = "geometry/hardware.json";
        private String rampedTileFile = "geometry/ramped-tiles.json";
    }

    @Data
    public static class FieldlineConfig {
        private long shot = 0;
        private double time = 0.0;
        private double span = 120.0;
        private double calibrationPhi = 0.0;
        private double traceStep = 1.0;
        private int arcPoints = 121;
        private double frameWindow = 36.0;
        private int minInFramePoints = 4;
        // 种子网格
        private double rMin = 0.55;
        private double rMax = 0.65;
        private double zMin = -0.40;
        private double zMax = -0.38;
        private int tracedRows = 21;
        private int tracedCols = 5;
        private int toroidalRows = 11;
        private int toroidalCols = 2;
    }

    @Data
    public static class RasterConfig {
        private int resolution = 64;
        private int smoothingWindow = 7;
        private double kernelRadius = 2.0;
        private double maxIntensity = 1000.0;
        private double splineInterval = 1.0;
    }

    @Data
    public static class TracerConfig {
        // 内置解析追踪器：圆截面磁面，常数安全因子
        private double axisR = 0.85;
        private double axisZ = 0.0;
        private double safetyFactor = 3.0;
        private double traceLength = 360.0;   // 环向追踪长度（度）
    }

    @Data
    public static class ReconstructionConfig {
        private double smoothing = 5000.0;
    }

    @Data
    public static class OutputConfig {
        private String directory = "data/fieldline-images";
        private boolean save = true;
    }
}
