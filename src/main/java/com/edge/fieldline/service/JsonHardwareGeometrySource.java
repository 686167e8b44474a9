package com.edge.fieldline.service;

import com.edge.fieldline.config.FieldlineProperties;
import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.geometry.model.Polyline;
import com.edge.fieldline.core.geometry.model.SegmentKind;
import com.edge.fieldline.core.transform.CoordinateTransform;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 从 JSON 文件读取硬件几何
 * <p>
 * 文件格式（坐标为柱坐标，phi 为度）：
 * <pre>
 * {"segments": [{"label": "tile1", "color": "grey", "view": "divertor", "divertor": "continuous",
 *                "r": [...], "z": [...], "phi": [...]}]}
 * </pre>
 * view、divertor 可省略，省略时对所有视图 / 位形生效。
 * 路径先按文件系统查找，找不到再按 classpath 查找。
 * 斜坡瓦片文件名中的 {version} 替换为版本号。
 */
@Service
public class JsonHardwareGeometrySource implements HardwareGeometrySource {
    private static final Logger logger = LoggerFactory.getLogger(JsonHardwareGeometrySource.class);

    private static final String DEFAULT_COLOR = "grey";

    private final ObjectMapper objectMapper;

    @Autowired
    private FieldlineProperties properties;

    public JsonHardwareGeometrySource() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    JsonHardwareGeometrySource(FieldlineProperties properties) {
        this();
        this.properties = properties;
    }

    @Override
    public List<Polyline> loadHardwareGeometry(String viewKind, boolean continuousDivertor) {
        String file = properties.getGeometry().getHardwareFile();
        try {
            GeometryFile geometry = read(file);
            List<Polyline> polylines = toPolylines(geometry, viewKind, continuousDivertor, file);
            logger.info("Loaded {} hardware segments from {} (view={}, continuousDivertor={})",
                polylines.size(), file, viewKind, continuousDivertor);
            return polylines;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load hardware geometry: " + file, e);
        }
    }

    @Override
    public List<Polyline> loadRampedTileGeometry(int version) {
        String file = properties.getGeometry().getRampedTileFile().replace("{version}", String.valueOf(version));
        try {
            GeometryFile geometry = read(file);
            List<Polyline> polylines = toPolylines(geometry, null, false, file);
            logger.info("Loaded {} ramped tile segments from {} (version={})", polylines.size(), file, version);
            return polylines;
        } catch (FileNotFoundException e) {
            logger.warn("Ramped tile geometry not found: {}", file);
            return Collections.emptyList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load ramped tile geometry: " + file, e);
        }
    }

    private GeometryFile read(String file) throws IOException {
        Path path = Paths.get(file);
        if (Files.exists(path)) {
            return objectMapper.readValue(path.toFile(), GeometryFile.class);
        }
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(file)) {
            if (in == null) {
                throw new FileNotFoundException(file);
            }
            return objectMapper.readValue(in, GeometryFile.class);
        }
    }

    private List<Polyline> toPolylines(GeometryFile geometry, String viewKind, boolean continuousDivertor,
                                       String file) {
        List<Polyline> polylines = new ArrayList<>();
        if (geometry == null || geometry.getSegments() == null) {
            return polylines;
        }
        String divertor = continuousDivertor ? "continuous" : "segmented";
        for (int i = 0; i < geometry.getSegments().size(); i++) {
            SegmentEntry entry = geometry.getSegments().get(i);
            if (viewKind != null && entry.getView() != null && !entry.getView().equalsIgnoreCase(viewKind)) {
                continue;
            }
            if (viewKind != null && entry.getDivertor() != null && !entry.getDivertor().equalsIgnoreCase(divertor)) {
                continue;
            }
            if (entry.getLabel() == null || entry.getLabel().isEmpty()) {
                throw new IllegalArgumentException("Segment " + i + " in " + file + " has no label");
            }
            if (entry.getR() == null || entry.getZ() == null || entry.getPhi() == null) {
                throw new IllegalArgumentException("Segment " + entry.getLabel() + " in " + file + " is missing r, z or phi");
            }
            double[][] xyz = CoordinateTransform.cylToCart(entry.getR(), entry.getZ(), entry.getPhi());
            List<Point3> points = new ArrayList<>(xyz[0].length);
            for (int k = 0; k < xyz[0].length; k++) {
                points.add(new Point3(xyz[0][k], xyz[1][k], xyz[2][k]));
            }
            String color = entry.getColor() == null ? DEFAULT_COLOR : entry.getColor();
            polylines.add(new Polyline(entry.getLabel(), SegmentKind.HARDWARE, color, points));
        }
        return polylines;
    }

    @Data
    static class GeometryFile {
        private List<SegmentEntry> segments;
    }

    @Data
    static class SegmentEntry {
        private String label;
        private String color;
        private String view;
        private String divertor;
        private double[] r;
        private double[] z;
        private double[] phi;
    }
}
