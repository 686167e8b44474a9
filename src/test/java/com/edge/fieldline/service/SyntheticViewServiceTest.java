package com.edge.fieldline.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.util.FileSystemUtils;

import com.edge.fieldline.TestGeometry;
import com.edge.fieldline.core.fieldline.CalibrationCornerGenerator;
import com.edge.fieldline.core.fieldline.AnalyticFieldLineTracer;
import com.edge.fieldline.core.fieldline.FieldLineTracer;
import com.edge.fieldline.core.geometry.model.SegmentKind;
import com.edge.fieldline.core.reconstruct.CorrelationScore;
import com.edge.fieldline.core.reconstruct.ReconstructionResult;
import com.edge.fieldline.core.sightline.AlignmentNotFoundException;
import com.edge.fieldline.model.FieldLineImageArchive;
import com.edge.fieldline.repository.FieldLineImageRepository;

@SpringBootTest(properties = {
        "edge-fieldline.fieldline.calibration-phi=90",
        "edge-fieldline.output.directory=target/test-fieldline-images" })
class SyntheticViewServiceTest
{
    @MockitoBean
    private HardwareGeometrySource geometrySource;

    @Autowired
    private HardwareGeometryCache geometryCache;

    @Autowired
    private SyntheticViewService viewService;

    @Autowired
    private FieldLineImageRepository repository;

    @Autowired
    private FieldLineTracer tracer;

    @Autowired
    private FrameAnalysisService frameAnalysis;

    @BeforeEach
    void setUp() throws Exception
    {
        geometryCache.invalidateAll();
        FileSystemUtils.deleteRecursively(repository.getDirectory());
        when(geometrySource.loadHardwareGeometry(anyString(), anyBoolean())).thenReturn(TestGeometry.floorRings());
    }

    @Test
    void testDefaultTracerIsAnalytic()
    {
        assertTrue(tracer instanceof AnalyticFieldLineTracer);
    }

    @Test
    void testBuildView()
    {
        ViewGeometry view = viewService.buildView();

        assertEquals(47 + 4, view.getStore().size());
        assertEquals(4, view.getStore().getSegments(SegmentKind.CALIBRATION).size());
        assertFalse(view.getCulled().isEmpty());
        assertTrue(view.getCulled().hasSpot());
        assertEquals(view.getCulled().size(), view.getProjected().size());
        assertNotNull(view.getStore().findByLabel(CalibrationCornerGenerator.TOP_RIGHT));
        assertEquals(63.0 / (2 * view.getPlane().getHalfWidth()), view.getPixelTransform().getScaleX(), 1e-6);
    }

    @Test
    void testSynthesizeInToroidalMode()
    {
        FieldLineImageSet images = viewService.synthesize();

        assertEquals(22, images.getAttempted());
        assertTrue(images.getAccepted() > 0);
        assertEquals(images.getAccepted(), images.getStack().size());
        assertEquals(64, images.getStack().getResolution());
        assertEquals(22, images.getView().getStore().getSegments(SegmentKind.FIELD_LINE).size());
    }

    @Test
    void testSynthesizeAndSave() throws Exception
    {
        Path file = viewService.synthesizeAndSave();

        assertNotNull(file);
        assertTrue(Files.exists(file));
        FieldLineImageArchive archive = repository.load(0, 0.0);
        assertEquals(archive.getRecords().size(), archive.getImages().length);
        assertEquals(archive.getRecords().size(), archive.getSeedR().length);
        assertEquals(7, archive.getSmoothingWindow());
        assertEquals(90.0, archive.getStartPhi());
    }

    @Test
    void testAlignmentFailureWritesNothing()
    {
        when(geometrySource.loadHardwareGeometry(anyString(), anyBoolean())).thenReturn(Collections.emptyList());

        assertThrows(AlignmentNotFoundException.class, () -> viewService.synthesizeAndSave());
        assertFalse(repository.exists(0, 0.0));
    }

    @Test
    void testFrameAnalysisAgainstSavedArchive() throws Exception
    {
        viewService.synthesizeAndSave();
        FieldLineImageArchive archive = repository.load(0, 0.0);
        double[][] frame = archive.getImages()[0];

        List<CorrelationScore> scores = frameAnalysis.rank(frame, 0, 0.0);
        assertEquals(archive.getRecords().size(), scores.size());
        assertEquals(1.0, scores.get(0).getScore(), 1e-9);

        ReconstructionResult result = frameAnalysis.reconstruct(frame, 0, 0.0);
        assertEquals(archive.getRecords().size(), result.getEmissivity().length);
        for (double e : result.getEmissivity())
        {
            assertTrue(e >= 0);
        }
    }
}
