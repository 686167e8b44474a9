package com.edge.fieldline.repository;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.edge.fieldline.config.FieldlineProperties;
import com.edge.fieldline.core.fieldline.FieldLineRecordBuilder;
import com.edge.fieldline.core.fieldline.model.FieldLineRecord;
import com.edge.fieldline.core.raster.ImageStack;
import com.edge.fieldline.model.FieldLineImageArchive;

class FieldLineImageRepositoryTest
{
    @TempDir
    Path tempDir;

    private FieldLineImageRepository repository;

    @BeforeEach
    void setUp()
    {
        FieldlineProperties properties = new FieldlineProperties();
        properties.getOutput().setDirectory(tempDir.resolve("archives").toString());
        repository = new FieldLineImageRepository(properties);
    }

    private static ImageStack stack()
    {
        List<FieldLineRecord> records = new FieldLineRecordBuilder()
                .add("fieldline3", 30000, 0.25, 0.58, -0.40, 90, 121, new double[] { 1, 2, 3, 4, 5 },
                        new double[] { 6, 7, 8, 9, 10 })
                .add("fieldline7", 30000, 0.25, 0.60, -0.38, 90, 80, new double[] { 1, 2, 3, 4 },
                        new double[] { 4, 3, 2, 1 })
                .build();
        double[][][] images = new double[2][4][4];
        images[0][1][2] = 125.5;
        images[1][3][3] = 7.0;
        return new ImageStack(images, records, 7);
    }

    @Test
    void testSaveAndLoad() throws Exception
    {
        FieldLineImageArchive archive = FieldLineImageArchive.of(30000, 0.25, 90.0, stack());
        Path file = repository.save(archive);

        assertEquals("fl_images_30000_0.25.json", file.getFileName().toString());
        assertTrue(Files.exists(file));
        assertFalse(Files.exists(file.resolveSibling(file.getFileName() + ".tmp")));
        assertTrue(repository.exists(30000, 0.25));

        FieldLineImageArchive loaded = repository.load(30000, 0.25);
        assertEquals(30000, loaded.getShot());
        assertEquals(0.25, loaded.getTime());
        assertEquals(7, loaded.getSmoothingWindow());
        assertEquals(90.0, loaded.getStartPhi());
        assertArrayEquals(new double[] { 0.58, 0.60 }, loaded.getSeedR());
        assertArrayEquals(new double[] { -0.40, -0.38 }, loaded.getSeedZ());
        assertEquals(125.5, loaded.getImages()[0][1][2]);
        assertNotNull(loaded.getCreatedAt());

        FieldLineRecord record = loaded.getRecords().get(1);
        assertEquals("fieldline7", record.getLabel());
        assertEquals(4, record.getCount());
        assertEquals(5, record.getCapacity());
        assertArrayEquals(new double[] { 4, 3, 2, 1 }, record.getPixelY());

        ImageStack restored = loaded.toImageStack();
        assertEquals(2, restored.size());
        assertEquals(7.0, restored.getVoxel(3, 3, 1));
    }

    @Test
    void testLoadMissingArchive()
    {
        assertThrows(FileNotFoundException.class, () -> repository.load(1, 1.0));
        assertFalse(repository.exists(1, 1.0));
    }
}
