package com.edge.fieldline.core.fieldline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.edge.fieldline.core.fieldline.model.FieldLineRecord;

class FieldLineRecordBuilderTest
{
    @Test
    void testPadsToMaximumCount()
    {
        FieldLineRecordBuilder builder = new FieldLineRecordBuilder()
                .add("fieldline0", 0, 0, 0.55, -0.40, 90, 121, new double[] { 1, 2, 3, 4 }, new double[] { 5, 6, 7, 8 })
                .add("fieldline1", 0, 0, 0.56, -0.40, 90, 121, new double[] { 1, 2, 3, 4, 5, 6 },
                        new double[] { 1, 1, 1, 1, 1, 1 });

        assertEquals(6, builder.maxCount());
        List<FieldLineRecord> records = builder.build();
        assertEquals(2, records.size());

        FieldLineRecord first = records.get(0);
        assertEquals(6, first.getCapacity());
        assertEquals(4, first.getCount());
        assertArrayEquals(new double[] { 1, 2, 3, 4, 0, 0 }, first.getX());
        assertArrayEquals(new double[] { 1, 2, 3, 4 }, first.getPixelX());
        assertArrayEquals(new double[] { 5, 6, 7, 8 }, first.getPixelY());
        assertEquals(6, records.get(1).getCount());
    }

    @Test
    void testInputArraysAreCopied()
    {
        double[] x = { 1, 2, 3, 4 };
        FieldLineRecordBuilder builder = new FieldLineRecordBuilder()
                .add("fieldline0", 0, 0, 0.55, -0.40, 90, 121, x, new double[4]);
        x[0] = 99;
        assertEquals(1.0, builder.build().get(0).getPixelX()[0]);
    }

    @Test
    void testEmptyBuilder()
    {
        assertTrue(new FieldLineRecordBuilder().build().isEmpty());
    }

    @Test
    void testMismatchedArraysRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new FieldLineRecordBuilder()
                .add("fieldline0", 0, 0, 0.55, -0.40, 90, 121, new double[3], new double[4]));
    }
}
