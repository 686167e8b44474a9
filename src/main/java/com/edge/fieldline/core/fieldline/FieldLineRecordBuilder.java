package com.edge.fieldline.core.fieldline;

import com.edge.fieldline.core.fieldline.model.FieldLineRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 磁力线记录构建器
 * <p>
 * 逐条累积变长的像素点列表，所有记录加入后才知道最大画面内点数，
 * 此时统一补零到固定容量
 */
public class FieldLineRecordBuilder {
    private final List<Entry> entries = new ArrayList<>();

    public FieldLineRecordBuilder add(String label, long shot, double time, double seedR, double seedZ,
                                      double startPhi, int tracedCount, double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Pixel arrays must have equal length: " + x.length + " vs " + y.length);
        }
        entries.add(new Entry(label, shot, time, seedR, seedZ, startPhi, tracedCount, x.clone(), y.clone()));
        return this;
    }

    public int size() {
        return entries.size();
    }

    public int maxCount() {
        int max = 0;
        for (Entry entry : entries) {
            max = Math.max(max, entry.x.length);
        }
        return max;
    }

    public List<FieldLineRecord> build() {
        int capacity = maxCount();
        List<FieldLineRecord> records = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            records.add(new FieldLineRecord(e.label, e.shot, e.time, e.seedR, e.seedZ, e.startPhi, e.tracedCount,
                e.x.length, Arrays.copyOf(e.x, capacity), Arrays.copyOf(e.y, capacity)));
        }
        return records;
    }

    private static class Entry {
        final String label;
        final long shot;
        final double time;
        final double seedR;
        final double seedZ;
        final double startPhi;
        final int tracedCount;
        final double[] x;
        final double[] y;

        Entry(String label, long shot, double time, double seedR, double seedZ, double startPhi,
              int tracedCount, double[] x, double[] y) {
            this.label = label;
            this.shot = shot;
            this.time = time;
            this.seedR = seedR;
            this.seedZ = seedZ;
            this.startPhi = startPhi;
            this.tracedCount = tracedCount;
            this.x = x;
            this.y = y;
        }
    }
}
