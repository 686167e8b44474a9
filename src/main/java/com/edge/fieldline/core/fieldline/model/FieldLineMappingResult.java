package com.edge.fieldline.core.fieldline.model;

import java.util.Collections;
import java.util.List;

/**
 * 磁力线像素映射结果及统计
 */
public class FieldLineMappingResult {
    private final List<FieldLineRecord> records;
    private final int attempted;
    private final int tracerErrors;
    private final int toroidalFallbacks;
    private final int emptyFrames;

    public FieldLineMappingResult(List<FieldLineRecord> records, int attempted, int tracerErrors,
                                  int toroidalFallbacks, int emptyFrames) {
        this.records = Collections.unmodifiableList(records);
        this.attempted = attempted;
        this.tracerErrors = tracerErrors;
        this.toroidalFallbacks = toroidalFallbacks;
        this.emptyFrames = emptyFrames;
    }

    public List<FieldLineRecord> getRecords() { return records; }
    public int getAttempted() { return attempted; }
    public int getTracerErrors() { return tracerErrors; }
    public int getToroidalFallbacks() { return toroidalFallbacks; }
    public int getEmptyFrames() { return emptyFrames; }

    public int getAccepted() {
        return records.size();
    }

    @Override
    public String toString() {
        return String.format("FieldLineMapping[attempted=%d, accepted=%d, tracerErrors=%d, fallbacks=%d, emptyFrames=%d]",
            attempted, records.size(), tracerErrors, toroidalFallbacks, emptyFrames);
    }
}
