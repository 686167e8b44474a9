package com.edge.fieldline.model;

import com.edge.fieldline.core.fieldline.model.FieldLineRecord;
import com.edge.fieldline.core.raster.ImageStack;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 磁力线图像存档（持久化产物）
 * images 按 [n][row][col] 排列，与 records 顺序一致
 */
@Data
public class FieldLineImageArchive {
    private long shot;
    private double time;
    private int smoothingWindow;
    private double startPhi;
    private double[] seedR;
    private double[] seedZ;
    private double[][][] images;
    private List<FieldLineRecord> records = new ArrayList<>();
    private LocalDateTime createdAt;

    public static FieldLineImageArchive of(long shot, double time, double startPhi, ImageStack stack) {
        FieldLineImageArchive archive = new FieldLineImageArchive();
        archive.setShot(shot);
        archive.setTime(time);
        archive.setStartPhi(startPhi);
        archive.setSmoothingWindow(stack.getSmoothingWindow());
        archive.setImages(stack.getImages());
        archive.setRecords(new ArrayList<>(stack.getRecords()));

        double[] r = new double[stack.size()];
        double[] z = new double[stack.size()];
        for (int n = 0; n < stack.size(); n++) {
            r[n] = stack.getRecords().get(n).getSeedR();
            z[n] = stack.getRecords().get(n).getSeedZ();
        }
        archive.setSeedR(r);
        archive.setSeedZ(z);
        archive.setCreatedAt(LocalDateTime.now());
        return archive;
    }

    public ImageStack toImageStack() {
        return new ImageStack(images, records, smoothingWindow);
    }
}
