package com.edge.fieldline.core.reconstruct;

import com.edge.fieldline.config.NativeLibraryLoader;
import com.edge.fieldline.core.fieldline.model.FieldLineRecord;
import com.edge.fieldline.core.raster.ImageStack;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 互相关排序
 * <p>
 * 计算相机帧与每张磁力线合成图像的归一化互相关（皮尔逊相关系数），
 * 按相关系数从高到低排序。任一方为常数图像时相关系数记为 0。
 */
@Component
public class CrossCorrelationRanker {
    private static final Logger logger = LoggerFactory.getLogger(CrossCorrelationRanker.class);

    public CrossCorrelationRanker() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    public List<CorrelationScore> rank(double[][] frame, ImageStack stack) {
        List<CorrelationScore> scores = new ArrayList<>(stack.size());
        Mat frameMat = toMat(frame);
        try {
            for (int n = 0; n < stack.size(); n++) {
                double[][] image = stack.getImage(n);
                if (image.length != frame.length || image[0].length != frame[0].length) {
                    throw new IllegalArgumentException(String.format("Frame size %dx%d does not match image size %dx%d",
                        frame.length, frame[0].length, image.length, image[0].length));
                }
                Mat imageMat = toMat(image);
                try {
                    FieldLineRecord record = stack.getRecords().get(n);
                    scores.add(new CorrelationScore(n, record.getLabel(), record.getSeedR(), record.getSeedZ(),
                        correlation(frameMat, imageMat)));
                } finally {
                    imageMat.release();
                }
            }
        } finally {
            frameMat.release();
        }

        scores.sort(Comparator.comparingDouble(CorrelationScore::getScore).reversed());
        if (!scores.isEmpty()) {
            logger.info("Best correlated field line: {}", scores.get(0));
        }
        return scores;
    }

    /**
     * 皮尔逊相关系数
     */
    double correlation(Mat a, Mat b) {
        Mat da = new Mat();
        Mat db = new Mat();
        try {
            Core.subtract(a, Core.mean(a), da);
            Core.subtract(b, Core.mean(b), db);
            double numerator = Core.sumElems(da.mul(db)).val[0];
            double varA = Core.sumElems(da.mul(da)).val[0];
            double varB = Core.sumElems(db.mul(db)).val[0];
            if (varA <= 0 || varB <= 0) {
                return 0.0;
            }
            return numerator / Math.sqrt(varA * varB);
        } finally {
            da.release();
            db.release();
        }
    }

    static Mat toMat(double[][] image) {
        int rows = image.length;
        int cols = image[0].length;
        Mat mat = new Mat(rows, cols, CvType.CV_64FC1, new Scalar(0));
        double[] flat = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(image[r], 0, flat, r * cols, cols);
        }
        mat.put(0, 0, flat);
        return mat;
    }
}
