package com.edge.fieldline.service;

import com.edge.fieldline.config.FieldlineProperties;
import com.edge.fieldline.core.raster.ImageStack;
import com.edge.fieldline.core.reconstruct.CorrelationScore;
import com.edge.fieldline.core.reconstruct.CrossCorrelationRanker;
import com.edge.fieldline.core.reconstruct.EmissivityReconstructor;
import com.edge.fieldline.core.reconstruct.ReconstructionResult;
import com.edge.fieldline.model.FieldLineImageArchive;
import com.edge.fieldline.repository.FieldLineImageRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * 相机帧分析：与存档的磁力线图像做互相关排序和发射率重建
 */
@Service
public class FrameAnalysisService {

    @Autowired
    private FieldlineProperties properties;

    @Autowired
    private FieldLineImageRepository repository;

    @Autowired
    private CrossCorrelationRanker ranker;

    @Autowired
    private EmissivityReconstructor reconstructor;

    public List<CorrelationScore> rank(double[][] frame, long shot, double time) throws IOException {
        return ranker.rank(frame, loadStack(shot, time));
    }

    public List<CorrelationScore> rank(double[][] frame, ImageStack stack) {
        return ranker.rank(frame, stack);
    }

    public ReconstructionResult reconstruct(double[][] frame, long shot, double time) throws IOException {
        return reconstruct(frame, loadStack(shot, time));
    }

    public ReconstructionResult reconstruct(double[][] frame, ImageStack stack) {
        return reconstructor.reconstruct(frame, stack, properties.getReconstruction().getSmoothing());
    }

    private ImageStack loadStack(long shot, double time) throws IOException {
        FieldLineImageArchive archive = repository.load(shot, time);
        return archive.toImageStack();
    }
}
