package com.edge.fieldline.schedule;

import com.edge.fieldline.core.sightline.AlignmentNotFoundException;
import com.edge.fieldline.service.SyntheticViewService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * 启动时执行一次完整合成
 * 仅在 edge-fieldline.run-on-startup=true 时启用
 */
@Component
@ConditionalOnProperty(prefix = "edge-fieldline", name = "run-on-startup", havingValue = "true")
public class StartupSynthesisRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupSynthesisRunner.class);

    @Autowired
    private SyntheticViewService viewService;

    @Override
    public void run(ApplicationArguments args) {
        logger.info("Starting field line synthesis");
        try {
            Path archive = viewService.synthesizeAndSave();
            if (archive != null) {
                logger.info("Field line synthesis completed: {}", archive);
            } else {
                logger.info("Field line synthesis completed, nothing written");
            }
        } catch (AlignmentNotFoundException e) {
            // 视线定位失败：不写任何文件
            logger.error("Stage 'sightline alignment' failed: {}", e.getMessage());
        } catch (UncheckedIOException e) {
            // 硬件几何文件缺失或无法解析
            logger.error("Stage 'hardware geometry load' failed: {}", e.getMessage());
        } catch (IllegalArgumentException e) {
            logger.error("Stage 'configuration' failed: {}", e.getMessage());
        } catch (IOException e) {
            logger.error("Stage 'archive write' failed", e);
        }
    }
}
