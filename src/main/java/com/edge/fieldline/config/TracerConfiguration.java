package com.edge.fieldline.config;

import com.edge.fieldline.core.fieldline.AnalyticFieldLineTracer;
import com.edge.fieldline.core.fieldline.FieldLineTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 磁力线追踪器配置
 * <p>
 * 从 application.yml 读取解析平衡参数；外部提供 FieldLineTracer 时不创建默认实现
 */
@Configuration
public class TracerConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TracerConfiguration.class);

    @Autowired
    private FieldlineProperties properties;

    @Bean
    @ConditionalOnMissingBean(FieldLineTracer.class)
    public FieldLineTracer fieldLineTracer() {
        FieldlineProperties.TracerConfig config = properties.getTracer();
        logger.info("AnalyticFieldLineTracer: axisR={}, axisZ={}, q={}, length={}",
            config.getAxisR(), config.getAxisZ(), config.getSafetyFactor(), config.getTraceLength());
        return new AnalyticFieldLineTracer(config.getAxisR(), config.getAxisZ(),
            config.getSafetyFactor(), config.getTraceLength());
    }
}
