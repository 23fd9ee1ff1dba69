package com.migration.planning.waveforge.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the configured defaults as a {@link WavePlanningOptions} bean.
 */
@Configuration
@Slf4j
@EnableConfigurationProperties(WavePlanningProperties.class)
public class WavePlanningConfig {

    @Bean
    public WavePlanningOptions defaultWavePlanningOptions(WavePlanningProperties properties) {
        WavePlanningOptions options = properties.toOptions();
        options.validate();
        log.info("[Wave Planning Config] min-size={}, max-size={}, category-waves={}, simple-categories={}, patterns={}",
                options.getMinSize(), options.getMaxSize(), options.isCategoryWaves(),
                options.getSimpleCategories(), options.getPrioritizePatterns().size());
        return options;
    }
}
