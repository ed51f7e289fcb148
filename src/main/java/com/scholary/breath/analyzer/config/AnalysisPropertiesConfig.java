package com.scholary.breath.analyzer.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for analysis-related beans.
 *
 * <p>Enables the AnalysisProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(AnalysisProperties.class)
public class AnalysisPropertiesConfig {}
