package com.brados.backend.progression.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ProgressionProperties.class)
public class ProgressionConfig {}
