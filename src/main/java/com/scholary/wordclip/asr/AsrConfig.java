package com.scholary.wordclip.asr;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the ASR client.
 *
 * <p>Enables the AsrProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(AsrProperties.class)
public class AsrConfig {}
