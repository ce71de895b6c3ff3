package com.scholary.wordclip.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables {@link WordclipProperties} to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(WordclipProperties.class)
public class WordclipConfig {}
