package com.scholary.wordclip.media;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables {@link FfmpegProperties} to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(FfmpegProperties.class)
public class MediaConfig {}
