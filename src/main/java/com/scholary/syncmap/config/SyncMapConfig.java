package com.scholary.syncmap.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for sync map beans.
 *
 * <p>Enables the SyncMapProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(SyncMapProperties.class)
public class SyncMapConfig {}
