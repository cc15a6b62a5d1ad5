package com.example.effectivediff.infrastructure;

import com.example.effectivediff.application.EffectiveDiffProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Entry point for hosts that embed the engine: import this class to get the pipeline and its
 * collaborators as beans, configured from {@code effective-diff.*}.
 */
@Configuration
@ComponentScan(basePackages = "com.example.effectivediff")
@EnableConfigurationProperties(EffectiveDiffProperties.class)
public class EffectiveDiffConfiguration {}
