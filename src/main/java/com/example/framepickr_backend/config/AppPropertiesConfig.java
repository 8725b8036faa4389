package com.example.framepickr_backend.config;

import com.example.framepickr_backend.scoring.ScoringWeights;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the preprocessing and scoring configuration properties.
 */
@Configuration
@EnableConfigurationProperties({PreprocessProperties.class, ScoringWeights.class})
public class AppPropertiesConfig {
}
