package com.example.framepickr_backend.config;

import com.example.framepickr_backend.detection.DetectorModels;
import com.example.framepickr_backend.service.LocalImageStore;
import com.example.framepickr_backend.service.Interfaces.ImageStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator detectorHealth(DetectorModels models, DetectorProperties properties) {
        // models are loaded at startup or the context never comes up
        return () -> Health.up()
                .withDetail("modelDir", properties.getModelDir())
                .withDetail("face", properties.getFace().getFile())
                .withDetail("eye", properties.getEye().getFile())
                .withDetail("smile", properties.getSmile().getFile())
                .build();
    }

    @Bean
    public HealthIndicator imageStoreHealth(ImageStore store) {
        return () -> {
            if (store instanceof LocalImageStore local) {
                Path root = local.root();
                if (Files.isDirectory(root) && Files.isWritable(root)) {
                    return Health.up().withDetail("backend", "local").withDetail("root", root.toString()).build();
                }
                return Health.down().withDetail("backend", "local").withDetail("root", root.toString()).build();
            }
            return Health.up().withDetail("backend", store.getClass().getSimpleName()).build();
        };
    }
}
