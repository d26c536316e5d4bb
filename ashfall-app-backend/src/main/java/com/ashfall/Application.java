package com.ashfall;

import com.ashfall.config.AshfallProperties;
import com.ashfall.model.LandUseClass;
import com.ashfall.repository.LandUseClassRepository;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

@SpringBootApplication
@EnableConfigurationProperties(AshfallProperties.class)
public class Application {
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

    // MapBiomas Indonesia legend
    @Bean
    CommandLineRunner initLandUseClasses(LandUseClassRepository repo) {
        return args -> {
            if (repo.count() > 0) {
                return;
            }
            repo.saveAll(List.of(
                    new LandUseClass(3, "Forest formation", "#1f8d49"),
                    new LandUseClass(5, "Mangrove", "#04381d"),
                    new LandUseClass(9, "Planted forest", "#7a5900"),
                    new LandUseClass(13, "Other natural vegetation", "#d89f5c"),
                    new LandUseClass(21, "Other agriculture", "#ffefc3"),
                    new LandUseClass(24, "Urban area", "#d4271e"),
                    new LandUseClass(25, "Other non-vegetation", "#db4d4f"),
                    new LandUseClass(30, "Mining pit", "#9c0027"),
                    new LandUseClass(31, "Aquaculture", "#091077"),
                    new LandUseClass(33, "River / Lake / Ocean", "#2532e4"),
                    new LandUseClass(35, "Oil palm", "#9065d0"),
                    new LandUseClass(40, "Rice paddy", "#c71585"),
                    new LandUseClass(76, "Peat swamp forest", "#2f7360")));
        };
    }
}
