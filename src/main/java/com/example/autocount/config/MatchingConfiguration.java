package com.example.autocount.config;

import com.example.autocount.service.matching.CandidateReducer;
import com.example.autocount.service.matching.CorrelationScanner;
import com.example.autocount.service.matching.Orientation;
import com.example.autocount.service.matching.TemplateRotator;
import com.example.autocount.service.matching.VisualSearchEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.stream.Collectors;

/**
 * Wires the matching pipeline. The pipeline classes carry no Spring annotations so the command
 * line entry point can assemble the same objects by hand.
 */
@Configuration
public class MatchingConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MatchingConfiguration.class);

    /**
     * Pool the orientation scans of every request run on.
     */
    @Bean(name = "scanExecutor")
    public ThreadPoolTaskExecutor scanExecutor(VisualSearchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getScanThreads());
        executor.setMaxPoolSize(properties.getScanThreads());
        executor.setQueueCapacity(properties.getScanQueueCapacity());
        executor.setThreadNamePrefix("scan-");
        // the submitting request thread scans itself when the queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    public TemplateRotator templateRotator() {
        return new TemplateRotator();
    }

    @Bean
    public CorrelationScanner correlationScanner(VisualSearchProperties properties) {
        return new CorrelationScanner(properties.getScanBandRows());
    }

    @Bean
    public CandidateReducer candidateReducer(VisualSearchProperties properties) {
        return new CandidateReducer(properties.getClusterDistanceFactor(), properties.getOverlapThreshold());
    }

    @Bean
    public VisualSearchEngine visualSearchEngine(VisualSearchProperties properties,
                                                 TemplateRotator rotator,
                                                 CorrelationScanner scanner,
                                                 CandidateReducer reducer,
                                                 @Qualifier("scanExecutor") ThreadPoolTaskExecutor scanExecutor) {
        List<Orientation> orientations = toOrientations(properties.getOrientations());
        log.info("Visual search configured with orientations {} and a cap of {} raw detections",
                orientations.stream().map(Orientation::degrees).collect(Collectors.toList()),
                properties.getMaxRawDetections());
        return new VisualSearchEngine(rotator, scanner, reducer, scanExecutor, orientations,
                properties.getMaxRawDetections());
    }

    static List<Orientation> toOrientations(List<Integer> degrees) {
        if (degrees == null || degrees.isEmpty()) {
            return List.of(Orientation.values());
        }
        return degrees.stream()
                .map(Orientation::fromDegrees)
                .distinct()
                .collect(Collectors.toList());
    }
}
