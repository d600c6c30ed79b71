package com.example.autocount.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "visual-search")
public class VisualSearchProperties {

    private double defaultThreshold = 0.7;
    private String defaultMethod = "NORMALIZED_CORRELATION";
    private List<Integer> orientations = new ArrayList<>(List.of(0, 90, 180, 270));
    private int maxRawDetections = 1000;
    private double clusterDistanceFactor = 0.8;
    private double overlapThreshold = 0.5;
    private int maxMatches = 10000;
    private int scanBandRows = 256;
    private Duration scanTimeout = Duration.ofSeconds(60);
    private int scanThreads = 4;
    private int scanQueueCapacity = 64;

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public void setDefaultThreshold(double defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public String getDefaultMethod() {
        return defaultMethod;
    }

    public void setDefaultMethod(String defaultMethod) {
        this.defaultMethod = defaultMethod;
    }

    public List<Integer> getOrientations() {
        return orientations;
    }

    public void setOrientations(List<Integer> orientations) {
        this.orientations = orientations;
    }

    public int getMaxRawDetections() {
        return maxRawDetections;
    }

    public void setMaxRawDetections(int maxRawDetections) {
        this.maxRawDetections = maxRawDetections;
    }

    public double getClusterDistanceFactor() {
        return clusterDistanceFactor;
    }

    public void setClusterDistanceFactor(double clusterDistanceFactor) {
        this.clusterDistanceFactor = clusterDistanceFactor;
    }

    public double getOverlapThreshold() {
        return overlapThreshold;
    }

    public void setOverlapThreshold(double overlapThreshold) {
        this.overlapThreshold = overlapThreshold;
    }

    public int getMaxMatches() {
        return maxMatches;
    }

    public void setMaxMatches(int maxMatches) {
        this.maxMatches = maxMatches;
    }

    public int getScanBandRows() {
        return scanBandRows;
    }

    public void setScanBandRows(int scanBandRows) {
        this.scanBandRows = scanBandRows;
    }

    public Duration getScanTimeout() {
        return scanTimeout;
    }

    public void setScanTimeout(Duration scanTimeout) {
        this.scanTimeout = scanTimeout;
    }

    public int getScanThreads() {
        return scanThreads;
    }

    public void setScanThreads(int scanThreads) {
        this.scanThreads = scanThreads;
    }

    public int getScanQueueCapacity() {
        return scanQueueCapacity;
    }

    public void setScanQueueCapacity(int scanQueueCapacity) {
        this.scanQueueCapacity = scanQueueCapacity;
    }
}
