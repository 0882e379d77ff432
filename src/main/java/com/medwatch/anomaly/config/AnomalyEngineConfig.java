package com.medwatch.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly-engine")
public class AnomalyEngineConfig {

    private boolean enableRuleEngine = true;

    private boolean enableMlModels = true;

    // Delay before the first tick and between subsequent ticks
    private Duration processingInterval = Duration.ofSeconds(30);

    // Anomalies with confidence >= this value are alerted (inclusive)
    private double alertThreshold = 0.7;

    // Initialize and start the engine once the application is ready
    private boolean autoStart = true;

    // Maximum number of pending data points fetched per tick
    private int batchSize = 500;

    private Model model = new Model();

    @Data
    public static class Model {
        private String modelId = "global";
        // Isolation forest score above which a data point is flagged
        private double scoreThreshold = 0.6;
        private int numTrees = 100;
        private int sampleSize = 256;
        private int minTrainingSamples = 20;
    }
}
