package com.bank.billshock.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "billshock")
public class DetectionConfig {

    // Historical transactions used for training when no source is given
    private String dataPath = "data/transactions.csv";

    // Where the trained model is written and read from
    private String modelPath = "models/anomaly_model.json";

    // Numeric column holding the transaction amount. "Amount" also matches.
    private String amountColumn = "amount";

    // Column added to detection output holding "Normal" / "Bill Shock"
    private String labelColumn = "Anomaly";

    // Used whenever a requested contamination is missing or outside [0.01, 0.5]
    private double defaultContamination = 0.05;

    private int numTrees = 100;

    // Clamped to the training set size when smaller
    private int sampleSize = 256;

    private long seed = 42;

    // Train from dataPath into modelPath when the application starts
    private boolean trainOnStartup = false;
}
