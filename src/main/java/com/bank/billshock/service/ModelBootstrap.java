package com.bank.billshock.service;

import com.bank.billshock.config.DetectionConfig;
import com.bank.billshock.engine.BillShockModel;
import com.bank.billshock.model.PipelineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Trains the model from {@code billshock.data-path} when the application starts, if
 * {@code billshock.train-on-startup} is set.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.arguments=--billshock.train-on-startup=true
 */
@Component
public class ModelBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ModelBootstrap.class);

    private final ModelTrainingService trainingService;
    private final DetectionConfig config;

    public ModelBootstrap(ModelTrainingService trainingService, DetectionConfig config) {
        this.trainingService = trainingService;
        this.config = config;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!config.isTrainOnStartup()) {
            log.debug("Startup training disabled");
            return;
        }

        log.info("=== Training bill shock model from {} ===", config.getDataPath());
        PipelineResult<BillShockModel> result = trainingService.trainModel();
        if (result.isSuccess()) {
            log.info("=== Startup training complete: model at {} ===", config.getModelPath());
        } else {
            // Not fatal: detection keeps reporting MODEL_NOT_FOUND until a model is trained
            log.warn("Startup training failed ({}): {}", result.getErrorKind(), result.getErrorMessage());
        }
    }
}
