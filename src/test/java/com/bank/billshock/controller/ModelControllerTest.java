package com.bank.billshock.controller;

import com.bank.billshock.config.DetectionConfig;
import com.bank.billshock.engine.BillShockModel;
import com.bank.billshock.model.ErrorKind;
import com.bank.billshock.model.ModelMetadata;
import com.bank.billshock.model.PipelineResult;
import com.bank.billshock.repository.ModelStore;
import com.bank.billshock.repository.ModelStoreException;
import com.bank.billshock.service.ModelTrainingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;

import static com.bank.billshock.testutil.TestDataFactory.TRAINING_WITH_SHOCK;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModelController.class)
class ModelControllerTest {

    private static final Path DATA_PATH = Path.of("data/transactions.csv");
    private static final Path MODEL_PATH = Path.of("models/anomaly_model.json");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ModelTrainingService trainingService;

    @MockBean
    private ModelStore modelStore;

    @MockBean
    private DetectionConfig config;

    @BeforeEach
    void setUp() {
        when(config.getDataPath()).thenReturn(DATA_PATH.toString());
        when(config.getModelPath()).thenReturn(MODEL_PATH.toString());
        when(config.getDefaultContamination()).thenReturn(0.05);
    }

    @Test
    void train_defaults_success() throws Exception {
        BillShockModel model = BillShockModel.fit(TRAINING_WITH_SHOCK, 0.05, 10, 256, 42L);
        when(trainingService.trainModel(eq(DATA_PATH), eq(MODEL_PATH), eq(0.05)))
                .thenReturn(PipelineResult.success(model));

        mockMvc.perform(post("/api/v1/models/train"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.treeCount").value(10))
                .andExpect(jsonPath("$.trainingSamples").value(8))
                .andExpect(jsonPath("$.contamination").value(0.05))
                .andExpect(jsonPath("$.modelPath").value(MODEL_PATH.toString()));
    }

    @Test
    void train_withSourceAndContamination() throws Exception {
        BillShockModel model = BillShockModel.fit(TRAINING_WITH_SHOCK, 0.2, 10, 256, 42L);
        when(trainingService.trainModel(eq(Path.of("uploads/history.csv")), eq(MODEL_PATH), eq(0.2)))
                .thenReturn(PipelineResult.success(model));

        mockMvc.perform(post("/api/v1/models/train")
                        .param("sourcePath", "uploads/history.csv")
                        .param("contamination", "0.2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.contamination").value(0.2));
    }

    @Test
    void train_missingSource_notFound() throws Exception {
        when(trainingService.trainModel(any(Path.class), any(Path.class), any()))
                .thenReturn(PipelineResult.failure(ErrorKind.FILE_NOT_FOUND, "File 'data/transactions.csv' does not exist"));

        mockMvc.perform(post("/api/v1/models/train"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("FILE_NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("File 'data/transactions.csv' does not exist"));
    }

    @Test
    void train_invalidData_unprocessable() throws Exception {
        when(trainingService.trainModel(any(Path.class), any(Path.class), any()))
                .thenReturn(PipelineResult.failure(ErrorKind.MISSING_COLUMN,
                        "Required column 'amount' not found. Available: Price"));

        mockMvc.perform(post("/api/v1/models/train"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("MISSING_COLUMN"));
    }

    @Test
    void train_saveFailure_serverError() throws Exception {
        when(trainingService.trainModel(any(Path.class), any(Path.class), any()))
                .thenReturn(PipelineResult.failure(ErrorKind.UNEXPECTED, "Failed to save model"));

        mockMvc.perform(post("/api/v1/models/train"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void getModelMetadata_found() throws Exception {
        when(modelStore.readMetadata(MODEL_PATH)).thenReturn(ModelMetadata.builder()
                .modelPath(MODEL_PATH.toString())
                .treeCount(100)
                .sampleSize(256)
                .threshold(0.62)
                .build());

        mockMvc.perform(get("/api/v1/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.treeCount").value(100))
                .andExpect(jsonPath("$.threshold").value(0.62));
    }

    @Test
    void getModelMetadata_notFound() throws Exception {
        when(modelStore.readMetadata(MODEL_PATH)).thenThrow(new ModelStoreException(ErrorKind.MODEL_NOT_FOUND,
                "Model file 'models/anomaly_model.json' not found. Train the model first."));

        mockMvc.perform(get("/api/v1/models"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("MODEL_NOT_FOUND"));
    }

    @Test
    void getModelMetadata_corrupt() throws Exception {
        when(modelStore.readMetadata(MODEL_PATH)).thenThrow(new ModelStoreException(ErrorKind.CORRUPT_MODEL,
                "Model file 'models/anomaly_model.json' is not a valid model: incomplete structure"));

        mockMvc.perform(get("/api/v1/models"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("CORRUPT_MODEL"));
    }
}
