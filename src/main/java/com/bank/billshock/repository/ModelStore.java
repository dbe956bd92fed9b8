package com.bank.billshock.repository;

import com.bank.billshock.engine.BillShockModel;
import com.bank.billshock.model.ErrorKind;
import com.bank.billshock.model.ModelMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * File-backed persistence for {@link BillShockModel}s as JSON.
 *
 * Saves write a temporary file next to the destination and move it into place, so a reader
 * sees either the previous file, the complete new file, or no file. Concurrent writers to the
 * same path are not coordinated.
 */
@Repository
public class ModelStore {

    private static final Logger log = LoggerFactory.getLogger(ModelStore.class);

    private final ObjectMapper objectMapper;

    public ModelStore() {
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public void save(BillShockModel model, Path path) {
        Path target = path.toAbsolutePath();
        Path directory = target.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), model);
            moveIntoPlace(temp, target);
            temp = null;

            log.info("Saved model to {}: {} trees, {} samples, threshold={}",
                    path, model.getNumTrees(), model.getTrainingSize(), model.getThreshold());
        } catch (IOException e) {
            throw new ModelStoreException(ErrorKind.UNEXPECTED,
                    "Failed to save model to " + path + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(temp);
        }
    }

    public BillShockModel load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ModelStoreException(ErrorKind.MODEL_NOT_FOUND,
                    "Model file '" + path + "' not found. Train the model first.");
        }

        BillShockModel model;
        try {
            model = objectMapper.readValue(path.toFile(), BillShockModel.class);
        } catch (NoSuchFileException e) {
            throw new ModelStoreException(ErrorKind.MODEL_NOT_FOUND,
                    "Model file '" + path + "' not found. Train the model first.", e);
        } catch (JsonProcessingException e) {
            throw new ModelStoreException(ErrorKind.CORRUPT_MODEL,
                    "Model file '" + path + "' is not a valid model: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ModelStoreException(ErrorKind.CORRUPT_MODEL,
                    "Model file '" + path + "' could not be read: " + e.getMessage(), e);
        }

        if (model == null || !model.isWellFormed()) {
            throw new ModelStoreException(ErrorKind.CORRUPT_MODEL,
                    "Model file '" + path + "' is not a valid model: incomplete structure");
        }
        if (model.getFormatVersion() != BillShockModel.FORMAT_VERSION) {
            throw new ModelStoreException(ErrorKind.CORRUPT_MODEL,
                    "Model file '" + path + "' has unsupported format version " + model.getFormatVersion());
        }
        return model;
    }

    public ModelMetadata readMetadata(Path path) {
        return ModelMetadata.from(load(path), path.toString());
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary model file {}", temp, e);
        }
    }
}
