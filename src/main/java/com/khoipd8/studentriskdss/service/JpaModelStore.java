package com.khoipd8.studentriskdss.service;

import com.khoipd8.studentriskdss.entity.ModelArtifact;
import com.khoipd8.studentriskdss.exception.ModelPersistenceException;
import com.khoipd8.studentriskdss.model.ClassifierModel;
import com.khoipd8.studentriskdss.repository.ModelArtifactRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.Optional;

/**
 * Keeps trained classifiers as serialized blobs in the {@code model_artifacts} table.
 */
@Service
@Slf4j
public class JpaModelStore implements ModelStore {

    @Autowired
    private ModelArtifactRepository modelArtifactRepository;

    @Override
    @Transactional
    public String save(ClassifierModel model, String handle) {
        try {
            ModelArtifact artifact = modelArtifactRepository.findByHandle(handle).orElseGet(ModelArtifact::new);
            artifact.setHandle(handle);
            artifact.setPayload(serialize(model));
            artifact.setFeatureNames(String.join(",", model.getFeatureNames()));
            artifact.setTrainingAccuracy(model.getTrainingAccuracy());
            artifact.setTrainingRecords(model.getAtRiskCount() + model.getNotAtRiskCount());
            modelArtifactRepository.save(artifact);

            log.debug("Stored model artifact '{}' ({} bytes)", handle, artifact.getPayload().length);
            return handle;
        } catch (IOException | DataAccessException e) {
            throw new ModelPersistenceException("Could not save model '" + handle + "'", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ClassifierModel> load(String handle) {
        Optional<ModelArtifact> artifact;
        try {
            artifact = modelArtifactRepository.findByHandle(handle);
        } catch (DataAccessException e) {
            throw new ModelPersistenceException("Could not look up model '" + handle + "'", e);
        }
        if (artifact.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(deserialize(artifact.get().getPayload()));
        } catch (IOException | ClassNotFoundException | ClassCastException e) {
            throw new ModelPersistenceException("Could not read model '" + handle + "'", e);
        }
    }

    private static byte[] serialize(ClassifierModel model) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(model);
        }
        return bytes.toByteArray();
    }

    private static ClassifierModel deserialize(byte[] payload) throws IOException, ClassNotFoundException {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(payload))) {
            return (ClassifierModel) in.readObject();
        }
    }
}
