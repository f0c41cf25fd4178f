package com.khoipd8.studentriskdss.service;

import com.khoipd8.studentriskdss.exception.ModelPersistenceException;
import com.khoipd8.studentriskdss.model.ClassifierModel;

import java.util.Optional;

/**
 * Durable storage for trained classifiers, addressed by an opaque handle.
 */
public interface ModelStore {

    /**
     * Stores the model under {@code handle}, replacing any previous artifact.
     *
     * @return the handle the model can be loaded with
     * @throws ModelPersistenceException when the artifact cannot be written
     */
    String save(ClassifierModel model, String handle);

    /**
     * @return the stored model, or empty when nothing is stored under {@code handle}
     * @throws ModelPersistenceException when an artifact exists but cannot be read
     */
    Optional<ClassifierModel> load(String handle);
}
