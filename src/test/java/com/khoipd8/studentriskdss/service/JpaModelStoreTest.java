package com.khoipd8.studentriskdss.service;

import com.khoipd8.studentriskdss.engine.RiskClassifier;
import com.khoipd8.studentriskdss.entity.ModelArtifact;
import com.khoipd8.studentriskdss.exception.ModelPersistenceException;
import com.khoipd8.studentriskdss.model.ClassifierModel;
import com.khoipd8.studentriskdss.repository.ModelArtifactRepository;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static com.khoipd8.studentriskdss.StudentFixtures.labelledDataset;
import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(JpaModelStore.class)
class JpaModelStoreTest {

    private static ClassifierModel trained;

    @Autowired JpaModelStore store;
    @Autowired ModelArtifactRepository repository;

    @BeforeAll
    static void train() {
        trained = new RiskClassifier().train(labelledDataset()).getModel();
    }

    @Test
    void saved_model_loads_back_equivalent() {
        assertEquals("trained_model", store.save(trained, "trained_model"));

        ClassifierModel loaded = store.load("trained_model").orElseThrow();

        assertNotSame(trained, loaded);
        assertEquals(trained.getFeatureNames(), loaded.getFeatureNames());
        assertArrayEquals(trained.getMedians(), loaded.getMedians());
        assertEquals(trained.getTrainingAccuracy(), loaded.getTrainingAccuracy());
        double[] vector = {1, 10, 2, 9, 8};
        assertEquals(trained.failureProbability(vector), loaded.failureProbability(vector), 1e-12);
    }

    @Test
    void saving_twice_replaces_the_artifact() {
        store.save(trained, "m");
        store.save(trained, "m");

        assertEquals(1, repository.count());
        ModelArtifact artifact = repository.findByHandle("m").orElseThrow();
        assertEquals(12, artifact.getTrainingRecords());
        assertEquals("failures,absences,studytime,G1,G2", artifact.getFeatureNames());
        assertNotNull(artifact.getCreatedAt());
    }

    @Test
    void unknown_handle_is_empty() {
        assertEquals(Optional.empty(), store.load("missing"));
    }

    @Test
    void corrupt_payload_is_reported() {
        ModelArtifact artifact = new ModelArtifact();
        artifact.setHandle("corrupt");
        artifact.setPayload("not a model".getBytes(StandardCharsets.UTF_8));
        repository.save(artifact);

        assertThrows(ModelPersistenceException.class, () -> store.load("corrupt"));
    }
}
