package com.khoipd8.studentriskdss.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDateTime;

@Entity
@Table(name = "model_artifacts")
@Data
@EqualsAndHashCode(exclude = {"payload"})
@ToString(exclude = {"payload"})
public class ModelArtifact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String handle;

    // serialized ClassifierModel
    @Lob
    @Column(nullable = false)
    private byte[] payload;

    @Column(name = "feature_names")
    private String featureNames;

    @Column(name = "training_accuracy")
    private Double trainingAccuracy;

    @Column(name = "training_records")
    private Integer trainingRecords;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
