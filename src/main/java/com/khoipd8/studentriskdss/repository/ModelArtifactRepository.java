package com.khoipd8.studentriskdss.repository;

import com.khoipd8.studentriskdss.entity.ModelArtifact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ModelArtifactRepository extends JpaRepository<ModelArtifact, Long> {

    Optional<ModelArtifact> findByHandle(String handle);
}
