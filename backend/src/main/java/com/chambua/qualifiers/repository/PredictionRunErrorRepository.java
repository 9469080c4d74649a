package com.chambua.qualifiers.repository;

import com.chambua.qualifiers.model.PredictionRunError;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PredictionRunErrorRepository extends JpaRepository<PredictionRunError, Long> {
    List<PredictionRunError> findByPredictionRunIdOrderByRowNumberAsc(Long predictionRunId);

    long countByPredictionRunId(Long predictionRunId);
}
