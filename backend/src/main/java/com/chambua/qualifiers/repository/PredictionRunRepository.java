package com.chambua.qualifiers.repository;

import com.chambua.qualifiers.model.PredictionRun;
import com.chambua.qualifiers.model.RunStatus;
import com.chambua.qualifiers.model.RunType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PredictionRunRepository extends JpaRepository<PredictionRun, Long> {
    Page<PredictionRun> findAllByOrderByStartedAtDescIdDesc(Pageable pageable);

    Optional<PredictionRun> findFirstByRunTypeAndInputHashAndStatusOrderByIdDesc(RunType runType, String inputHash, RunStatus status);

    Optional<PredictionRun> findFirstByRunTypeAndInputHashAndHistoricalLookupHashAndModelVersionAndStatusOrderByIdDesc(
            RunType runType, String inputHash, String historicalLookupHash, String modelVersion, RunStatus status);

    List<PredictionRun> findByStatusAndStartedAtBefore(RunStatus status, Instant cutoff);

    List<PredictionRun> findByInputHashOrderByIdAsc(String inputHash);
}
