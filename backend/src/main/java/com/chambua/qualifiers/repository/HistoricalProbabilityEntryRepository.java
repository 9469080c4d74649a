package com.chambua.qualifiers.repository;

import com.chambua.qualifiers.model.HistoricalProbabilityEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface HistoricalProbabilityEntryRepository extends JpaRepository<HistoricalProbabilityEntry, Long> {
}
