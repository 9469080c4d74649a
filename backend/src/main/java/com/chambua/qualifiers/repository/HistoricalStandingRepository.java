package com.chambua.qualifiers.repository;

import com.chambua.qualifiers.model.Confederation;
import com.chambua.qualifiers.model.HistoricalStanding;
import org.springframework.data.jpa.repository.JpaRepository;

public interface HistoricalStandingRepository extends JpaRepository<HistoricalStanding, Long> {
    boolean existsBySeasonAndConfederationAndStageAndGroupNameAndTeam(Integer season, Confederation confederation,
                                                                       String stage, String groupName, String team);
}
