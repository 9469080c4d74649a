package com.chambua.qualifiers.repository;

import com.chambua.qualifiers.model.Confederation;
import com.chambua.qualifiers.model.QualificationStatus;
import com.chambua.qualifiers.model.TeamSlotProbability;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.Instant;
import java.util.List;

public interface TeamSlotProbabilityRepository extends JpaRepository<TeamSlotProbability, Long> {
    List<TeamSlotProbability> findAllByOrderByProbFillSlotDescTeamAsc();

    List<TeamSlotProbability> findByConfederationOrderByProbFillSlotDescTeamAsc(Confederation confederation);

    List<TeamSlotProbability> findByQualificationStatusOrderByProbFillSlotDescTeamAsc(QualificationStatus status);

    List<TeamSlotProbability> findByConfederationAndQualificationStatusOrderByProbFillSlotDescTeamAsc(Confederation confederation, QualificationStatus status);

    long countByQualificationStatus(QualificationStatus status);

    @Query("select t.confederation, count(t) from TeamSlotProbability t group by t.confederation")
    List<Object[]> countByConfederation();

    @Query("select max(t.updatedAt) from TeamSlotProbability t")
    Instant findLatestUpdate();
}
