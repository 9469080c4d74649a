package com.chambua.qualifiers.service;

import com.chambua.qualifiers.model.MaterializationCounts;
import com.chambua.qualifiers.model.ProbabilityResult;
import com.chambua.qualifiers.model.TeamSlotProbability;
import com.chambua.qualifiers.repository.TeamSlotProbabilityRepository;
import com.chambua.qualifiers.util.TeamNameNormalizer;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class JpaTeamProbabilityStore implements TeamProbabilityStore {

    private final TeamSlotProbabilityRepository repository;
    private final Clock clock;

    public JpaTeamProbabilityStore(TeamSlotProbabilityRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public MaterializationCounts upsertAll(List<ProbabilityResult> results) {
        Map<String, TeamSlotProbability> existing = new HashMap<>();
        for (TeamSlotProbability row : repository.findAll()) {
            existing.put(row.storeKey(), row);
        }
        Instant now = Instant.now(clock);
        List<TeamSlotProbability> toSave = new ArrayList<>(results.size());
        int inserted = 0, updated = 0;
        for (ProbabilityResult result : results) {
            TeamSlotProbability row = existing.get(result.storeKey());
            if (row == null) {
                row = new TeamSlotProbability(TeamNameNormalizer.clean(result.team()), result.confederation(),
                        TeamNameNormalizer.clean(result.group()));
                existing.put(result.storeKey(), row);
                inserted++;
            } else {
                updated++;
            }
            row.applyResult(result, now);
            toSave.add(row);
        }
        repository.saveAll(toSave);
        repository.flush();
        return new MaterializationCounts(inserted, updated);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProbabilityResult> findAll() {
        return repository.findAllByOrderByProbFillSlotDescTeamAsc().stream()
                .map(TeamSlotProbability::toResult)
                .toList();
    }
}
