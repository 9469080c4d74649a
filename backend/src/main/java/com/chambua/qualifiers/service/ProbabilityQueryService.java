package com.chambua.qualifiers.service;

import com.chambua.qualifiers.dto.PredictionRunErrorDTO;
import com.chambua.qualifiers.dto.PredictionRunSummaryDTO;
import com.chambua.qualifiers.dto.ProbabilityStatsDTO;
import com.chambua.qualifiers.dto.TeamProbabilityDTO;
import com.chambua.qualifiers.model.Confederation;
import com.chambua.qualifiers.model.QualificationStatus;
import com.chambua.qualifiers.model.TeamSlotProbability;
import com.chambua.qualifiers.repository.PredictionRunErrorRepository;
import com.chambua.qualifiers.repository.PredictionRunRepository;
import com.chambua.qualifiers.repository.TeamSlotProbabilityRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Read side of the current probability table and the run ledger. */
@Service
@Transactional(readOnly = true)
public class ProbabilityQueryService {

    private static final int MAX_PAGE_SIZE = 200;

    private final TeamSlotProbabilityRepository probabilityRepository;
    private final PredictionRunRepository runRepository;
    private final PredictionRunErrorRepository errorRepository;

    public ProbabilityQueryService(TeamSlotProbabilityRepository probabilityRepository,
                                   PredictionRunRepository runRepository,
                                   PredictionRunErrorRepository errorRepository) {
        this.probabilityRepository = probabilityRepository;
        this.runRepository = runRepository;
        this.errorRepository = errorRepository;
    }

    /** Both filters are optional; labels are parsed leniently and unknown values raise IllegalArgumentException. */
    public List<TeamProbabilityDTO> list(String confederation, String status) {
        Confederation conf = blank(confederation) ? null : Confederation.fromLabel(confederation);
        QualificationStatus st = blank(status) ? null : QualificationStatus.fromLabel(status);
        List<TeamSlotProbability> rows;
        if (conf != null && st != null) {
            rows = probabilityRepository.findByConfederationAndQualificationStatusOrderByProbFillSlotDescTeamAsc(conf, st);
        } else if (conf != null) {
            rows = probabilityRepository.findByConfederationOrderByProbFillSlotDescTeamAsc(conf);
        } else if (st != null) {
            rows = probabilityRepository.findByQualificationStatusOrderByProbFillSlotDescTeamAsc(st);
        } else {
            rows = probabilityRepository.findAllByOrderByProbFillSlotDescTeamAsc();
        }
        return rows.stream().map(ProbabilityQueryService::toDto).toList();
    }

    public ProbabilityStatsDTO stats() {
        Map<String, Long> byConfederation = new TreeMap<>();
        for (Object[] row : probabilityRepository.countByConfederation()) {
            byConfederation.put(((Confederation) row[0]).name(), ((Number) row[1]).longValue());
        }
        return new ProbabilityStatsDTO(
                probabilityRepository.count(),
                probabilityRepository.countByQualificationStatus(QualificationStatus.QUALIFIED),
                probabilityRepository.countByQualificationStatus(QualificationStatus.IN_PROGRESS),
                byConfederation,
                probabilityRepository.findLatestUpdate());
    }

    public List<PredictionRunSummaryDTO> listRuns(int page, int size) {
        if (page < 0) throw new IllegalArgumentException("page must not be negative");
        if (size < 1) throw new IllegalArgumentException("size must be positive");
        int effective = Math.min(size, MAX_PAGE_SIZE);
        return runRepository.findAllByOrderByStartedAtDescIdDesc(PageRequest.of(page, effective))
                .map(r -> PredictionRunSummaryDTO.from(r, false))
                .getContent();
    }

    public Optional<PredictionRunSummaryDTO> getRun(Long id) {
        return runRepository.findById(id).map(r -> PredictionRunSummaryDTO.from(r, false));
    }

    public Optional<List<PredictionRunErrorDTO>> runErrors(Long id) {
        if (!runRepository.existsById(id)) return Optional.empty();
        return Optional.of(errorRepository.findByPredictionRunIdOrderByRowNumberAsc(id).stream()
                .map(e -> new PredictionRunErrorDTO(e.getId(), e.getRowNumber(), e.getTeam(), e.getReason(), e.getPayload()))
                .toList());
    }

    static TeamProbabilityDTO toDto(TeamSlotProbability t) {
        return new TeamProbabilityDTO(
                t.getTeam(),
                t.getConfederation() != null ? t.getConfederation().name() : null,
                t.getCurrentGroup(),
                t.getQualificationStatus() != null ? t.getQualificationStatus().getLabel() : null,
                t.getProbFillSlot(),
                t.getPosition(),
                t.getPoints(),
                t.getPlayed(),
                t.getGoalDiff(),
                t.getLookupLevel() != null ? t.getLookupLevel().name() : null,
                t.getUpdatedAt());
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
