package com.chambua.qualifiers.controller;

import com.chambua.qualifiers.dto.PredictionRunErrorDTO;
import com.chambua.qualifiers.dto.PredictionRunSummaryDTO;
import com.chambua.qualifiers.dto.StandingIngestItem;
import com.chambua.qualifiers.service.ProbabilityQueryService;
import com.chambua.qualifiers.service.QualifierProbabilityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/qualifiers/runs")
@CrossOrigin(origins = "*")
public class PredictionRunController {

    private static final Logger log = LoggerFactory.getLogger(PredictionRunController.class);

    private final QualifierProbabilityService probabilityService;
    private final ProbabilityQueryService queryService;

    public PredictionRunController(QualifierProbabilityService probabilityService,
                                   ProbabilityQueryService queryService) {
        this.probabilityService = probabilityService;
        this.queryService = queryService;
    }

    @PostMapping
    public PredictionRunSummaryDTO run(@RequestBody List<StandingIngestItem> items,
                                       @RequestParam(name = "triggeredBy", defaultValue = "api") String triggeredBy) {
        long start = System.currentTimeMillis();
        log.info("[Prediction][REQ] rows={}, triggeredBy={}", items == null ? 0 : items.size(), triggeredBy);
        try {
            PredictionRunSummaryDTO summary = probabilityService.run(items, triggeredBy);
            log.info("[Prediction][OK] runId={}, status={}, reused={}, ms={}",
                    summary.getId(), summary.getStatus(), summary.isReused(), (System.currentTimeMillis() - start));
            return summary;
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (Exception ex) {
            log.error("[Prediction][ERR] msg={}", ex.toString());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Prediction run failed", ex);
        }
    }

    @PostMapping("/from-source")
    public PredictionRunSummaryDTO runFromSource(@RequestParam(name = "triggeredBy", defaultValue = "api") String triggeredBy) {
        log.info("[Prediction][REQ] from-source triggeredBy={}", triggeredBy);
        try {
            return probabilityService.runFromSource(triggeredBy);
        } catch (Exception ex) {
            log.error("[Prediction][ERR] from-source msg={}", ex.toString());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Prediction run failed", ex);
        }
    }

    @GetMapping
    public List<PredictionRunSummaryDTO> listRuns(@RequestParam(value = "page", defaultValue = "0") int page,
                                                  @RequestParam(value = "size", defaultValue = "20") int size) {
        try {
            return queryService.listRuns(page, size);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @GetMapping("/{id}")
    public PredictionRunSummaryDTO getRun(@PathVariable("id") Long id) {
        return queryService.getRun(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
    }

    @GetMapping("/{id}/errors")
    public List<PredictionRunErrorDTO> listErrors(@PathVariable("id") Long id) {
        return queryService.runErrors(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
    }
}
