package com.chambua.qualifiers.controller;

import com.chambua.qualifiers.dto.ProbabilityStatsDTO;
import com.chambua.qualifiers.dto.TeamProbabilityDTO;
import com.chambua.qualifiers.service.ProbabilityQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/qualifiers/probabilities")
@CrossOrigin(origins = "*")
public class ProbabilityController {

    private static final Logger log = LoggerFactory.getLogger(ProbabilityController.class);

    private final ProbabilityQueryService queryService;

    public ProbabilityController(ProbabilityQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping
    public List<TeamProbabilityDTO> list(@RequestParam(name = "confederation", required = false) String confederation,
                                         @RequestParam(name = "status", required = false) String status) {
        try {
            List<TeamProbabilityDTO> rows = queryService.list(confederation, status);
            log.debug("[Probabilities][OK] confederation={}, status={}, rows={}", confederation, status, rows.size());
            return rows;
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (Exception ex) {
            log.error("[Probabilities][ERR] confederation={}, status={}, msg={}", confederation, status, ex.toString());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to load probabilities", ex);
        }
    }

    @GetMapping("/stats")
    public ProbabilityStatsDTO stats() {
        return queryService.stats();
    }
}
