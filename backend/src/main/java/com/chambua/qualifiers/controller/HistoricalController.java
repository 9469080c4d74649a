package com.chambua.qualifiers.controller;

import com.chambua.qualifiers.dto.PredictionRunSummaryDTO;
import com.chambua.qualifiers.service.HistoricalArchiveImportService;
import com.chambua.qualifiers.service.HistoricalLookupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/qualifiers/historical")
@CrossOrigin(origins = "*")
public class HistoricalController {

    private static final Logger log = LoggerFactory.getLogger(HistoricalController.class);

    private final HistoricalArchiveImportService archiveImportService;
    private final HistoricalLookupService lookupService;

    public HistoricalController(HistoricalArchiveImportService archiveImportService,
                                HistoricalLookupService lookupService) {
        this.archiveImportService = archiveImportService;
        this.lookupService = lookupService;
    }

    @PostMapping(value = "/archive", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public PredictionRunSummaryDTO importArchive(@RequestParam("file") MultipartFile file,
                                                 @RequestParam(name = "triggeredBy", defaultValue = "api") String triggeredBy) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "file is required");
        }
        log.info("[Archive][REQ] file={}, bytes={}", file.getOriginalFilename(), file.getSize());
        try {
            return archiveImportService.importCsv(file.getBytes(), file.getOriginalFilename(), triggeredBy);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (Exception ex) {
            log.error("[Archive][ERR] file={}, msg={}", file.getOriginalFilename(), ex.toString());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Archive import failed", ex);
        }
    }

    @PostMapping("/rebuild")
    public PredictionRunSummaryDTO rebuild(@RequestParam(name = "triggeredBy", defaultValue = "api") String triggeredBy) {
        log.info("[Lookup][REQ] rebuild triggeredBy={}", triggeredBy);
        try {
            return PredictionRunSummaryDTO.from(lookupService.rebuild(triggeredBy), false);
        } catch (Exception ex) {
            log.error("[Lookup][ERR] rebuild msg={}", ex.toString());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Lookup rebuild failed", ex);
        }
    }
}
