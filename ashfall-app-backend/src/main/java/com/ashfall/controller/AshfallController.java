package com.ashfall.controller;

import com.ashfall.model.AshfallRequest;
import com.ashfall.model.AshfallResult;
import com.ashfall.service.AshfallAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/ashfall")
@CrossOrigin(origins = "*") // Allow CORS from all origins for development
public class AshfallController {

    private static final Logger logger = LoggerFactory.getLogger(AshfallController.class);

    private final AshfallAnalysisService analysisService;

    public AshfallController(AshfallAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    public AshfallResult analyze(@RequestBody AshfallRequest request) {
        logger.debug("Analysis requested with {} observation(s)",
                request.getObservations() == null ? 0 : request.getObservations().size());
        return analysisService.analyze(request);
    }
}
