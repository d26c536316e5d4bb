package com.ashfall.controller;

import com.ashfall.model.LandUseClass;
import com.ashfall.service.LandUseClassService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class LandUseClassController {

    private final LandUseClassService landUseClassService;

    public LandUseClassController(LandUseClassService landUseClassService) {
        this.landUseClassService = landUseClassService;
    }

    @GetMapping("/landuse-classes")
    public List<LandUseClass> getLandUseClasses() {
        return landUseClassService.findAll();
    }

    @GetMapping("/landuse-classes/{code}")
    public ResponseEntity<LandUseClass> getLandUseClass(@PathVariable int code) {
        return landUseClassService.findByCode(code)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
