package com.ashfall.service;

import com.ashfall.model.LandUseClass;
import com.ashfall.repository.LandUseClassRepository;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class LandUseClassService {

    private final LandUseClassRepository landUseClassRepository;

    public LandUseClassService(LandUseClassRepository landUseClassRepository) {
        this.landUseClassRepository = landUseClassRepository;
    }

    public List<LandUseClass> findAll() {
        return landUseClassRepository.findAllByOrderByCodeAsc();
    }

    public Optional<LandUseClass> findByCode(int code) {
        return landUseClassRepository.findById(code);
    }

    /** Class names keyed by code, for labelling zonal records. */
    public Map<Integer, String> classNames() {
        Map<Integer, String> names = new HashMap<>();
        for (LandUseClass c : landUseClassRepository.findAll()) {
            names.put(c.getCode(), c.getName());
        }
        return names;
    }
}
