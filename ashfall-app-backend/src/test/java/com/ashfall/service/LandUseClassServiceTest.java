package com.ashfall.service;

import com.ashfall.model.LandUseClass;
import com.ashfall.repository.LandUseClassRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(LandUseClassService.class)
public class LandUseClassServiceTest {

    @Autowired
    private LandUseClassService service;

    @Autowired
    private LandUseClassRepository repository;

    @Test
    void classNamesAreKeyedByCode() {
        repository.save(new LandUseClass(300, "Lahar deposit", "#bbbbbb"));

        Map<Integer, String> names = service.classNames();

        assertEquals("Lahar deposit", names.get(300));
        assertEquals(repository.count(), names.size());
    }

    @Test
    void findByCode() {
        repository.save(new LandUseClass(301, "Pumice raft", null));

        assertEquals("Pumice raft", service.findByCode(301).map(LandUseClass::getName).orElse(null));
        assertTrue(service.findByCode(99999).isEmpty());
    }
}
