package com.ashfall.repository;

import com.ashfall.model.LandUseClass;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
public class LandUseClassRepositoryTest {

    @Autowired
    private LandUseClassRepository repository;

    @Test
    void listsClassesOrderedByCode() {
        repository.save(new LandUseClass(250, "Lava field", null));
        repository.save(new LandUseClass(200, "Tephra plain", "#444444"));

        List<LandUseClass> all = repository.findAllByOrderByCodeAsc();

        for (int i = 1; i < all.size(); i++) {
            assertTrue(all.get(i - 1).getCode() < all.get(i).getCode());
        }
        assertTrue(all.stream().anyMatch(c -> c.getCode() == 250));
        assertEquals("#444444", repository.findById(200).map(LandUseClass::getColor).orElse(null));
    }
}
