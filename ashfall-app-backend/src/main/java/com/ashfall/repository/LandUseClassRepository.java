package com.ashfall.repository;

import com.ashfall.model.LandUseClass;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LandUseClassRepository extends JpaRepository<LandUseClass, Integer> {

    List<LandUseClass> findAllByOrderByCodeAsc();
}
