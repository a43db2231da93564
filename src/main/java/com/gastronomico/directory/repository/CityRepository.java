package com.gastronomico.directory.repository;

import com.gastronomico.directory.entity.City;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface CityRepository extends JpaRepository<City, Long> {

    List<City> findAllByOrderByCreatedAtDescIdDesc();

    List<City> findByNameContainingIgnoreCaseOrderByNameAsc(String fragment);

    /**
     * Deletes in the database so the ON DELETE rules on sponsor_cities and
     * restaurants apply. Returns the number of removed rows (0 or 1).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM City c WHERE c.id = :id")
    int deleteCityById(@Param("id") Long id);
}
