package com.gastronomico.directory.repository;

import com.gastronomico.directory.entity.Sponsor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SponsorRepository extends JpaRepository<Sponsor, Long> {

    // Sponsors newest first; cities of one sponsor by name so ids and names stay paired
    @Query("""
        SELECT new com.gastronomico.directory.repository.SponsorCityRow(s, c.id, c.name)
        FROM Sponsor s
        LEFT JOIN s.cityLinks sc
        LEFT JOIN sc.city c
        ORDER BY s.createdAt DESC, s.id DESC, c.name ASC, c.id ASC
    """)
    List<SponsorCityRow> findAllWithCities();

    @Query("""
        SELECT new com.gastronomico.directory.repository.SponsorCityRow(s, c.id, c.name)
        FROM Sponsor s
        LEFT JOIN s.cityLinks sc
        LEFT JOIN sc.city c
        WHERE s.id = :id
        ORDER BY c.name ASC, c.id ASC
    """)
    List<SponsorCityRow> findWithCitiesById(@Param("id") Long id);

    @Query("""
        SELECT new com.gastronomico.directory.repository.SponsorCityRow(s, c.id, c.name)
        FROM Sponsor s
        LEFT JOIN s.cityLinks sc
        LEFT JOIN sc.city c
        WHERE LOWER(s.name) LIKE LOWER(CONCAT('%', :fragment, '%'))
           OR LOWER(s.email) LIKE LOWER(CONCAT('%', :fragment, '%'))
           OR LOWER(s.representative) LIKE LOWER(CONCAT('%', :fragment, '%'))
        ORDER BY s.name ASC, s.id ASC, c.name ASC, c.id ASC
    """)
    List<SponsorCityRow> searchWithCities(@Param("fragment") String fragment);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Sponsor s WHERE s.id = :id")
    int deleteSponsorById(@Param("id") Long id);
}
