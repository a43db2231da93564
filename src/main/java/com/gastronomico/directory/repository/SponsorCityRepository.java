package com.gastronomico.directory.repository;

import com.gastronomico.directory.entity.SponsorCity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SponsorCityRepository extends JpaRepository<SponsorCity, Long> {

    List<SponsorCity> findBySponsorId(Long sponsorId);

    long countByCityId(Long cityId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM SponsorCity sc WHERE sc.sponsor.id = :sponsorId")
    int deleteBySponsorId(@Param("sponsorId") Long sponsorId);
}
