package com.gastronomico.directory.service;

import com.gastronomico.directory.entity.City;
import com.gastronomico.directory.entity.Sponsor;
import com.gastronomico.directory.entity.SponsorCity;
import com.gastronomico.directory.exception.ConflictException;
import com.gastronomico.directory.exception.ReferenceNotFoundException;
import com.gastronomico.directory.repository.CityRepository;
import com.gastronomico.directory.repository.SponsorCityRepository;
import com.gastronomico.directory.repository.SponsorRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Replaces the full set of cities a sponsor is associated with.
 *
 * The replace is delete-all then insert-all inside one transaction. When
 * called from a sponsor create/update it joins the caller's transaction,
 * so a failure here also undoes the sponsor write. After a successful
 * call the stored set equals the requested set; after a failed call it
 * equals the set from before the call.
 */
@Service
@Slf4j
public class SponsorCitySynchronizer {

    private final SponsorRepository sponsorRepo;
    private final CityRepository cityRepo;
    private final SponsorCityRepository linkRepo;

    public SponsorCitySynchronizer(SponsorRepository sponsorRepo,
                                   CityRepository cityRepo,
                                   SponsorCityRepository linkRepo) {
        this.sponsorRepo = sponsorRepo;
        this.cityRepo = cityRepo;
        this.linkRepo = linkRepo;
    }

    /**
     * @param sponsorId existing sponsor
     * @param cityIds   desired cities, may be empty; duplicates collapse
     * @return the distinct city ids now associated with the sponsor
     */
    @Transactional
    public Set<Long> setAssociations(Long sponsorId, Collection<Long> cityIds) {
        Objects.requireNonNull(sponsorId, "sponsorId");
        Set<Long> desired = cityIds == null
                ? new LinkedHashSet<>()
                : new LinkedHashSet<>(cityIds);

        if (!sponsorRepo.existsById(sponsorId)) {
            throw new ReferenceNotFoundException("Sponsor not found: " + sponsorId);
        }

        List<City> cities = desired.isEmpty() ? List.of() : cityRepo.findAllById(desired);
        if (cities.size() != desired.size()) {
            Set<Long> found = cities.stream().map(City::getId).collect(Collectors.toSet());
            List<Long> missing = desired.stream().filter(id -> !found.contains(id)).toList();
            throw new ReferenceNotFoundException("City not found: " + missing);
        }

        int removed = linkRepo.deleteBySponsorId(sponsorId);

        Sponsor sponsor = sponsorRepo.getReferenceById(sponsorId);
        List<SponsorCity> links = cities.stream()
                .map(city -> SponsorCity.builder().sponsor(sponsor).city(city).build())
                .toList();

        try {
            linkRepo.saveAllAndFlush(links);
        } catch (DataIntegrityViolationException e) {
            if (!IntegrityViolations.isUniqueViolation(e)) {
                throw e;
            }
            // a concurrent replace got in between
            throw new ConflictException("Sponsor cities were changed concurrently, retry the request", e);
        }

        log.debug("Sponsor {} cities replaced: removed {}, inserted {}", sponsorId, removed, links.size());
        return desired;
    }
}
