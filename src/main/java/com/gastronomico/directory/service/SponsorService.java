package com.gastronomico.directory.service;

import com.gastronomico.directory.entity.Sponsor;
import com.gastronomico.directory.exception.ConflictException;
import com.gastronomico.directory.exception.ResourceNotFoundException;
import com.gastronomico.directory.exception.ValidationException;
import com.gastronomico.directory.model.SponsorRequest;
import com.gastronomico.directory.model.SponsorView;
import com.gastronomico.directory.repository.SponsorRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Sponsor CRUD. Create and update write the sponsor row and replace its
 * city associations in the same transaction, then read the result back
 * through {@link SponsorCityAggregator}.
 */
@Service
@Slf4j
public class SponsorService {

    static final String NAME_EMAIL_REQUIRED = "Sponsor name and email are required";
    static final String INVALID_EMAIL = "Email format is not valid";
    static final String INVALID_CITY_IDS = "cityIds must not contain null entries";
    static final String DUPLICATE_EMAIL = "A sponsor with that email already exists";
    static final String NOT_FOUND = "Sponsor not found";

    private final SponsorRepository sponsorRepo;
    private final SponsorCitySynchronizer synchronizer;
    private final SponsorCityAggregator aggregator;

    public SponsorService(SponsorRepository sponsorRepo,
                          SponsorCitySynchronizer synchronizer,
                          SponsorCityAggregator aggregator) {
        this.sponsorRepo = sponsorRepo;
        this.synchronizer = synchronizer;
        this.aggregator = aggregator;
    }

    public List<SponsorView> findAll() {
        return aggregator.fetchSponsorsWithCities();
    }

    public SponsorView findById(Long id) {
        return aggregator.fetchSponsorWithCities(id)
                .orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND));
    }

    public List<SponsorView> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return aggregator.searchSponsorsWithCities(query.trim());
    }

    @Transactional
    public SponsorView create(SponsorRequest request) {
        Sponsor sponsor = new Sponsor();
        List<Long> cityIds = applyRequest(sponsor, request);

        Sponsor saved = save(sponsor);
        synchronizer.setAssociations(saved.getId(), cityIds);

        log.info("Created sponsor {} <{}> with {} cities", saved.getId(), saved.getEmail(), cityIds.size());
        return readBack(saved.getId());
    }

    @Transactional
    public SponsorView update(Long id, SponsorRequest request) {
        // validate before looking anything up
        Sponsor changes = new Sponsor();
        List<Long> cityIds = applyRequest(changes, request);

        Sponsor sponsor = sponsorRepo.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND));
        sponsor.setName(changes.getName());
        sponsor.setEmail(changes.getEmail());
        sponsor.setPhone(changes.getPhone());
        sponsor.setRepresentative(changes.getRepresentative());
        sponsor.setLogoLight(changes.getLogoLight());
        sponsor.setLogoDark(changes.getLogoDark());

        save(sponsor);
        synchronizer.setAssociations(id, cityIds);

        log.info("Updated sponsor {} with {} cities", id, cityIds.size());
        return readBack(id);
    }

    @Transactional
    public void delete(Long id) {
        if (sponsorRepo.deleteSponsorById(id) == 0) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        log.info("Deleted sponsor {}", id);
    }

    private List<Long> applyRequest(Sponsor target, SponsorRequest request) {
        if (request.getName() == null || request.getName().isBlank()
                || request.getEmail() == null || request.getEmail().isBlank()) {
            throw new ValidationException(NAME_EMAIL_REQUIRED);
        }
        target.setName(request.getName().trim());
        target.setEmail(InputValidator.requireEmail(request.getEmail().trim(), INVALID_EMAIL));
        target.setPhone(InputValidator.trimToNull(request.getPhone()));
        target.setRepresentative(InputValidator.trimToNull(request.getRepresentative()));
        target.setLogoLight(InputValidator.blankToNull(request.getLogoLight()));
        target.setLogoDark(InputValidator.blankToNull(request.getLogoDark()));
        return InputValidator.requireIds(request.getCityIds(), INVALID_CITY_IDS);
    }

    private Sponsor save(Sponsor sponsor) {
        try {
            return sponsorRepo.saveAndFlush(sponsor);
        } catch (DataIntegrityViolationException e) {
            if (IntegrityViolations.isUniqueViolation(e)) {
                throw new ConflictException(DUPLICATE_EMAIL, e);
            }
            throw e;
        }
    }

    private SponsorView readBack(Long id) {
        return aggregator.fetchSponsorWithCities(id)
                .orElseThrow(() -> new IllegalStateException("Sponsor " + id + " vanished after write"));
    }
}
