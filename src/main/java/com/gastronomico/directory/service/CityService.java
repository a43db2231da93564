package com.gastronomico.directory.service;

import com.gastronomico.directory.entity.City;
import com.gastronomico.directory.exception.ConflictException;
import com.gastronomico.directory.exception.ResourceNotFoundException;
import com.gastronomico.directory.model.CityRequest;
import com.gastronomico.directory.model.CityView;
import com.gastronomico.directory.repository.CityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Slf4j
public class CityService {

    static final String NAME_REQUIRED = "City name is required";
    static final String DUPLICATE_NAME = "A city with that name already exists";
    static final String NOT_FOUND = "City not found";

    private final CityRepository cityRepo;

    public CityService(CityRepository cityRepo) {
        this.cityRepo = cityRepo;
    }

    @Transactional(readOnly = true)
    public List<CityView> findAll() {
        return cityRepo.findAllByOrderByCreatedAtDescIdDesc().stream()
                .map(CityView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public CityView findById(Long id) {
        return cityRepo.findById(id)
                .map(CityView::from)
                .orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND));
    }

    /** A missing or blank query yields no results rather than the whole table. */
    @Transactional(readOnly = true)
    public List<CityView> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return cityRepo.findByNameContainingIgnoreCaseOrderByNameAsc(query.trim()).stream()
                .map(CityView::from)
                .toList();
    }

    @Transactional
    public CityView create(CityRequest request) {
        String name = InputValidator.requireText(request.getName(), NAME_REQUIRED);

        City city = save(City.builder().name(name).build());
        log.info("Created city {} '{}'", city.getId(), city.getName());
        return CityView.from(city);
    }

    @Transactional
    public CityView update(Long id, CityRequest request) {
        String name = InputValidator.requireText(request.getName(), NAME_REQUIRED);

        City city = cityRepo.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND));
        city.setName(name);

        City saved = save(city);
        log.info("Updated city {} to '{}'", saved.getId(), saved.getName());
        return CityView.from(saved);
    }

    /** Association rows go with the city; restaurants keep living without one. */
    @Transactional
    public void delete(Long id) {
        if (cityRepo.deleteCityById(id) == 0) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        log.info("Deleted city {}", id);
    }

    private City save(City city) {
        try {
            return cityRepo.saveAndFlush(city);
        } catch (DataIntegrityViolationException e) {
            if (IntegrityViolations.isUniqueViolation(e)) {
                throw new ConflictException(DUPLICATE_NAME, e);
            }
            throw e;
        }
    }
}
