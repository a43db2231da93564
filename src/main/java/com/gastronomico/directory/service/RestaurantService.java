package com.gastronomico.directory.service;

import com.gastronomico.directory.entity.City;
import com.gastronomico.directory.entity.Restaurant;
import com.gastronomico.directory.exception.ReferenceNotFoundException;
import com.gastronomico.directory.exception.ResourceNotFoundException;
import com.gastronomico.directory.exception.ValidationException;
import com.gastronomico.directory.model.RestaurantRequest;
import com.gastronomico.directory.model.RestaurantView;
import com.gastronomico.directory.repository.CityRepository;
import com.gastronomico.directory.repository.RestaurantRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class RestaurantService {

    static final String NAMES_REQUIRED = "Official name and display name are required";
    static final String INVALID_EMAIL = "Email format is not valid";
    static final String INVALID_TABLE_COUNT = "tableCount must not be negative";
    static final String NOT_FOUND = "Restaurant not found";

    private final RestaurantRepository restaurantRepo;
    private final CityRepository cityRepo;

    public RestaurantService(RestaurantRepository restaurantRepo, CityRepository cityRepo) {
        this.restaurantRepo = restaurantRepo;
        this.cityRepo = cityRepo;
    }

    @Transactional(readOnly = true)
    public List<RestaurantView> findAll() {
        return restaurantRepo.findAllWithCity().stream()
                .map(RestaurantView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public RestaurantView findById(Long id) {
        return restaurantRepo.findWithCityById(id)
                .map(RestaurantView::from)
                .orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND));
    }

    /** Matches official name, display name, representative or email. */
    @Transactional(readOnly = true)
    public List<RestaurantView> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return restaurantRepo.searchWithCity(query.trim()).stream()
                .map(RestaurantView::from)
                .toList();
    }

    @Transactional
    public RestaurantView create(RestaurantRequest request) {
        validate(request);

        Restaurant restaurant = new Restaurant();
        apply(restaurant, request);

        Restaurant saved = restaurantRepo.saveAndFlush(restaurant);
        log.info("Created restaurant {} '{}' ({} branches)",
                saved.getId(), saved.getDisplayName(), saved.getBranches().size());
        return RestaurantView.from(saved);
    }

    @Transactional
    public RestaurantView update(Long id, RestaurantRequest request) {
        validate(request);

        Restaurant restaurant = restaurantRepo.findWithCityById(id)
                .orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND));
        apply(restaurant, request);

        Restaurant saved = restaurantRepo.saveAndFlush(restaurant);
        log.info("Updated restaurant {}", saved.getId());
        return RestaurantView.from(saved);
    }

    @Transactional
    public void delete(Long id) {
        if (restaurantRepo.deleteRestaurantById(id) == 0) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        log.info("Deleted restaurant {}", id);
    }

    private void validate(RestaurantRequest request) {
        if (request.getOfficialName() == null || request.getOfficialName().isBlank()
                || request.getDisplayName() == null || request.getDisplayName().isBlank()) {
            throw new ValidationException(NAMES_REQUIRED);
        }
        String email = InputValidator.trimToNull(request.getEmail());
        if (email != null && !InputValidator.isEmail(email)) {
            throw new ValidationException(INVALID_EMAIL);
        }
        if (request.getTableCount() != null && request.getTableCount() < 0) {
            throw new ValidationException(INVALID_TABLE_COUNT);
        }
    }

    // Full replace: fields missing from the request are cleared
    private void apply(Restaurant target, RestaurantRequest request) {
        target.setOfficialName(request.getOfficialName().trim());
        target.setDisplayName(request.getDisplayName().trim());
        target.setDescription(InputValidator.trimToNull(request.getDescription()));
        target.setRepresentative(InputValidator.trimToNull(request.getRepresentative()));
        target.setTableCount(request.getTableCount());
        target.setCity(resolveCity(request.getCityId()));
        target.setEmail(InputValidator.trimToNull(request.getEmail()));
        target.setPhone(InputValidator.trimToNull(request.getPhone()));
        target.setInstagram(InputValidator.trimToNull(request.getInstagram()));
        target.setLogo(InputValidator.trimToNull(request.getLogo()));
        target.setShortLocation(InputValidator.trimToNull(request.getShortLocation()));
        target.setSchedule(InputValidator.trimToNull(request.getSchedule()));
        target.setBranches(request.getBranches() != null
                ? new ArrayList<>(request.getBranches())
                : new ArrayList<>());
        target.setProposals(InputValidator.trimToNull(request.getProposals()));
        target.setEditions(InputValidator.trimToNull(request.getEditions()));
        target.setAwards(InputValidator.trimToNull(request.getAwards()));
    }

    private City resolveCity(Long cityId) {
        if (cityId == null) return null;
        return cityRepo.findById(cityId)
                .orElseThrow(() -> new ReferenceNotFoundException("City not found: " + cityId));
    }
}
