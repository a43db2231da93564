package com.gastronomico.directory.service;

import com.gastronomico.directory.entity.Sponsor;
import com.gastronomico.directory.model.SponsorView;
import com.gastronomico.directory.repository.SponsorCityRow;
import com.gastronomico.directory.repository.SponsorRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Builds sponsor views with their cities from the flat left-join rows.
 *
 * A sponsor with n cities arrives as n rows; a sponsor with none arrives
 * as one row whose city columns are null. Rows are grouped back to one
 * view per sponsor in query order, and the null city of the second case
 * is skipped so the lists come out empty instead of holding a null.
 */
@Service
public class SponsorCityAggregator {

    private final SponsorRepository sponsorRepo;

    public SponsorCityAggregator(SponsorRepository sponsorRepo) {
        this.sponsorRepo = sponsorRepo;
    }

    @Transactional(readOnly = true)
    public Optional<SponsorView> fetchSponsorWithCities(Long sponsorId) {
        List<SponsorView> views = group(sponsorRepo.findWithCitiesById(sponsorId));
        return views.isEmpty() ? Optional.empty() : Optional.of(views.get(0));
    }

    @Transactional(readOnly = true)
    public List<SponsorView> fetchSponsorsWithCities() {
        return group(sponsorRepo.findAllWithCities());
    }

    /** Case-insensitive substring match on name, email or representative. */
    @Transactional(readOnly = true)
    public List<SponsorView> searchSponsorsWithCities(String fragment) {
        return group(sponsorRepo.searchWithCities(fragment));
    }

    static List<SponsorView> group(List<SponsorCityRow> rows) {
        Map<Long, SponsorView> bySponsor = new LinkedHashMap<>();

        for (SponsorCityRow row : rows) {
            Sponsor sponsor = row.sponsor();
            SponsorView view = bySponsor.computeIfAbsent(sponsor.getId(), id -> toView(sponsor));

            if (row.cityId() != null) {
                view.getCityIds().add(row.cityId());
                view.getCityNames().add(row.cityName());
            }
        }

        return new ArrayList<>(bySponsor.values());
    }

    private static SponsorView toView(Sponsor sponsor) {
        return SponsorView.builder()
                .id(sponsor.getId())
                .name(sponsor.getName())
                .email(sponsor.getEmail())
                .phone(sponsor.getPhone())
                .representative(sponsor.getRepresentative())
                .logoLight(sponsor.getLogoLight())
                .logoDark(sponsor.getLogoDark())
                .createdAt(sponsor.getCreatedAt())
                .build();
    }
}
