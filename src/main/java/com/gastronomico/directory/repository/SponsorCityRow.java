package com.gastronomico.directory.repository;

import com.gastronomico.directory.entity.Sponsor;

/**
 * One row of the sponsor ⟕ sponsor_cities ⟕ cities join. {@code cityId}
 * and {@code cityName} are both null for a sponsor without cities.
 */
public record SponsorCityRow(Sponsor sponsor, Long cityId, String cityName) {
}
