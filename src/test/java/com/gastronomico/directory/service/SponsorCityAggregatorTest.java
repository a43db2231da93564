package com.gastronomico.directory.service;

import com.gastronomico.directory.entity.Sponsor;
import com.gastronomico.directory.model.SponsorView;
import com.gastronomico.directory.repository.SponsorCityRow;
import com.gastronomico.directory.repository.SponsorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SponsorCityAggregatorTest {

    private SponsorRepository sponsorRepo;
    private SponsorCityAggregator aggregator;

    @BeforeEach
    void setUp() {
        sponsorRepo = mock(SponsorRepository.class);
        aggregator = new SponsorCityAggregator(sponsorRepo);
    }

    @Test
    void groupsRowsPerSponsorKeepingQueryOrder() {
        Sponsor acme = sponsor(1L, "Acme", "a@a.com");
        Sponsor lonely = sponsor(2L, "Lonely", "l@l.com");
        Sponsor zeta = sponsor(3L, "Zeta", "z@z.com");

        List<SponsorView> views = SponsorCityAggregator.group(List.of(
                new SponsorCityRow(acme, 7L, "Arequipa"),
                new SponsorCityRow(acme, 1L, "Lima"),
                new SponsorCityRow(lonely, null, null),
                new SponsorCityRow(zeta, 4L, "Cusco")));

        assertEquals(3, views.size());
        assertEquals(List.of(1L, 2L, 3L), views.stream().map(SponsorView::getId).toList());

        SponsorView first = views.get(0);
        assertEquals("Acme", first.getName());
        assertEquals("a@a.com", first.getEmail());
        assertEquals(List.of(7L, 1L), first.getCityIds());
        assertEquals(List.of("Arequipa", "Lima"), first.getCityNames());

        assertEquals(List.of(4L), views.get(2).getCityIds());
        assertEquals(List.of("Cusco"), views.get(2).getCityNames());
    }

    @Test
    void sponsorWithoutCitiesGetsEmptyListsNotNullEntries() {
        List<SponsorView> views = SponsorCityAggregator.group(List.of(
                new SponsorCityRow(sponsor(9L, "Solo", "s@s.com"), null, null)));

        SponsorView view = views.get(0);
        assertNotNull(view.getCityIds());
        assertNotNull(view.getCityNames());
        assertTrue(view.getCityIds().isEmpty());
        assertTrue(view.getCityNames().isEmpty());
    }

    @Test
    void fetchSingleReturnsEmptyWhenSponsorIsUnknown() {
        when(sponsorRepo.findWithCitiesById(42L)).thenReturn(List.of());

        assertEquals(Optional.empty(), aggregator.fetchSponsorWithCities(42L));
    }

    @Test
    void fetchSingleCollectsAllCitiesOfTheSponsor() {
        Sponsor acme = sponsor(1L, "Acme", "a@a.com");
        when(sponsorRepo.findWithCitiesById(1L)).thenReturn(List.of(
                new SponsorCityRow(acme, 2L, "Cusco"),
                new SponsorCityRow(acme, 1L, "Lima")));

        SponsorView view = aggregator.fetchSponsorWithCities(1L).orElseThrow();

        assertEquals(List.of(2L, 1L), view.getCityIds());
        assertEquals(List.of("Cusco", "Lima"), view.getCityNames());
    }

    @Test
    void searchDelegatesFragmentToRepository() {
        when(sponsorRepo.searchWithCities("acm")).thenReturn(List.of(
                new SponsorCityRow(sponsor(1L, "Acme", "a@a.com"), null, null)));

        List<SponsorView> views = aggregator.searchSponsorsWithCities("acm");

        assertEquals(1, views.size());
        verify(sponsorRepo).searchWithCities("acm");
    }

    private static Sponsor sponsor(Long id, String name, String email) {
        return Sponsor.builder()
                .id(id)
                .name(name)
                .email(email)
                .createdAt(LocalDateTime.of(2025, 1, 1, 12, 0))
                .build();
    }
}
