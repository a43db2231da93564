package com.gastronomico.directory.service;

import com.gastronomico.directory.entity.City;
import com.gastronomico.directory.entity.Sponsor;
import com.gastronomico.directory.entity.SponsorCity;
import com.gastronomico.directory.exception.ConflictException;
import com.gastronomico.directory.exception.ReferenceNotFoundException;
import com.gastronomico.directory.repository.CityRepository;
import com.gastronomico.directory.repository.SponsorCityRepository;
import com.gastronomico.directory.repository.SponsorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class SponsorCitySynchronizerTest {

    private SponsorRepository sponsorRepo;
    private CityRepository cityRepo;
    private SponsorCityRepository linkRepo;
    private SponsorCitySynchronizer synchronizer;

    @BeforeEach
    void setUp() {
        sponsorRepo = mock(SponsorRepository.class);
        cityRepo = mock(CityRepository.class);
        linkRepo = mock(SponsorCityRepository.class);
        synchronizer = new SponsorCitySynchronizer(sponsorRepo, cityRepo, linkRepo);

        when(sponsorRepo.existsById(5L)).thenReturn(true);
        when(sponsorRepo.getReferenceById(5L)).thenReturn(Sponsor.builder().id(5L).build());
    }

    @Test
    void unknownSponsorIsRejectedBeforeTouchingAssociations() {
        assertThrows(ReferenceNotFoundException.class,
                () -> synchronizer.setAssociations(99L, List.of(1L)));

        verify(linkRepo, never()).deleteBySponsorId(anyLong());
    }

    @Test
    void duplicateIdsCollapseToOneRowEach() {
        when(cityRepo.findAllById(Set.of(1L, 2L))).thenReturn(List.of(city(1L, "Lima"), city(2L, "Cusco")));

        Set<Long> result = synchronizer.setAssociations(5L, List.of(1L, 2L, 1L));

        assertEquals(Set.of(1L, 2L), result);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<SponsorCity>> links = ArgumentCaptor.forClass(List.class);
        verify(linkRepo).deleteBySponsorId(5L);
        verify(linkRepo).saveAllAndFlush(links.capture());
        assertEquals(2, links.getValue().size());
        assertTrue(links.getValue().stream().allMatch(l -> l.getSponsor().getId().equals(5L)));
    }

    @Test
    void emptyInputOnlyRemovesExistingRows() {
        Set<Long> result = synchronizer.setAssociations(5L, List.of());

        assertTrue(result.isEmpty());
        verify(linkRepo).deleteBySponsorId(5L);
        verify(cityRepo, never()).findAllById(any());
    }

    @Test
    void missingCityFailsWithoutInsertingAnything() {
        when(cityRepo.findAllById(Set.of(1L, 404L))).thenReturn(List.of(city(1L, "Lima")));

        ReferenceNotFoundException e = assertThrows(ReferenceNotFoundException.class,
                () -> synchronizer.setAssociations(5L, List.of(1L, 404L)));

        assertTrue(e.getMessage().contains("404"));
        verify(linkRepo, never()).deleteBySponsorId(anyLong());
        verify(linkRepo, never()).saveAllAndFlush(any());
    }

    @Test
    void integrityViolationOnInsertBecomesConflict() {
        when(cityRepo.findAllById(Set.of(1L))).thenReturn(List.of(city(1L, "Lima")));
        when(linkRepo.saveAllAndFlush(any())).thenThrow(new DataIntegrityViolationException("dup",
                new SQLException("Unique index or primary key violation", "23505")));

        assertThrows(ConflictException.class, () -> synchronizer.setAssociations(5L, List.of(1L)));
    }

    @Test
    void foreignKeyViolationOnInsertIsNotReportedAsConflict() {
        when(cityRepo.findAllById(Set.of(1L))).thenReturn(List.of(city(1L, "Lima")));
        when(linkRepo.saveAllAndFlush(any())).thenThrow(new DataIntegrityViolationException("fk",
                new SQLException("Referential integrity constraint violation", "23503")));

        assertThrows(DataIntegrityViolationException.class,
                () -> synchronizer.setAssociations(5L, List.of(1L)));
    }

    private static City city(Long id, String name) {
        return City.builder().id(id).name(name).build();
    }
}
