package com.peakrank.service;

import com.peakrank.model.Division;
import com.peakrank.repository.DivisionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.Period;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Selects the competitive division for an athlete's age and gender.
 * Candidates are ordered by {@code sortOrder}, then creation time, then id.
 */
@Service
@RequiredArgsConstructor
public class DivisionMatcher {

    private static final Comparator<Division> PRIORITY = Comparator
            .comparing((Division division) -> division.getSortOrder() == null ? 0 : division.getSortOrder())
            .thenComparing(Division::getCreatedAt, Comparator.nullsLast(Comparator.<OffsetDateTime>naturalOrder()))
            .thenComparing(Division::getDivisionId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final DivisionRepository divisionRepository;

    public Optional<Division> match(LocalDate dateOfBirth, String gender, LocalDate today) {
        if (dateOfBirth == null) {
            return Optional.empty();
        }
        return select(divisionRepository.findByActiveTrueOrderBySortOrderAscCreatedAtAsc(), dateOfBirth, gender, today);
    }

    public Optional<Division> select(List<Division> divisions, LocalDate dateOfBirth, String gender, LocalDate today) {
        Objects.requireNonNull(today, "today is required");
        if (dateOfBirth == null || divisions == null) {
            return Optional.empty();
        }
        int age = ageOn(dateOfBirth, today);
        return divisions.stream()
                .filter(Division::isActive)
                .filter(division -> genderMatches(division.getGender(), gender))
                .filter(division -> division.getAgeMin() == null || age >= division.getAgeMin())
                .filter(division -> division.getAgeMax() == null || age <= division.getAgeMax())
                .min(PRIORITY);
    }

    public static int ageOn(LocalDate dateOfBirth, LocalDate today) {
        return Period.between(dateOfBirth, today).getYears();
    }

    private static boolean genderMatches(String divisionGender, String athleteGender) {
        if (divisionGender == null || divisionGender.isBlank()) {
            return true;
        }
        return athleteGender != null && divisionGender.trim().equalsIgnoreCase(athleteGender.trim());
    }
}
