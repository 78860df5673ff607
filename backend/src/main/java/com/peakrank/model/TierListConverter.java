package com.peakrank.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Stores an ordered tier list as a comma separated string, e.g. {@code "F,E,D"}.
 */
@Converter
public class TierListConverter implements AttributeConverter<List<Tier>, String> {

    private static final String SEPARATOR = ",";

    @Override
    public String convertToDatabaseColumn(List<Tier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            return "";
        }
        return String.join(SEPARATOR, tiers.stream().map(Tier::name).toList());
    }

    @Override
    public List<Tier> convertToEntityAttribute(String value) {
        if (value == null || value.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.stream(value.split(SEPARATOR))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .map(Tier::valueOf)
                .toList());
    }
}
