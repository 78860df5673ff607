package com.peakrank.config;

import com.peakrank.model.Tier;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Level threshold settings.
 * When {@code levelThresholds} is empty the table is derived from {@code xpPerSublevel}:
 * ten sublevels per tier letter, each costing that letter's XP.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "peakrank.progression")
public class ProgressionProperties {

    private List<Long> levelThresholds = new ArrayList<>();

    private Map<Tier, Integer> xpPerSublevel = defaultXpPerSublevel();

    private static Map<Tier, Integer> defaultXpPerSublevel() {
        Map<Tier, Integer> defaults = new EnumMap<>(Tier.class);
        defaults.put(Tier.F, 100);
        defaults.put(Tier.E, 200);
        defaults.put(Tier.D, 400);
        defaults.put(Tier.C, 800);
        defaults.put(Tier.B, 1600);
        defaults.put(Tier.A, 3200);
        defaults.put(Tier.S, 6400);
        return defaults;
    }
}
