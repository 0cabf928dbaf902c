package com.jamcycle.service;

import com.jamcycle.config.JamCycleProperties;
import com.jamcycle.model.ArchivedCycle;
import com.jamcycle.model.GuildState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Draws the next theme from the configured pool, avoiding the current theme and archived ones
 * while unused themes remain.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredThemeSource implements ThemeSource {

    private final JamCycleProperties jamCycleProperties;
    private final Random competitionRandom;

    @Override
    public Optional<String> proposeTheme(GuildState state) {
        List<String> pool = jamCycleProperties.getThemes().getPool().stream()
                .filter(theme -> theme != null && !theme.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
        if (pool.isEmpty()) {
            return Optional.empty();
        }

        Set<String> used = new HashSet<>();
        if (state.cycle().theme() != null) {
            used.add(state.cycle().theme());
        }
        for (ArchivedCycle archived : state.archive().values()) {
            if (archived.theme() != null) {
                used.add(archived.theme());
            }
        }

        List<String> fresh = pool.stream().filter(theme -> !used.contains(theme)).toList();
        if (fresh.isEmpty()) {
            fresh = pool.stream().filter(theme -> !theme.equals(state.cycle().theme())).toList();
        }
        if (fresh.isEmpty()) {
            return Optional.of(pool.get(0));
        }
        return Optional.of(fresh.get(competitionRandom.nextInt(fresh.size())));
    }
}
