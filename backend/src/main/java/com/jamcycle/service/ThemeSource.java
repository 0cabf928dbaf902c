package com.jamcycle.service;

import com.jamcycle.model.GuildState;

import java.util.Optional;

/**
 * Proposes the theme of the next cycle.
 */
public interface ThemeSource {

    Optional<String> proposeTheme(GuildState state);
}
