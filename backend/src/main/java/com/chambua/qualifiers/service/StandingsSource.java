package com.chambua.qualifiers.service;

import com.chambua.qualifiers.dto.StandingIngestItem;

import java.util.List;

/** Supplies the current qualifier standings, one item per team and group. */
public interface StandingsSource {

    List<StandingIngestItem> fetchCurrentStandings();
}
