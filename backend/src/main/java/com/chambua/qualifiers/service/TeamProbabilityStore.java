package com.chambua.qualifiers.service;

import com.chambua.qualifiers.model.MaterializationCounts;
import com.chambua.qualifiers.model.ProbabilityResult;

import java.util.List;

/**
 * Current probability table keyed by (team, confederation, group).
 * {@link #upsertAll} must be all-or-nothing.
 */
public interface TeamProbabilityStore {

    MaterializationCounts upsertAll(List<ProbabilityResult> results);

    List<ProbabilityResult> findAll();
}
