package it.aw.hybridsearch.controller;

import it.aw.hybridsearch.model.HybridResult;
import it.aw.hybridsearch.model.SearchOutcome;
import it.aw.hybridsearch.model.SearchStats;

import java.util.List;

/**
 * Risposta di POST /api/search.
 *
 * @param explanations presenti solo se richieste, nello stesso ordine dei risultati
 */
public record SearchResponse(List<HybridResult> results,
                             SearchOutcome.Source source,
                             SearchStats stats,
                             List<String> explanations) {}
