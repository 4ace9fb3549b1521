package it.aw.hybridsearch.model;

import it.aw.hybridsearch.exception.ValidationException;

import java.time.LocalDate;

/** Intervallo di date di documento, estremi inclusi; uno dei due può mancare. */
public record DateRange(LocalDate from, LocalDate to) {

    public DateRange {
        if (from == null && to == null) {
            throw new ValidationException("dateRange richiede almeno uno tra 'from' e 'to'");
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("dateRange non valido: " + from + " successivo a " + to);
        }
    }
}
