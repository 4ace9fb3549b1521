package it.aw.hybridsearch.store;

import it.aw.hybridsearch.model.Chunk;

/** Chunk con il suo vettore, pronto per essere scritto nello store. */
public record VectorEntry(Chunk chunk, float[] vector) {

    public VectorEntry {
        vector = vector.clone();
    }
}
