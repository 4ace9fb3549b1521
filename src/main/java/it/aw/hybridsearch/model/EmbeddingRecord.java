package it.aw.hybridsearch.model;

import java.util.Arrays;

/**
 * Vettore persistito per un chunk. Il vettore è copiato in ingresso e in uscita:
 * il record resta immutabile anche se il chiamante modifica l'array.
 */
public record EmbeddingRecord(String chunkId, int sequenceIndex, float[] vector, String documentId, String tenantId) {

    public EmbeddingRecord {
        vector = vector.clone();
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    public int dimensions() {
        return vector.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmbeddingRecord other)) return false;
        return sequenceIndex == other.sequenceIndex
                && chunkId.equals(other.chunkId)
                && documentId.equals(other.documentId)
                && tenantId.equals(other.tenantId)
                && Arrays.equals(vector, other.vector);
    }

    @Override
    public int hashCode() {
        int result = chunkId.hashCode();
        result = 31 * result + sequenceIndex;
        result = 31 * result + Arrays.hashCode(vector);
        return result;
    }

    @Override
    public String toString() {
        return "EmbeddingRecord[chunkId=" + chunkId + ", dimensions=" + vector.length + "]";
    }
}
