package eu.virtualparadox.ragqa.rag.index.model;

/**
 * @param totalVectors number of chunk vectors in the index
 * @param dimension    vector dimension, {@code 0} while the index is empty
 */
public record IndexStats(int totalVectors, int dimension) {

}
