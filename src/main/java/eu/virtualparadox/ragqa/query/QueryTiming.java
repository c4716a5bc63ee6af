package eu.virtualparadox.ragqa.query;

/**
 * Wall-clock durations of one query, in milliseconds rounded to two decimals.
 * {@code totalMs} covers the whole query, including context assembly.
 */
public record QueryTiming(double embeddingMs, double retrievalMs, double generationMs, double totalMs) {

}
