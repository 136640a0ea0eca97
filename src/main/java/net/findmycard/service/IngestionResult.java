package net.findmycard.service;

/**
 * Outcome of one catalog write.
 *
 * @param received card objects in the payload
 * @param stored printings written to the repository
 * @param skipped objects rejected by the mapper or, for market data, unknown printing ids
 */
public record IngestionResult(int received, int stored, int skipped) {
}
