package net.findmycard.controller.dto;

/**
 * Counts reported back to catalog ingestion callers.
 */
public record IngestionResultDto(int received, int stored, int skipped) {
}
