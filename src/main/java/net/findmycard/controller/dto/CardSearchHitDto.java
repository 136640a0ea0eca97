package net.findmycard.controller.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Search row: the flattened identity plus the printing shown for it.
 */
public record CardSearchHitDto(@JsonUnwrapped CardDto card, PrintingDto printing) {
}
