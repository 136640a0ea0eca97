package net.findmycard.controller.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import java.util.List;

/**
 * A card identity with all of its printings, representative first.
 */
public record CardDetailDto(@JsonUnwrapped CardDto card, List<PrintingDto> printings) {
}
