package net.findmycard.model;

import java.util.Map;

/**
 * One face of a transform, modal or split card.
 */
public record CardFace(String name,
                       String manaCost,
                       String typeLine,
                       String oracleText,
                       Map<String, String> imageUris) {

    public CardFace {
        imageUris = imageUris == null ? Map.of() : Map.copyOf(imageUris);
    }
}
