package com.flagship.donation_pipeline.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * HATEOAS link lookup on PayPal resources.
 */
public final class PayPalLinks {

    private PayPalLinks() {
    }

    /**
     * Returns the href of the first link matching one of {@code rels}, tried in order.
     */
    public static Optional<String> find(JsonNode resource, String... rels) {
        JsonNode links = resource.path("links");
        for (String rel : rels) {
            for (JsonNode link : links) {
                if (rel.equals(link.path("rel").asText()) && link.hasNonNull("href")) {
                    return Optional.of(link.get("href").asText());
                }
            }
        }
        return Optional.empty();
    }
}
