package fr.lapetina.failover.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Upstream origin identified by host, optionally followed by a port.
 * Immutable and thread-safe.
 *
 * The authority is opaque to the router: it is only ever substituted into
 * {@code http://<authority><path>} when an attempt is made.
 */
public record Origin(String authority) {

    public Origin {
        Objects.requireNonNull(authority, "Origin authority is required");
        if (authority.isBlank()) {
            throw new IllegalArgumentException("Origin authority must not be blank");
        }
        for (int i = 0; i < authority.length(); i++) {
            char c = authority.charAt(i);
            if (Character.isWhitespace(c) || c == '/' || c == '?' || c == '#') {
                throw new IllegalArgumentException(
                        "Origin must be a bare host[:port], got: " + authority);
            }
        }
    }

    /**
     * Parses a single origin, trimming surrounding whitespace.
     */
    public static Origin of(String text) {
        Objects.requireNonNull(text, "Origin text is required");
        return new Origin(text.trim());
    }

    /**
     * Parses an ordered, comma-separated origin list. Empty entries are skipped.
     */
    public static List<Origin> parseList(String csv) {
        List<Origin> origins = new ArrayList<>();
        if (csv == null) {
            return origins;
        }
        for (String part : csv.split(",")) {
            if (!part.isBlank()) {
                origins.add(of(part));
            }
        }
        return origins;
    }

    @Override
    public String toString() {
        return authority;
    }
}
