package io.ecsexporter.core.api;

import java.util.List;

/**
 * One page of a paginated list call.
 *
 * @param identifiers resource ARNs in response order
 * @param nextToken   continuation token, {@code null} on the last page
 */
public record IdentifierPage(List<String> identifiers, String nextToken) {

    public IdentifierPage {
        identifiers = identifiers == null ? List.of() : List.copyOf(identifiers);
        if (nextToken != null && nextToken.isEmpty()) {
            nextToken = null;
        }
    }

    public static IdentifierPage last(List<String> identifiers) {
        return new IdentifierPage(identifiers, null);
    }

    public boolean hasNextToken() {
        return nextToken != null;
    }
}
