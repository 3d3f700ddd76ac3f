package org.clinidex.persistence.bundle;

import java.util.List;

/**
 * Response to a batch or transaction bundle, one result per entry in entry order.
 *
 * @param type    {@code batch-response} or {@code transaction-response}
 * @param entries the entry results
 */
public record BundleResponse(String type, List<BundleEntryResult> entries) {

    public BundleResponse {
        entries = List.copyOf(entries);
    }
}
