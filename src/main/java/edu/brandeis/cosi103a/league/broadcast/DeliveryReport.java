package edu.brandeis.cosi103a.league.broadcast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one broadcast. {@code successful + failed == total} always holds.
 */
public record DeliveryReport(
    @JsonProperty("total") int total,
    @JsonProperty("successful") int successful,
    @JsonProperty("failed") int failed,
    @JsonProperty("failed_ids") ImmutableList<String> failedIds,
    @JsonProperty("errors") ImmutableMap<String, String> errors
) {
    public DeliveryReport {
        if (successful + failed != total) {
            throw new IllegalArgumentException(
                "successful (" + successful + ") + failed (" + failed + ") != total (" + total + ")");
        }
        if (failedIds.size() != failed) {
            throw new IllegalArgumentException("failed_ids does not match failed count");
        }
    }

    public double successRate() {
        return total == 0 ? 1.0 : (double) successful / total;
    }

    public boolean allDelivered() {
        return failed == 0;
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Collects per-recipient outcomes for a single broadcast call.
     */
    static final class Builder {
        private int successful;
        private final List<String> failedIds = new ArrayList<>();
        private final Map<String, String> errors = new LinkedHashMap<>();

        Builder success() {
            successful++;
            return this;
        }

        Builder failure(String recipientId, String error) {
            failedIds.add(recipientId);
            errors.put(recipientId, error);
            return this;
        }

        DeliveryReport build() {
            return new DeliveryReport(
                successful + failedIds.size(),
                successful,
                failedIds.size(),
                ImmutableList.copyOf(failedIds),
                ImmutableMap.copyOf(errors));
        }
    }
}
