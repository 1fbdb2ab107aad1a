package com.example.datadestruction.http;

import com.example.datadestruction.service.DeletionOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Success body for a destruction request. {@code deleted_ids} is omitted when nothing was
 * deleted; {@code not_found} is always present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DestructionResponse(
        @JsonProperty("message") String message,
        @JsonProperty("deleted_ids") List<String> deletedIds,
        @JsonProperty("not_found") List<String> notFound
) {

    static final String NO_MATCH_MESSAGE = "No matching Connect_IDs found";

    public static DestructionResponse from(DeletionOutcome outcome) {
        List<String> notFound = List.copyOf(outcome.notFound());
        if (!outcome.hasDeletions()) {
            return new DestructionResponse(NO_MATCH_MESSAGE, null, notFound);
        }
        String message = "Deleted " + outcome.deletedIds().size() + " records from "
                + outcome.target().physicalName();
        return new DestructionResponse(message, List.copyOf(outcome.deletedIds()), notFound);
    }
}
