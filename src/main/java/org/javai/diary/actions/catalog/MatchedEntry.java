package org.javai.diary.actions.catalog;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Lightweight, read-only projection of a catalog row used for resolution and display.
 *
 * @param id the row identifier
 * @param title the row title
 * @param status the current status, or null if the row has none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchedEntry(String id, String title, String status) {
}
