package com.ainotes.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for related-note retrieval.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelatedNotesResponse {
    private String noteId;

    @Builder.Default
    private List<RelatedNote> relatedNotes = List.of();
}
