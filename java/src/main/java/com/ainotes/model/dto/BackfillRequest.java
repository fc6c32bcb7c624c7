package com.ainotes.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters of one tag backfill run. Scoped to a single owner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillRequest {

    @NotBlank(message = "Owner subject is required")
    private String ownerSubject;

    /**
     * When true only notes with empty tags are candidates.
     */
    @Builder.Default
    private boolean onlyMissing = true;
}
