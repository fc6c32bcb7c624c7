package com.ainotes.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * HTTP body for the backfill endpoint. The owner comes from the authenticated principal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillTagsRequest {

    @Builder.Default
    private boolean onlyMissing = true;
}
