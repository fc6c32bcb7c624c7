package com.ainotes.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Summary of one backfill run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillResult {

    private int processedCount;

    private int totalNotes;

    @Builder.Default
    private List<String> errors = List.of();

    /**
     * Set when the run stopped early because its cancellation signal fired.
     */
    private boolean cancelled;
}
