package com.ainotes.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Single related-note hit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelatedNote {
    private String id;
    private String title;
    private String tags;
    private LocalDateTime updatedAt;
    private Double score;
}
