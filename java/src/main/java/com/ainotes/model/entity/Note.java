package com.ainotes.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A user's note. Tags are stored denormalized as a comma-separated string;
 * the embedding is present only after a successful enrichment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("notes")
public class Note {

    public static final int TAGS_MAX_LENGTH = 500;

    @Id
    private UUID id;

    @Column("title")
    private String title;

    @Column("content")
    private String content;

    @Column("tags")
    private String tags; // comma-separated

    @Column("embedding")
    private float[] embedding;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    @Column("owner_subject")
    private String ownerSubject;

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
