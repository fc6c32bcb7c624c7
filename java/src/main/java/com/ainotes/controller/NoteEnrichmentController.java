package com.ainotes.controller;

import com.ainotes.model.dto.BackfillRequest;
import com.ainotes.model.dto.BackfillResult;
import com.ainotes.model.dto.BackfillTagsRequest;
import com.ainotes.model.dto.RelatedNotesResponse;
import com.ainotes.service.BackfillCoordinator;
import com.ainotes.service.RelatedNotesService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * Controller for AI enrichment of the caller's notes.
 */
@RestController
@RequestMapping("/v1/notes")
@RequiredArgsConstructor
public class NoteEnrichmentController {

    private final BackfillCoordinator backfillCoordinator;
    private final RelatedNotesService relatedNotesService;

    @PostMapping("/backfill-tags")
    public Mono<BackfillResult> backfillTags(
            @AuthenticationPrincipal String ownerSubject,
            @RequestBody(required = false) BackfillTagsRequest body) {
        BackfillRequest request = BackfillRequest.builder()
                .ownerSubject(ownerSubject)
                .onlyMissing(body == null || body.isOnlyMissing())
                .build();
        return backfillCoordinator.backfillTags(request);
    }

    @GetMapping("/{id}/related")
    public Mono<RelatedNotesResponse> relatedNotes(
            @AuthenticationPrincipal String ownerSubject,
            @PathVariable UUID id,
            @RequestParam(required = false) Integer topN) {
        return relatedNotesService.findRelated(ownerSubject, id, topN);
    }

    @PostMapping("/{id}/embedding")
    public Mono<Map<String, Object>> refreshEmbedding(
            @AuthenticationPrincipal String ownerSubject,
            @PathVariable UUID id) {
        return relatedNotesService.refreshEmbedding(ownerSubject, id)
                .map(note -> Map.of(
                        "id", note.getId().toString(),
                        "dimensions", note.getEmbedding().length
                ));
    }
}
