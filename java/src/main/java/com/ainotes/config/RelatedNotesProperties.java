package com.ainotes.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings of related-note retrieval.
 */
@Data
@Component
@ConfigurationProperties(prefix = "ainotes.related")
public class RelatedNotesProperties {

    private int defaultCount = 5;

    private int maxCount = 50;

    /**
     * Neighbours scoring below this cosine similarity are dropped.
     */
    private double similarityThreshold = 0.7;
}
