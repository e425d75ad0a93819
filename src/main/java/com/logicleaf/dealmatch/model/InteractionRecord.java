package com.logicleaf.dealmatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "deal_tracking")
public class InteractionRecord {

    @Id
    private String id;

    @Indexed
    private String listingId;
    private String buyerId;

    private InteractionType interactionType;
    private Instant timestamp;
    private String notes;

    private Map<String, String> metadata;
}
