package com.logicleaf.dealmatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Timeline {
    private Instant createdAt;
    private Instant updatedAt;
    private Instant publishedAt;
    private Instant completedAt;
}
