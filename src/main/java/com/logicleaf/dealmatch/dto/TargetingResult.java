package com.logicleaf.dealmatch.dto;

import com.logicleaf.dealmatch.model.Listing;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TargetingResult {
    private Listing listing;
    private List<String> newlyTargeted;
    private List<String> alreadyTargeted;
}
