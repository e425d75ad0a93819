package com.logicleaf.dealmatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessModel {
    public static final String RECURRING_REVENUE = "Recurring Revenue";
    public static final String PROJECT_BASED = "Project-Based";
    public static final String ASSET_LIGHT = "Asset Light";
    public static final String ASSET_HEAVY = "Asset Heavy";

    private boolean recurringRevenue;
    private boolean projectBased;
    private boolean assetLight;
    private boolean assetHeavy;
}
