package com.logicleaf.dealmatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuyerPreferences {
    private Boolean stopSendingDeals;
    private Boolean doNotSendMarketedDeals;
    private Boolean allowBuyerLikeDeals;
}
