package com.logicleaf.dealmatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuyerFit {
    private List<String> capitalAvailability;
    private Double minTransactionSize;
    private Integer minPriorAcquisitions;
}
