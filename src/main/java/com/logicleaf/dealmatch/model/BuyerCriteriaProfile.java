package com.logicleaf.dealmatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "company_profiles")
public class BuyerCriteriaProfile {

    @Id
    private String id;

    @Indexed(unique = true)
    private String buyerId;

    private String buyerName;
    private String buyerEmail;
    private String companyName;
    private String companyType;
    private String capitalEntity;
    private Integer dealsCompletedLast5Years;
    private Double averageDealSize;

    private TargetCriteria targetCriteria;
    private BuyerPreferences preferences;
}
