package com.logicleaf.dealmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyActivityDTO {
    // yyyy-MM-dd, UTC
    private String date;
    private long activations;
    private long rejections;
    private long views;
}
