package com.logicleaf.dealmatch.store;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Pre-filter for candidate profiles: a buyer must target at least one of the countries and the
 * industry sector.
 */
@Value
@Builder
public class ProfileFilter {
    Set<String> countries;
    String industrySector;
}
