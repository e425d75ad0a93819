package com.logicleaf.dealmatch.service;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeographyHierarchyTest {

    private final GeographyHierarchy hierarchy = new GeographyHierarchy();

    @Test
    void countryExpandsToItsRegionAndContinent() {
        assertEquals(Set.of("France", "Western Europe", "Europe"), hierarchy.expand("France"));
    }

    @Test
    void continentExpandsToEverythingBelowIt() {
        Set<String> europe = hierarchy.expand("Europe");

        assertTrue(europe.containsAll(Set.of("Europe", "Western Europe", "Southern Europe", "France", "Italy")));
        assertFalse(europe.contains("Japan"));
    }

    @Test
    void unknownAndBlankSelections() {
        assertEquals(Set.of("Atlantis"), hierarchy.expand("Atlantis"));
        assertTrue(hierarchy.expand(" ").isEmpty());
        assertTrue(hierarchy.expand(null).isEmpty());
    }
}
