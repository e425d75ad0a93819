package com.logicleaf.dealmatch.service;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Continent / region / country tree used to widen a listing's geography before it is compared
 * with the countries a buyer targets.
 */
@Component
public class GeographyHierarchy {

    private final Map<String, List<String>> children = new LinkedHashMap<>();
    private final Map<String, String> parents = new HashMap<>();

    public GeographyHierarchy() {
        node("North America", "United States", "Canada", "Mexico");
        node("South America", "Brazil", "Argentina", "Chile", "Colombia", "Peru", "Uruguay");
        node("Europe", "Western Europe", "Northern Europe", "Southern Europe", "Eastern Europe");
        node("Western Europe", "United Kingdom", "Ireland", "France", "Germany", "Netherlands", "Belgium",
                "Luxembourg", "Switzerland", "Austria");
        node("Northern Europe", "Sweden", "Norway", "Denmark", "Finland", "Iceland");
        node("Southern Europe", "Spain", "Portugal", "Italy", "Greece", "Malta", "Cyprus");
        node("Eastern Europe", "Poland", "Czech Republic", "Hungary", "Romania", "Bulgaria", "Slovakia", "Ukraine");
        node("Asia", "East Asia", "South Asia", "Southeast Asia", "Middle East");
        node("East Asia", "China", "Japan", "South Korea", "Hong Kong", "Taiwan");
        node("South Asia", "India", "Pakistan", "Bangladesh", "Sri Lanka");
        node("Southeast Asia", "Singapore", "Malaysia", "Indonesia", "Thailand", "Vietnam", "Philippines");
        node("Middle East", "United Arab Emirates", "Saudi Arabia", "Qatar", "Israel", "Turkey");
        node("Africa", "West Africa", "East Africa", "Southern Africa", "North Africa");
        node("West Africa", "Nigeria", "Ghana", "Senegal", "Ivory Coast");
        node("East Africa", "Kenya", "Ethiopia", "Tanzania", "Uganda", "Rwanda");
        node("Southern Africa", "South Africa", "Botswana", "Namibia", "Zambia");
        node("North Africa", "Egypt", "Morocco", "Tunisia", "Algeria");
        node("Oceania", "Australia", "New Zealand");
    }

    private void node(String name, String... members) {
        children.put(name, List.of(members));
        for (String member : members) {
            parents.put(member, name);
        }
    }

    /**
     * The selection itself, every enclosing region and continent, and everything it contains.
     * Unknown names expand to themselves only.
     */
    public Set<String> expand(String selection) {
        if (selection == null || selection.isBlank()) {
            return Collections.emptySet();
        }
        Set<String> expanded = new LinkedHashSet<>();
        expanded.add(selection);

        String parent = parents.get(selection);
        while (parent != null) {
            expanded.add(parent);
            parent = parents.get(parent);
        }

        Deque<String> pending = new ArrayDeque<>(children.getOrDefault(selection, List.of()));
        while (!pending.isEmpty()) {
            String next = pending.pop();
            if (expanded.add(next)) {
                pending.addAll(children.getOrDefault(next, List.of()));
            }
        }
        return expanded;
    }
}
