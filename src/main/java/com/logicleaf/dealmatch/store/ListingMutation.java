package com.logicleaf.dealmatch.store;

import com.logicleaf.dealmatch.model.Listing;

/**
 * Read-modify-write step applied to a freshly loaded listing. Must depend only on the listing
 * it receives, since the unit of work may run it again against a newer version.
 */
@FunctionalInterface
public interface ListingMutation<T> {

    Outcome<T> apply(Listing listing);

    record Outcome<T>(T value, boolean changed) {

        public static <T> Outcome<T> changed(T value) {
            return new Outcome<>(value, true);
        }

        public static <T> Outcome<T> unchanged(T value) {
            return new Outcome<>(value, false);
        }
    }
}
