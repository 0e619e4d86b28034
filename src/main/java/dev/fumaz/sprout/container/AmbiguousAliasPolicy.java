package dev.fumaz.sprout.container;

/**
 * Decides what happens to an inferred name that matches several registered types.
 */
public enum AmbiguousAliasPolicy {

    /**
     * Ambiguous names are left out of the provider's name table. Building only fails when a dependency consumes an
     * ambiguous name without an exact alias.
     */
    LENIENT,

    /**
     * Building fails for any ambiguous name that no exact alias overrides, whether or not it is consumed.
     */
    EAGER

}
