package io.github.flameyossnowy.dynrel.api.model;

import io.github.flameyossnowy.dynrel.api.relation.Relation;

/**
 * An ordinary named relation defined on a model.
 * <p>
 * Must return a {@link Relation}; any other value is rejected when the relation is materialized.
 */
@FunctionalInterface
public interface RelationMethod {
    Object relation();
}
