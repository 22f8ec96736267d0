package io.github.flameyossnowy.dynrel.api.dynamic;

import io.github.flameyossnowy.dynrel.api.relation.RelationshipKind;

/**
 * What a dynamic relation name resolved to.
 *
 * @param requestedName the name as asked for, possibly an alias
 * @param canonicalName the name after alias resolution
 * @param targetEntity  identifier of the related entity
 * @param key           foreign or local key handed to the construction method
 * @param kind          relationship kind, looked up by the requested name
 */
public record ResolvedRelation(
    String requestedName,
    String canonicalName,
    String targetEntity,
    String key,
    RelationshipKind kind
) {
}
