package io.github.flameyossnowy.dynrel.api.relation;

import io.github.flameyossnowy.dynrel.api.model.EntityType;
import io.github.flameyossnowy.dynrel.api.model.Model;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Related rows carry the parent's key in {@code foreignKey}.
 */
public class HasMany<M extends Model> extends Relation<List<M>> {
    public HasMany(@NotNull Model parent, @NotNull EntityType<M> related, @NotNull String foreignKey) {
        super(parent, related, foreignKey);
    }

    @Override
    public List<M> getResults() {
        Object key = parent.getKey();
        if (key == null) {
            return List.of();
        }
        return List.copyOf(this.<M>fetch(foreignKey, key));
    }

    @Override
    public RelationshipKind getKind() {
        return RelationshipKind.HAS_MANY;
    }
}
