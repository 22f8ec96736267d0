package io.github.flameyossnowy.dynrel.api.relation;

import io.github.flameyossnowy.dynrel.api.model.EntityType;
import io.github.flameyossnowy.dynrel.api.model.Model;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public class HasOne<M extends Model> extends Relation<M> {
    public HasOne(@NotNull Model parent, @NotNull EntityType<M> related, @NotNull String foreignKey) {
        super(parent, related, foreignKey);
    }

    @Override
    public @Nullable M getResults() {
        Object key = parent.getKey();
        if (key == null) {
            return null;
        }

        List<M> results = fetch(foreignKey, key);
        return results.isEmpty() ? null : results.get(0);
    }

    @Override
    public RelationshipKind getKind() {
        return RelationshipKind.HAS_ONE;
    }
}
