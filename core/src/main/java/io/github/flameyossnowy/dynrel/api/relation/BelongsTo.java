package io.github.flameyossnowy.dynrel.api.relation;

import io.github.flameyossnowy.dynrel.api.model.EntityType;
import io.github.flameyossnowy.dynrel.api.model.Model;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The parent carries the owner's key in {@code foreignKey}; the owner is matched on its primary key.
 */
public class BelongsTo<M extends Model> extends Relation<M> {
    public BelongsTo(@NotNull Model parent, @NotNull EntityType<M> related, @NotNull String foreignKey) {
        super(parent, related, foreignKey);
    }

    public String getOwnerKey() {
        return related.primaryKey();
    }

    @Override
    public @Nullable M getResults() {
        Object value = parent.getAttribute(foreignKey);
        if (value == null) {
            return null;
        }

        List<M> results = fetch(getOwnerKey(), value);
        return results.isEmpty() ? null : results.get(0);
    }

    @Override
    public RelationshipKind getKind() {
        return RelationshipKind.BELONGS_TO;
    }
}
