package io.github.flameyossnowy.dynrel.api.relation;

import io.github.flameyossnowy.dynrel.api.model.EntityType;
import io.github.flameyossnowy.dynrel.api.model.Model;
import io.github.flameyossnowy.dynrel.api.model.ModelContext;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An unexecuted relationship between a parent model and a related entity type.
 * <p>
 * Nothing is fetched until {@link #getResults()} is called, and every call fetches again.
 * Caching materialized results is up to the owning model.
 *
 * @param <R> the materialized result type
 */
public abstract class Relation<R> {
    protected final Model parent;
    protected final EntityType<? extends Model> related;
    protected final String foreignKey;

    protected Relation(@NotNull Model parent, @NotNull EntityType<? extends Model> related, @NotNull String foreignKey) {
        this.parent = Objects.requireNonNull(parent, "Parent cannot be null");
        this.related = Objects.requireNonNull(related, "Related entity type cannot be null");
        this.foreignKey = Objects.requireNonNull(foreignKey, "Foreign key cannot be null");
    }

    /**
     * Executes the underlying query and returns the materialized value.
     */
    public abstract R getResults();

    public abstract RelationshipKind getKind();

    public Model getParent() {
        return parent;
    }

    public EntityType<? extends Model> getRelated() {
        return related;
    }

    public String getForeignKey() {
        return foreignKey;
    }

    @SuppressWarnings("unchecked")
    protected <M extends Model> List<M> fetch(@NotNull String column, @Nullable Object value) {
        ModelContext context = parent.getContext();
        List<Map<String, Object>> rows = context.source().where(related.table(), column, value);

        List<M> models = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            models.add((M) related.factory().create(context, row));
        }
        return models;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
            "parent=" + parent.getClass().getSimpleName() +
            ", related=" + related.identifier() +
            ", foreignKey='" + foreignKey + '\'' +
            '}';
    }
}
