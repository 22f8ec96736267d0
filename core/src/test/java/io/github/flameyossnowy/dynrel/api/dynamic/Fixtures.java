package io.github.flameyossnowy.dynrel.api.dynamic;

import io.github.flameyossnowy.dynrel.api.model.EntityRegistry;
import io.github.flameyossnowy.dynrel.api.model.EntityType;
import io.github.flameyossnowy.dynrel.api.model.InMemoryRecordSource;
import io.github.flameyossnowy.dynrel.api.model.Model;
import io.github.flameyossnowy.dynrel.api.model.ModelContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class Fixtures {
    private Fixtures() {
    }

    static EntityRegistry entities() {
        return new EntityRegistry()
            .register(EntityType.of("App\\Post", "posts", Post::new))
            .register(EntityType.of("App\\Comment", "comments", Comment::new))
            .register(EntityType.of("App\\User", "users", User::new))
            .register(EntityType.of("App\\UserLanguage", "user_languages", UserLanguage::new));
    }

    static InMemoryRecordSource seed() {
        return new InMemoryRecordSource()
            .insert("posts", Map.of("id", 1, "user_id", 10, "title", "Hello"))
            .insert("posts", Map.of("id", 2, "user_id", 99, "title", "Orphan"))
            .insert("comments", Map.of("id", 100, "post_id", 1, "body", "first"))
            .insert("comments", Map.of("id", 101, "post_id", 1, "body", "second"))
            .insert("comments", Map.of("id", 102, "post_id", 2, "body", "elsewhere"))
            .insert("users", Map.of("id", 10, "name", "alice"))
            .insert("user_languages", Map.of("id", 1, "user_id", 10, "code", "en"))
            .insert("user_languages", Map.of("id", 2, "user_id", 10, "code", "fr"));
    }

    static List<Object> ids(Object models) {
        List<Object> ids = new ArrayList<>();
        for (Object model : (List<?>) models) {
            ids.add(((Model) model).getKey());
        }
        return ids;
    }

    static ModelContext context(InMemoryRecordSource source) {
        return new ModelContext(entities(), source);
    }
}
