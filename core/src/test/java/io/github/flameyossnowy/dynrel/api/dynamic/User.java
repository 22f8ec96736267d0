package io.github.flameyossnowy.dynrel.api.dynamic;

import io.github.flameyossnowy.dynrel.api.config.DynamicRelationConfig;
import io.github.flameyossnowy.dynrel.api.model.ModelContext;

import java.util.Map;

public class User extends DynamicModel {
    static final DynamicRelationConfig RELATIONS = DynamicRelationConfig.builder()
        .relations("user_languages")
        .alias("languages", "user_languages")
        .build();

    public User(ModelContext context, Map<String, Object> attributes) {
        this(context, attributes, RELATIONS);
    }

    public User(ModelContext context, Map<String, Object> attributes, DynamicRelationConfig config) {
        super(context, attributes, config);
    }
}
