package io.github.flameyossnowy.dynrel.api.dynamic;

import io.github.flameyossnowy.dynrel.api.model.Model;
import io.github.flameyossnowy.dynrel.api.model.ModelContext;

import java.util.Map;

public class UserLanguage extends Model {
    public UserLanguage(ModelContext context, Map<String, Object> attributes) {
        super(context, attributes);
    }
}
