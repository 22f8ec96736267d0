package io.github.flameyossnowy.dynrel.api.dynamic;

import io.github.flameyossnowy.dynrel.api.model.Model;
import io.github.flameyossnowy.dynrel.api.model.ModelContext;

import java.util.Map;

public class Comment extends Model {
    public Comment(ModelContext context, Map<String, Object> attributes) {
        super(context, attributes);
    }

    public String getBody() {
        return (String) getAttribute("body");
    }
}
