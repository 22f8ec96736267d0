package io.github.flameyossnowy.dynrel.api.dynamic;

import io.github.flameyossnowy.dynrel.api.config.DynamicRelationConfig;
import io.github.flameyossnowy.dynrel.api.exceptions.InvalidRelationshipContractException;
import io.github.flameyossnowy.dynrel.api.exceptions.RelationNotFoundException;
import io.github.flameyossnowy.dynrel.api.exceptions.UndefinedMethodException;
import io.github.flameyossnowy.dynrel.api.exceptions.UnknownEntityException;
import io.github.flameyossnowy.dynrel.api.model.InMemoryRecordSource;
import io.github.flameyossnowy.dynrel.api.model.ModelContext;
import io.github.flameyossnowy.dynrel.api.relation.BelongsTo;
import io.github.flameyossnowy.dynrel.api.relation.HasMany;
import io.github.flameyossnowy.dynrel.api.relation.HasOne;
import io.github.flameyossnowy.dynrel.api.relation.RelationshipKind;
import io.github.flameyossnowy.dynrel.api.utils.Logging;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.github.flameyossnowy.dynrel.api.dynamic.Fixtures.ids;
import static org.junit.jupiter.api.Assertions.*;

class DynamicModelTest {
    InMemoryRecordSource source;
    ModelContext context;
    Post post;

    @BeforeAll
    static void enableLogging() {
        Logging.ENABLED = true;
        Logging.DEEP = true;
    }

    @BeforeEach
    void setup() {
        source = Fixtures.seed();
        context = Fixtures.context(source);
        post = new Post(context, Map.of("id", 1, "user_id", 10, "title", "Hello"));
    }

    @Test
    void dynamicPropertyMatchesDirectRelationship() {
        Object viaProperty = post.getProperty("comments");

        List<Comment> direct = post.<Comment>hasMany("App\\Comment", "post_id").getResults();

        assertEquals(List.of(100, 101), ids(viaProperty));
        assertEquals(ids(direct), ids(viaProperty));
    }

    @Test
    void repeatedReadsAreServedFromTheRelationCache() {
        Object first = post.getProperty("comments");
        assertEquals(1, source.queryCount());

        Object second = post.getProperty("comments");
        Object third = post.getRelationValue("comments");

        assertSame(first, second);
        assertSame(first, third);
        assertEquals(1, source.queryCount());
        assertTrue(post.relationLoaded("comments"));
    }

    @Test
    void cacheIsPerInstance() {
        post.getProperty("comments");
        Post other = new Post(context, Map.of("id", 2, "user_id", 99));

        assertEquals(List.of(102), ids(other.getProperty("comments")));
        assertEquals(2, source.queryCount());
    }

    @Test
    void typeModelAndKeyOverridesAreApplied() {
        Object author = post.getProperty("author");

        User user = assertInstanceOf(User.class, author);
        assertEquals("alice", user.getAttribute("name"));
    }

    @Test
    void missingBelongsToOwnerIsCachedAsNull() {
        Post orphan = new Post(context, Map.of("id", 2, "user_id", 99));

        assertNull(orphan.getProperty("author"));
        assertNull(orphan.getProperty("author"));

        assertTrue(orphan.relationLoaded("author"));
        assertEquals(1, source.queryCount());
    }

    @Test
    void callingADynamicRelationReturnsTheUnexecutedDescriptor() {
        Object relation = post.call("comments");

        HasMany<?> hasMany = assertInstanceOf(HasMany.class, relation);
        assertEquals("App\\Comment", hasMany.getRelated().identifier());
        assertEquals("post_id", hasMany.getForeignKey());
        assertSame(post, hasMany.getParent());
        assertEquals(0, source.queryCount());
        assertFalse(post.relationLoaded("comments"));

        BelongsTo<?> belongsTo = assertInstanceOf(BelongsTo.class, post.call("author"));
        assertEquals("user_id", belongsTo.getForeignKey());
        assertEquals("id", belongsTo.getOwnerKey());
    }

    @Test
    void isDynamicRelationIsAnsweredAsAHelperCall() {
        assertEquals(Boolean.TRUE, post.call("isDynamicRelation", "comments"));
        assertEquals(Boolean.FALSE, post.call("isDynamicRelation", "firstComment"));
        assertTrue(post.isDynamicRelation("tags"));

        assertThrows(IllegalArgumentException.class, () -> post.call("isDynamicRelation"));
    }

    @Test
    void aliasResolvesToCanonicalRelation() {
        User user = new User(context, Map.of("id", 10, "name", "alice"));

        Object languages = user.getProperty("languages");

        assertEquals(List.of(1, 2), ids(languages));
        assertTrue(user.relationLoaded("languages"));
        assertFalse(user.relationLoaded("user_languages"));

        HasMany<?> relation = assertInstanceOf(HasMany.class, user.call("languages"));
        assertEquals("App\\UserLanguage", relation.getRelated().identifier());
        assertEquals("user_id", relation.getForeignKey());
    }

    @Test
    void aliasKeepsItsOwnTypeOverride() {
        DynamicRelationConfig config = User.RELATIONS.toBuilder()
            .type("languages", RelationshipKind.HAS_ONE)
            .build();
        User user = new User(context, Map.of("id", 10), config);

        assertInstanceOf(HasOne.class, user.call("languages"));
        assertInstanceOf(HasMany.class, user.call("user_languages"));

        Object language = user.getProperty("languages");
        assertInstanceOf(UserLanguage.class, language);
    }

    @Test
    void ordinaryRelationMethodsStillWork() {
        Object first = post.getProperty("firstComment");

        Comment comment = assertInstanceOf(Comment.class, first);
        assertEquals("first", comment.getBody());
        assertSame(first, post.getProperty("firstComment"));
        assertEquals(1, source.queryCount());
    }

    @Test
    void proxyFallsBackToOrdinaryRelations() {
        Object writer = post.dynamicRelationProxy("writer");

        assertInstanceOf(User.class, writer);
        assertTrue(post.relationLoaded("writer"));
        assertSame(writer, post.dynamicRelationProxy("writer"));
        assertEquals(1, source.queryCount());
    }

    @Test
    void proxyReturnsCachedValueForNonDynamicName() {
        post.setRelation("pinned", "cached");

        assertEquals("cached", post.dynamicRelationProxy("pinned"));
    }

    @Test
    void unknownRelationThroughProxyFails() {
        RelationNotFoundException e = assertThrows(RelationNotFoundException.class,
            () -> post.dynamicRelationProxy("likes"));

        assertEquals("likes", e.getRelationName());
        assertTrue(e.getMessage().contains("likes"));
    }

    @Test
    void aliasOfUnregisteredRelationFails() {
        DynamicRelationConfig config = DynamicRelationConfig.builder()
            .relations("langs")
            .alias("langs", "spoken_languages")
            .build();
        User user = new User(context, Map.of("id", 10), config);

        RelationNotFoundException e = assertThrows(RelationNotFoundException.class, () -> user.getProperty("langs"));
        assertEquals("langs", e.getRelationName());
        assertTrue(e.getMessage().contains("spoken_languages"));
    }

    @Test
    void nonRelationFromMethodBreaksTheContract() {
        InvalidRelationshipContractException e = assertThrows(InvalidRelationshipContractException.class,
            () -> post.getProperty("broken"));

        assertEquals("broken", e.getRelationName());
        assertEquals(String.class, e.getActualType());
        assertFalse(post.relationLoaded("broken"));
    }

    @Test
    void nonDynamicPropertiesFallBackToTheHost() {
        assertEquals("Hello", post.getProperty("title"));
        assertNull(post.getProperty("nothing"));
        assertNull(post.getRelationValue("nothing"));
    }

    @Test
    void unknownMethodFallsBackToTheHost() {
        assertThrows(UndefinedMethodException.class, () -> post.call("publish"));
        assertInstanceOf(HasOne.class, post.call("firstComment"));
    }

    @Test
    void unregisteredTargetEntitySurfacesFromTheHost() {
        UnknownEntityException e = assertThrows(UnknownEntityException.class, () -> post.getProperty("tags"));

        assertEquals("App\\Tag", e.getIdentifier());
    }

    @Test
    void modelsOfOneTypeShareAResolver() {
        Post other = new Post(context, Map.of("id", 2));

        assertSame(post.dynamicRelations(), other.dynamicRelations());
        assertEquals("post_id", post.dynamicRelations().defaultKey());
    }
}
