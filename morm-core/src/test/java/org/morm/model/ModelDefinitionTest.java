package org.morm.model;

import org.morm.exception.DeclarationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelDefinitionTest {

    @Test
    @DisplayName("describe keeps field declaration order and defaults the table to the model name")
    void describeKeepsOrder() {
        ModelDefinition model = ModelDefinition.builder("SiteUser")
                .primaryKey("id")
                .field("id", "BIGINT")
                .field("name", "VARCHAR(100)")
                .field("email", "TEXT")
                .uniqueGroup("ne", "name", "email")
                .build();

        SchemaSnapshot snapshot = model.describe();

        assertThat(snapshot.getTable()).isEqualTo("SiteUser");
        assertThat(snapshot.getFields().keySet()).containsExactly("id", "name", "email");
        assertThat(snapshot.getUniqueGroups().get("ne").getFieldNames()).containsExactly("name", "email");
    }

    @Test
    @DisplayName("Each describe returns an independent copy")
    void describeReturnsCopies() {
        ModelDefinition model = ModelDefinition.builder("m")
                .field(FieldSpec.builder().name("tags").sqlType("TEXT").indexSpecs(List.of("btree")).build())
                .build();

        SchemaSnapshot first = model.describe();
        first.field("tags").getIndexSpecs().add("hash");

        assertThat(model.describe().field("tags").getIndexSpecs()).containsExactly("btree");
    }

    @Test
    @DisplayName("Duplicate field names are rejected by the builder")
    void duplicateField() {
        ModelDefinition.Builder builder = ModelDefinition.builder("m").field("id", "BIGINT");

        assertThatThrownBy(() -> builder.field("id", "INT"))
                .isInstanceOf(DeclarationException.class)
                .hasMessageContaining("Duplicate field 'id'");
    }

    @Test
    @DisplayName("Invalid declarations fail at describe time")
    void invalidDeclarationFailsOnDescribe() {
        ModelDefinition model = ModelDefinition.builder("m")
                .field("id", "BIGINT")
                .uniqueGroup("g", "id", "gone")
                .build();

        assertThatThrownBy(model::describe).isInstanceOf(DeclarationException.class);
    }

    @Test
    @DisplayName("Registry rejects abstract models, duplicate names and shared tables")
    void registryRules() {
        ModelRegistry registry = new ModelRegistry();
        registry.register(ModelDefinition.builder("a").field("id", "INT").build());

        assertThatThrownBy(() -> registry.register(ModelDefinition.builder("base").abstractModel(true).build()))
                .isInstanceOf(DeclarationException.class)
                .hasMessage("Abstract model (base) can not be in database");
        assertThatThrownBy(() -> registry.register(ModelDefinition.builder("a").build()))
                .isInstanceOf(DeclarationException.class);
        assertThatThrownBy(() -> registry.register(ModelDefinition.builder("b").table("a").build()))
                .isInstanceOf(DeclarationException.class)
                .hasMessageContaining("same table");
    }

    @Test
    @DisplayName("select keeps registration order and fails on unknown names")
    void registrySelect() {
        ModelRegistry registry = new ModelRegistry()
                .register(ModelDefinition.builder("a").build())
                .register(ModelDefinition.builder("b").build())
                .register(ModelDefinition.builder("c").build());

        assertThat(registry.select(List.of("c", "a"))).extracting(ModelDefinition::getName).containsExactly("a", "c");
        assertThat(registry.select(List.of())).hasSize(3);
        assertThatThrownBy(() -> registry.select(List.of("x"))).isInstanceOf(DeclarationException.class);
    }
}
