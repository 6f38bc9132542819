package org.morm.config;

import org.morm.exception.DeclarationException;
import org.morm.model.ModelDefinition;
import org.morm.model.ModelRegistry;
import org.morm.model.SchemaSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ModelDescriptorLoaderTest {

    @TempDir
    Path tempDir;

    private final ModelDescriptorLoader loader = new ModelDescriptorLoader();

    private ModelRegistry loadYaml(String yaml) throws IOException {
        Path file = tempDir.resolve("models.yaml");
        Files.writeString(file, yaml);
        return loader.load(file);
    }

    @Test
    @DisplayName("Models extend abstract parents, which are never registered")
    void extendsAbstractParent() throws IOException {
        ModelRegistry registry = loadYaml("""
                models:
                  - name: Base
                    abstract: true
                    primaryKey: id
                    fields:
                      - name: id
                        sqlType: BIGINT
                        onAdd: NOT NULL
                      - name: created_at
                        sqlType: TIMESTAMP
                  - name: User
                    extends: Base
                    table: site_user
                    fields:
                      - name: email
                        sqlType: VARCHAR(255)
                        unique: true
                        indexSpecs: [hash]
                    uniqueGroups:
                      ne: [id, email]
                """);

        assertThat(registry.all()).extracting(ModelDefinition::getName).containsExactly("User");
        SchemaSnapshot user = registry.get("User").describe();
        assertEquals("site_user", user.getTable());
        assertEquals("id", user.getPrimaryKey());
        assertThat(user.getFields().keySet()).containsExactly("id", "created_at", "email");
        assertEquals("NOT NULL", user.field("id").getOnAdd());
        assertThat(user.field("email").isUnique()).isTrue();
        assertThat(user.field("email").getIndexSpecs()).containsExactly("hash");
        assertThat(user.getUniqueGroups().get("ne").getFieldNames()).containsExactly("id", "email");
    }

    @Test
    @DisplayName("The table name defaults to the model name")
    void tableDefaultsToName() throws IOException {
        ModelRegistry registry = loadYaml("""
                models:
                  - name: Tag
                    fields:
                      - name: label
                        sqlType: TEXT
                """);

        assertEquals("Tag", registry.get("Tag").getTable());
    }

    @Test
    @DisplayName("JSON descriptors are read by file extension")
    void jsonDescriptor() throws IOException {
        Path file = tempDir.resolve("models.json");
        Files.writeString(file, """
                {"models": [{"name": "Tag", "table": "tags",
                  "fields": [{"name": "label", "sqlType": "TEXT", "alterOps": ["SET NOT NULL"]}]}]}
                """);

        ModelRegistry registry = loader.load(file);

        assertThat(registry.get("Tag").describe().field("label").getAlterOps()).containsExactly("SET NOT NULL");
    }

    @Test
    @DisplayName("An unresolvable Java type leaves the model without a declared type")
    void unknownJavaType() throws IOException {
        ModelRegistry registry = loadYaml("""
                models:
                  - name: Tag
                    javaType: com.example.DoesNotExist
                    fields:
                      - name: label
                        sqlType: TEXT
                  - name: Note
                    javaType: java.lang.String
                    fields:
                      - name: body
                        sqlType: TEXT
                """);

        assertNull(registry.get("Tag").getJavaType());
        assertEquals(String.class, registry.get("Note").getJavaType());
    }

    @Test
    @DisplayName("Cyclic inheritance is rejected")
    void cyclicExtends() {
        assertThatThrownBy(() -> loadYaml("""
                models:
                  - name: A
                    extends: B
                    fields: [{name: a, sqlType: INT}]
                  - name: B
                    extends: A
                    fields: [{name: b, sqlType: INT}]
                """))
                .isInstanceOf(DeclarationException.class)
                .hasMessageContaining("Cyclic");
    }

    @Test
    @DisplayName("Extending an unknown model is rejected")
    void unknownParent() {
        assertThatThrownBy(() -> loadYaml("""
                models:
                  - name: A
                    extends: Missing
                    fields: [{name: a, sqlType: INT}]
                """))
                .isInstanceOf(DeclarationException.class)
                .hasMessageContaining("extends unknown model 'Missing'");
    }

    @Test
    @DisplayName("Duplicate model names and fields declared twice in one entry are rejected")
    void duplicates() {
        assertThatThrownBy(() -> loadYaml("""
                models:
                  - name: A
                    fields: [{name: a, sqlType: INT}]
                  - name: A
                    fields: [{name: b, sqlType: INT}]
                """))
                .isInstanceOf(DeclarationException.class)
                .hasMessageContaining("Duplicate model 'A'");

        assertThatThrownBy(() -> loadYaml("""
                models:
                  - name: A
                    fields: [{name: a, sqlType: INT}, {name: a, sqlType: BIGINT}]
                """))
                .isInstanceOf(DeclarationException.class)
                .hasMessageContaining("Duplicate field 'a' in model 'A'");
    }

    @Test
    @DisplayName("A child overrides inherited fields in place and its unique groups replace the parent's")
    void childOverridesParent() throws IOException {
        ModelRegistry registry = loadYaml("""
                models:
                  - name: UserEmail
                    table: user_email
                    fields:
                      - {name: user_id, sqlType: INTEGER}
                      - {name: email, sqlType: VARCHAR(255)}
                      - {name: provider, sqlType: VARCHAR(50)}
                      - {name: verified, sqlType: BOOLEAN, onAdd: DEFAULT FALSE}
                    uniqueGroups:
                      user_email: [user_id, email]
                      user_provider: [user_id, provider]
                  - name: ExtendedUserEmail
                    extends: UserEmail
                    table: extended_user_email
                    fields:
                      - {name: email, sqlType: VARCHAR(100)}
                      - {name: token, sqlType: VARCHAR(100)}
                    uniqueGroups:
                      user_email: [user_id, email]
                      user_token: [user_id, token]
                """);

        SchemaSnapshot parent = registry.get("UserEmail").describe();
        SchemaSnapshot child = registry.get("ExtendedUserEmail").describe();

        assertThat(child.getFields().keySet()).containsExactly("user_id", "email", "provider", "verified", "token");
        assertEquals("VARCHAR(100)", child.field("email").getSqlType());
        assertEquals("VARCHAR(255)", parent.field("email").getSqlType());
        assertThat(child.getUniqueGroups().keySet()).containsExactly("user_email", "user_token");
        assertThat(parent.getUniqueGroups().keySet()).containsExactly("user_email", "user_provider");
    }

    @Test
    @DisplayName("A child without unique groups keeps the nearest ancestor's")
    void inheritsUniqueGroupsWhenSilent() throws IOException {
        ModelRegistry registry = loadYaml("""
                models:
                  - name: Base
                    abstract: true
                    fields: [{name: id, sqlType: INT}, {name: code, sqlType: TEXT}]
                    uniqueGroups:
                      id_code: [id, code]
                  - name: Item
                    extends: Base
                    fields: [{name: label, sqlType: TEXT}]
                """);

        assertThat(registry.get("Item").describe().getUniqueGroups().keySet()).containsExactly("id_code");
    }

    @Test
    @DisplayName("A missing descriptor file is a declaration error")
    void missingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.yaml")))
                .isInstanceOf(DeclarationException.class)
                .hasMessageContaining("absent.yaml");
    }

    @Test
    @DisplayName("Descriptors built in code are converted the same way")
    void fromObject() {
        ModelDescriptor.ModelEntry entry = new ModelDescriptor.ModelEntry();
        entry.setName("Tag");
        entry.setFields(List.of(org.morm.model.FieldSpec.of("label", "TEXT")));
        ModelDescriptor descriptor = new ModelDescriptor();
        descriptor.setModels(List.of(entry));

        assertThat(loader.toRegistry(descriptor).get("Tag").getFields()).containsKey("label");
    }
}
