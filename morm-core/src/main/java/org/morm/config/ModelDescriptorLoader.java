package org.morm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.morm.exception.DeclarationException;
import org.morm.exception.MormException;
import org.morm.model.FieldSpec;
import org.morm.model.ModelDefinition;
import org.morm.model.ModelRegistry;
import org.morm.support.ObjectMappers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link ModelRegistry} from a YAML or JSON descriptor file.
 * Abstract entries are never registered; they only provide fields to the entries extending them.
 */
@Slf4j
public class ModelDescriptorLoader {

    private final ObjectMapper yamlMapper = ObjectMappers.yaml();
    private final ObjectMapper jsonMapper = ObjectMappers.json();

    public ModelRegistry load(Path descriptorFile) {
        if (!Files.exists(descriptorFile)) {
            throw new DeclarationException("Model descriptor not found: " + descriptorFile);
        }
        ObjectMapper mapper = descriptorFile.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
                ? jsonMapper : yamlMapper;
        ModelDescriptor descriptor;
        try {
            descriptor = mapper.readValue(descriptorFile.toFile(), ModelDescriptor.class);
        } catch (IOException e) {
            throw new MormException("Failed to read model descriptor " + descriptorFile, e);
        }
        return toRegistry(descriptor);
    }

    public ModelRegistry toRegistry(ModelDescriptor descriptor) {
        Map<String, ModelDescriptor.ModelEntry> byName = new LinkedHashMap<>();
        for (ModelDescriptor.ModelEntry entry : descriptor.getModels()) {
            if (entry.getName() == null || entry.getName().isBlank()) {
                throw new DeclarationException("Model entry without name in descriptor");
            }
            if (byName.putIfAbsent(entry.getName(), entry) != null) {
                throw new DeclarationException("Duplicate model '" + entry.getName() + "' in descriptor");
            }
        }

        ModelRegistry registry = new ModelRegistry();
        for (ModelDescriptor.ModelEntry entry : byName.values()) {
            if (entry.isAbstractModel()) {
                log.debug("Skipping abstract model {}", entry.getName());
                continue;
            }
            registry.register(toDefinition(entry, byName));
        }
        return registry;
    }

    private ModelDefinition toDefinition(ModelDescriptor.ModelEntry entry, Map<String, ModelDescriptor.ModelEntry> byName) {
        List<ModelDescriptor.ModelEntry> lineage = lineage(entry, byName);

        ModelDefinition.Builder builder = ModelDefinition.builder(entry.getName())
                .table(entry.getTable())
                .javaType(resolveType(entry.getJavaType()));
        String primaryKey = null;
        Map<String, FieldSpec> fields = new LinkedHashMap<>();
        Map<String, List<String>> uniqueGroups = Map.of();
        for (ModelDescriptor.ModelEntry e : lineage) {
            if (e.getPrimaryKey() != null) {
                primaryKey = e.getPrimaryKey();
            }
            Set<String> declaredHere = new HashSet<>();
            for (FieldSpec field : e.getFields()) {
                if (field == null || field.getName() == null) {
                    throw new DeclarationException("Field of model '" + e.getName() + "' has no name");
                }
                if (!declaredHere.add(field.getName())) {
                    throw new DeclarationException("Duplicate field '" + field.getName() + "' in model '" + e.getName() + "'");
                }
                // a redeclared field replaces the inherited one in place
                fields.put(field.getName(), field.toBuilder().build());
            }
            // unique groups are not merged: the nearest entry declaring any wins
            if (!e.getUniqueGroups().isEmpty()) {
                uniqueGroups = e.getUniqueGroups();
            }
        }
        fields.values().forEach(builder::field);
        uniqueGroups.forEach((group, members) -> builder.uniqueGroup(group, new ArrayList<>(members)));
        return builder.primaryKey(primaryKey).build();
    }

    /**
     * Ancestors first, the entry itself last.
     */
    private static List<ModelDescriptor.ModelEntry> lineage(ModelDescriptor.ModelEntry entry,
                                                            Map<String, ModelDescriptor.ModelEntry> byName) {
        List<ModelDescriptor.ModelEntry> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        ModelDescriptor.ModelEntry current = entry;
        while (current != null) {
            if (!seen.add(current.getName())) {
                throw new DeclarationException("Cyclic 'extends' involving model '" + current.getName() + "'");
            }
            chain.add(0, current);
            String parent = current.getParent();
            if (parent == null) {
                break;
            }
            current = byName.get(parent);
            if (current == null) {
                throw new DeclarationException("Model '" + entry.getName() + "' extends unknown model '" + parent + "'");
            }
        }
        return chain;
    }

    private static Class<?> resolveType(String javaType) {
        if (javaType == null || javaType.isBlank()) {
            return null;
        }
        try {
            return Class.forName(javaType.trim());
        } catch (ClassNotFoundException e) {
            log.warn("Java type {} is not on the classpath; hooks will see no declared type", javaType);
            return null;
        }
    }
}
