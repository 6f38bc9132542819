package org.morm.model;

import org.morm.exception.DeclarationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Models known to the migration engine, in registration order.
 * Built once and handed to the engine; there is no global instance.
 */
public class ModelRegistry {
    private final Map<String, ModelDefinition> models = new LinkedHashMap<>();

    public ModelRegistry register(ModelDefinition model) {
        if (model.isAbstractModel()) {
            throw new DeclarationException("Abstract model (" + model.getName() + ") can not be in database");
        }
        if (models.containsKey(model.getName())) {
            throw new DeclarationException("Model '" + model.getName() + "' is already registered");
        }
        for (ModelDefinition m : models.values()) {
            if (m.getTable().equals(model.getTable())) {
                throw new DeclarationException("Models '" + m.getName() + "' and '" + model.getName()
                        + "' map to the same table '" + model.getTable() + "'");
            }
        }
        models.put(model.getName(), model);
        return this;
    }

    public ModelDefinition get(String name) {
        ModelDefinition model = models.get(name);
        if (model == null) {
            throw new DeclarationException("Unknown model '" + name + "'");
        }
        return model;
    }

    public List<ModelDefinition> all() {
        return List.copyOf(models.values());
    }

    /**
     * The named models in registration order, or every model when {@code names} is empty.
     */
    public List<ModelDefinition> select(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return all();
        }
        names.forEach(this::get);
        List<ModelDefinition> selected = new ArrayList<>();
        for (ModelDefinition m : models.values()) {
            if (names.contains(m.getName())) {
                selected.add(m);
            }
        }
        return selected;
    }

    public boolean isEmpty() {
        return models.isEmpty();
    }
}
