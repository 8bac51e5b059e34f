/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Conduit.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.conduit.engine.stub;

import com.fasterxml.jackson.databind.JsonNode;
import com.hellblazer.conduit.engine.EngineException;
import com.hellblazer.conduit.engine.PropertyPathNotFoundException;
import com.hellblazer.conduit.engine.PropertyType;
import com.hellblazer.conduit.engine.PropertyValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one view model instance. Nested view model properties are created on first access, so self referencing
 * view models and cycles between instances are representable.
 *
 * @author hal.hildebrand
 */
final class ViewModelNode {
    final SceneDocument               document;
    final SceneDocument.ViewModelDef  def;
    final String                      instanceName;
    private final Map<String, Object> slots         = new HashMap<>();
    private final Map<String, Integer> triggerCounts = new HashMap<>();

    /**
     * Property resolved from a dotted path: the owning node and the property's definition
     */
    record Slot(ViewModelNode owner, SceneDocument.PropertyDef def) {
        String name() {
            return def.name();
        }
    }

    ViewModelNode(SceneDocument document, SceneDocument.ViewModelDef def, String instanceName) {
        this.document = document;
        this.def = def;
        this.instanceName = instanceName;
        for (var property : def.properties()) {
            switch (property.type()) {
                case NUMBER, STRING, BOOLEAN, ENUM, COLOR, TRIGGER -> slots.put(property.name(),
                                                                                initialValue(property));
                case LIST -> slots.put(property.name(), new ArrayList<ViewModelNode>());
                default -> {
                    // nested instances, images and artboards start unset
                }
            }
        }
    }

    static ViewModelNode create(SceneDocument document, String viewModel, String instanceName, JsonNode values) {
        var def = document.viewModels().get(viewModel);
        if (def == null) {
            throw new EngineException("Unknown view model: " + viewModel);
        }
        var node = new ViewModelNode(document, def, instanceName);
        if (values != null) {
            node.apply(values);
        }
        return node;
    }

    Slot resolve(String path) {
        if (path == null || path.isEmpty()) {
            throw new PropertyPathNotFoundException(String.valueOf(path), "Empty property path");
        }
        var segments = path.split("\\.", -1);
        var node = this;
        for (int i = 0; i < segments.length - 1; i++) {
            var property = node.def.property(segments[i]);
            if (property == null || property.type() != PropertyType.VIEW_MODEL) {
                throw new PropertyPathNotFoundException(path,
                                                        "'" + segments[i] + "' is not a nested view model of "
                                                        + node.def.name() + " in path '" + path + "'");
            }
            node = node.nested(property);
        }
        var leaf = segments[segments.length - 1];
        var property = node.def.property(leaf);
        if (property == null) {
            throw new PropertyPathNotFoundException(path,
                                                    "No property '" + leaf + "' on " + node.def.name() + " for path '"
                                                    + path + "'");
        }
        return new Slot(node, property);
    }

    Slot resolve(String path, PropertyType expected) {
        var slot = resolve(path);
        if (slot.def().type() != expected) {
            throw new PropertyPathNotFoundException(path, "Property '" + path + "' is " + slot.def().type() + ", not "
                                                          + expected);
        }
        return slot;
    }

    PropertyValue value(String name) {
        return (PropertyValue) slots.get(name);
    }

    void setValue(SceneDocument.PropertyDef property, PropertyValue value) {
        if (property.type() == PropertyType.ENUM) {
            var option = ((PropertyValue.EnumValue) value).value();
            var definition = property.reference() == null ? null : document.enums().get(property.reference());
            if (definition != null && !definition.options().contains(option)) {
                throw new EngineException("'" + option + "' is not an option of enum " + definition.name());
            }
        }
        if (property.type() == PropertyType.TRIGGER) {
            triggerCounts.merge(property.name(), 1, Integer::sum);
            return;
        }
        slots.put(property.name(), value);
    }

    int triggerCount(String name) {
        return triggerCounts.getOrDefault(name, 0);
    }

    ViewModelNode nested(SceneDocument.PropertyDef property) {
        var nested = (ViewModelNode) slots.get(property.name());
        if (nested == null) {
            if (property.reference() == null) {
                throw new EngineException("Property '" + property.name() + "' has no view model type");
            }
            nested = create(document, property.reference(), "", null);
            slots.put(property.name(), nested);
        }
        return nested;
    }

    void setNested(SceneDocument.PropertyDef property, ViewModelNode nested) {
        checkReference(property, nested);
        slots.put(property.name(), nested);
    }

    @SuppressWarnings("unchecked")
    List<ViewModelNode> list(SceneDocument.PropertyDef property) {
        return (List<ViewModelNode>) slots.get(property.name());
    }

    /**
     * Image or artboard assigned to a property, null if unset
     */
    Object reference(String name) {
        return slots.get(name);
    }

    void setReference(String name, Object target) {
        if (target == null) {
            slots.remove(name);
        } else {
            slots.put(name, target);
        }
    }

    void checkReference(SceneDocument.PropertyDef property, ViewModelNode candidate) {
        if (property.reference() != null && !property.reference().equals(candidate.def.name())) {
            throw new EngineException(
            "Property '" + property.name() + "' holds " + property.reference() + " instances, not "
            + candidate.def.name());
        }
    }

    private void apply(JsonNode values) {
        var fields = values.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var property = def.property(field.getKey());
            if (property == null) {
                throw new EngineException("Instance of " + def.name() + " sets unknown property " + field.getKey());
            }
            switch (property.type()) {
                case NUMBER, STRING, BOOLEAN, ENUM, COLOR -> slots.put(property.name(),
                                                                       toValue(property.type(), field.getValue()));
                case VIEW_MODEL -> nested(property).apply(field.getValue());
                case LIST -> {
                    var items = list(property);
                    for (var item : field.getValue()) {
                        items.add(create(document, property.reference(), "", item));
                    }
                }
                default -> throw new EngineException(
                "Property " + property.name() + " of type " + property.type() + " cannot be authored");
            }
        }
    }

    private PropertyValue initialValue(SceneDocument.PropertyDef property) {
        if (property.initial() != null && !property.initial().isNull()) {
            return toValue(property.type(), property.initial());
        }
        return switch (property.type()) {
            case NUMBER -> PropertyValue.number(0);
            case STRING -> PropertyValue.text("");
            case BOOLEAN -> PropertyValue.bool(false);
            case ENUM -> {
                var definition = property.reference() == null ? null : document.enums().get(property.reference());
                yield PropertyValue.enumOption(
                definition == null || definition.options().isEmpty() ? "" : definition.options().get(0));
            }
            case COLOR -> PropertyValue.color(0xFF000000);
            default -> PropertyValue.trigger();
        };
    }

    private static PropertyValue toValue(PropertyType type, JsonNode node) {
        return switch (type) {
            case NUMBER -> PropertyValue.number((float) node.asDouble());
            case STRING -> PropertyValue.text(node.asText());
            case BOOLEAN -> PropertyValue.bool(node.asBoolean());
            case ENUM -> PropertyValue.enumOption(node.asText());
            case COLOR -> PropertyValue.color(SceneDocument.parseColor(node, 0xFF000000));
            default -> PropertyValue.trigger();
        };
    }

    @Override
    public String toString() {
        return instanceName.isEmpty() ? def.name() : def.name() + "/" + instanceName;
    }
}
