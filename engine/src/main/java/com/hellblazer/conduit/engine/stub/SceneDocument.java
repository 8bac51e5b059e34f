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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.conduit.engine.EngineException;
import com.hellblazer.conduit.engine.EnumDefinition;
import com.hellblazer.conduit.engine.PropertyType;
import com.hellblazer.conduit.engine.PropertyValue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed form of the JSON scene files understood by {@link StubSceneEngine}.
 *
 * <pre>
 * {
 *   "artboards": [ { "name": "Main", "width": 400, "height": 300, "color": "#FF3366CC",
 *                    "viewModel": "Player",
 *                    "stateMachines": [ { "name": "Idle", "settleAfter": 0.5,
 *                                         "inputs": [ { "name": "speed", "type": "number", "value": 1 } ] } ] } ],
 *   "viewModels": [ { "name": "Player",
 *                     "properties": [ { "name": "health", "type": "number", "value": 100 },
 *                                     { "name": "stats", "type": "viewModel", "viewModel": "Stats" },
 *                                     { "name": "items", "type": "list", "viewModel": "Item" } ],
 *                     "instances": { "Alice": { "health": 50 } } } ],
 *   "enums": [ { "name": "Mood", "options": [ "happy", "sad" ] } ]
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
record SceneDocument(List<ArtboardDef> artboards, Map<String, ViewModelDef> viewModels,
                     Map<String, EnumDefinition> enums) {

    record ArtboardDef(String name, float width, float height, int color, String viewModel,
                       List<StateMachineDef> stateMachines) {
    }

    record StateMachineDef(String name, float settleAfter, List<InputDef> inputs) {
    }

    record InputDef(String name, PropertyType type, PropertyValue initial) {
    }

    record ViewModelDef(String name, List<PropertyDef> properties, Map<String, JsonNode> instances) {

        PropertyDef property(String propertyName) {
            for (var property : properties) {
                if (property.name().equals(propertyName)) {
                    return property;
                }
            }
            return null;
        }
    }

    /**
     * @param reference enum name for ENUM properties, view model name for VIEW_MODEL and LIST properties
     */
    record PropertyDef(String name, PropertyType type, String reference, JsonNode initial) {
    }

    static SceneDocument parse(ObjectMapper mapper, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new EngineException("Empty scene file");
        }
        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new EngineException("Malformed scene file: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new EngineException("Malformed scene file: expected a JSON object");
        }

        Map<String, EnumDefinition> enums = new LinkedHashMap<>();
        for (var node : root.path("enums")) {
            var options = new ArrayList<String>();
            node.path("options").forEach(o -> options.add(o.asText()));
            var name = required(node, "name", "enum");
            enums.put(name, new EnumDefinition(name, options));
        }

        Map<String, ViewModelDef> viewModels = new LinkedHashMap<>();
        for (var node : root.path("viewModels")) {
            var name = required(node, "name", "view model");
            var properties = new ArrayList<PropertyDef>();
            for (var p : node.path("properties")) {
                var type = parseType(p, "type");
                var reference = p.hasNonNull("enum") ? p.get("enum").asText()
                                                     : p.hasNonNull("viewModel") ? p.get("viewModel").asText() : null;
                properties.add(new PropertyDef(required(p, "name", "property"), type, reference, p.get("value")));
            }
            Map<String, JsonNode> instances = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.path("instances").fields();
            while (fields.hasNext()) {
                var field = fields.next();
                instances.put(field.getKey(), field.getValue());
            }
            viewModels.put(name, new ViewModelDef(name, properties, instances));
        }

        var artboards = new ArrayList<ArtboardDef>();
        for (var node : root.path("artboards")) {
            var stateMachines = new ArrayList<StateMachineDef>();
            for (var sm : node.path("stateMachines")) {
                var inputs = new ArrayList<InputDef>();
                for (var in : sm.path("inputs")) {
                    var type = parseType(in, "type");
                    if (type != PropertyType.NUMBER && type != PropertyType.BOOLEAN && type != PropertyType.TRIGGER) {
                        throw new EngineException("Unsupported state machine input type: " + type);
                    }
                    inputs.add(new InputDef(required(in, "name", "input"), type, initialInput(type, in.get("value"))));
                }
                stateMachines.add(new StateMachineDef(required(sm, "name", "state machine"),
                                                      (float) sm.path("settleAfter").asDouble(0), inputs));
            }
            artboards.add(new ArtboardDef(required(node, "name", "artboard"),
                                          (float) node.path("width").asDouble(100),
                                          (float) node.path("height").asDouble(100),
                                          parseColor(node.get("color"), 0xFF000000),
                                          node.hasNonNull("viewModel") ? node.get("viewModel").asText() : null,
                                          stateMachines));
        }
        return new SceneDocument(artboards, viewModels, enums);
    }

    static int parseColor(JsonNode node, int fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return (int) node.asLong();
        }
        var text = node.asText().trim();
        if (text.startsWith("#")) {
            text = text.substring(1);
        }
        try {
            if (text.length() == 6) {
                return 0xFF000000 | Integer.parseInt(text, 16);
            }
            if (text.length() == 8) {
                return (int) Long.parseLong(text, 16);
            }
        } catch (NumberFormatException e) {
            throw new EngineException("Invalid color: " + node.asText(), e);
        }
        throw new EngineException("Invalid color: " + node.asText());
    }

    private static PropertyValue initialInput(PropertyType type, JsonNode value) {
        return switch (type) {
            case NUMBER -> PropertyValue.number(value == null ? 0 : (float) value.asDouble());
            case BOOLEAN -> PropertyValue.bool(value != null && value.asBoolean());
            default -> PropertyValue.trigger();
        };
    }

    private static PropertyType parseType(JsonNode node, String field) {
        var text = node.path(field).asText("");
        // accept camelCase ("viewModel") as well as constant names
        var normalized = text.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
        try {
            return PropertyType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new EngineException("Unknown property type: '" + text + "'", e);
        }
    }

    private static String required(JsonNode node, String field, String what) {
        var value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new EngineException("Malformed scene file: " + what + " without " + field);
        }
        return value.asText();
    }
}
