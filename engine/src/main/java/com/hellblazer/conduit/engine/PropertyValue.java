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
package com.hellblazer.conduit.engine;

import java.util.Objects;

/**
 * Value of a property or state machine input, tagged with its {@link PropertyType}. Only the value types are
 * represented; nested instances, lists and images are addressed through handles instead.
 *
 * @author hal.hildebrand
 */
public sealed interface PropertyValue
permits PropertyValue.NumberValue, PropertyValue.TextValue, PropertyValue.BooleanValue, PropertyValue.EnumValue,
        PropertyValue.ColorValue, PropertyValue.TriggerValue {

    static PropertyValue number(float value) {
        return new NumberValue(value);
    }

    static PropertyValue text(String value) {
        return new TextValue(value);
    }

    static PropertyValue bool(boolean value) {
        return new BooleanValue(value);
    }

    static PropertyValue enumOption(String value) {
        return new EnumValue(value);
    }

    static PropertyValue color(int argb) {
        return new ColorValue(argb);
    }

    static PropertyValue trigger() {
        return TriggerValue.INSTANCE;
    }

    PropertyType type();

    record NumberValue(float value) implements PropertyValue {
        @Override
        public PropertyType type() {
            return PropertyType.NUMBER;
        }
    }

    record TextValue(String value) implements PropertyValue {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public PropertyType type() {
            return PropertyType.STRING;
        }
    }

    record BooleanValue(boolean value) implements PropertyValue {
        @Override
        public PropertyType type() {
            return PropertyType.BOOLEAN;
        }
    }

    record EnumValue(String value) implements PropertyValue {
        public EnumValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public PropertyType type() {
            return PropertyType.ENUM;
        }
    }

    record ColorValue(int argb) implements PropertyValue {
        @Override
        public PropertyType type() {
            return PropertyType.COLOR;
        }

        @Override
        public String toString() {
            return String.format("ColorValue[#%08X]", argb);
        }
    }

    /**
     * Firing a trigger carries no payload
     */
    record TriggerValue() implements PropertyValue {
        static final TriggerValue INSTANCE = new TriggerValue();

        @Override
        public PropertyType type() {
            return PropertyType.TRIGGER;
        }
    }
}
