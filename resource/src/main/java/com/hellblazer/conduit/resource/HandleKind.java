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
package com.hellblazer.conduit.resource;

/**
 * Enumeration of the native object kinds a {@link Handle} can stand in for.
 * Each kind owns its own partition in the {@link ResourceRegistry} and its own id sequence.
 *
 * @author hal.hildebrand
 */
public enum HandleKind {
    FILE("File", "Imported scene file"),
    ARTBOARD("Artboard", "Artboard instance"),
    STATE_MACHINE("State Machine", "State machine instance"),
    BINDABLE_INSTANCE("Bindable Instance", "Data binding view model instance"),
    IMAGE("Image", "Decoded image asset"),
    AUDIO("Audio", "Decoded audio asset"),
    FONT("Font", "Decoded font asset"),
    SURFACE("Surface", "Offscreen drawing surface"),
    DRAW_KEY("Draw Key", "Client draw operation key"),
    RENDER_TARGET("Render Target", "Engine render target bound to a surface");

    private final String displayName;
    private final String description;

    HandleKind(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Decoded assets that may be registered by name for scene loading
     */
    public boolean isAsset() {
        return this == IMAGE || this == AUDIO || this == FONT;
    }

    /**
     * Kinds minted by the client without any native object behind them
     */
    public boolean isClientOnly() {
        return this == DRAW_KEY;
    }
}
