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
package com.hellblazer.conduit.bridge.protocol;

import com.hellblazer.conduit.engine.AssetType;
import com.hellblazer.conduit.engine.DrawConfig;
import com.hellblazer.conduit.engine.InstanceSource;
import com.hellblazer.conduit.engine.PointerEvent;
import com.hellblazer.conduit.engine.PropertyType;
import com.hellblazer.conduit.engine.PropertyValue;
import com.hellblazer.conduit.engine.Selector;
import com.hellblazer.conduit.resource.Handle;

import java.util.List;
import java.util.Objects;

/**
 * A requested operation, enqueued by a client thread and executed by the command server. Every variant carries a
 * stable {@link CommandType} tag and a request id, 0 for fire-and-forget commands. Payloads are values only: byte
 * buffers are copied in and out, native objects are referenced by {@link Handle}.
 * <p>
 * Commands that create a native object carry the handle it will be registered under, minted by the client before
 * the command is enqueued.
 *
 * @author hal.hildebrand
 */
public interface Command {

    CommandType type();

    long requestId();

    default boolean isFireAndForget() {
        return requestId() == 0;
    }

    // Files

    record LoadFile(long requestId, Handle file, byte[] bytes) implements Command {
        public LoadFile {
            Objects.requireNonNull(bytes, "bytes");
            bytes = bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        @Override
        public CommandType type() {
            return CommandType.LOAD_FILE;
        }

        @Override
        public String toString() {
            return "LoadFile[requestId=" + requestId + ", file=" + file + ", " + bytes.length + " bytes]";
        }
    }

    record ListArtboards(long requestId, Handle file) implements Command {
        @Override
        public CommandType type() {
            return CommandType.LIST_ARTBOARDS;
        }
    }

    record ListStateMachines(long requestId, Handle artboard) implements Command {
        @Override
        public CommandType type() {
            return CommandType.LIST_STATE_MACHINES;
        }
    }

    record ListViewModels(long requestId, Handle file) implements Command {
        @Override
        public CommandType type() {
            return CommandType.LIST_VIEW_MODELS;
        }
    }

    record ListViewModelInstances(long requestId, Handle file, String viewModel) implements Command {
        @Override
        public CommandType type() {
            return CommandType.LIST_VIEW_MODEL_INSTANCES;
        }
    }

    record ListViewModelProperties(long requestId, Handle file, String viewModel) implements Command {
        @Override
        public CommandType type() {
            return CommandType.LIST_VIEW_MODEL_PROPERTIES;
        }
    }

    record ListEnums(long requestId, Handle file) implements Command {
        @Override
        public CommandType type() {
            return CommandType.LIST_ENUMS;
        }
    }

    // Artboards and state machines

    record CreateArtboard(long requestId, Handle file, Selector selector, Handle artboard) implements Command {
        @Override
        public CommandType type() {
            return CommandType.CREATE_ARTBOARD;
        }
    }

    record CreateStateMachine(long requestId, Handle artboard, Selector selector, Handle stateMachine)
    implements Command {
        @Override
        public CommandType type() {
            return CommandType.CREATE_STATE_MACHINE;
        }
    }

    record ResizeArtboard(long requestId, Handle artboard, float width, float height, float scale)
    implements Command {
        @Override
        public CommandType type() {
            return CommandType.RESIZE_ARTBOARD;
        }
    }

    record ResetArtboardSize(long requestId, Handle artboard) implements Command {
        @Override
        public CommandType type() {
            return CommandType.RESET_ARTBOARD_SIZE;
        }
    }

    record AdvanceStateMachine(long requestId, Handle stateMachine, float seconds) implements Command {
        @Override
        public CommandType type() {
            return CommandType.ADVANCE_STATE_MACHINE;
        }
    }

    record ListInputs(long requestId, Handle stateMachine) implements Command {
        @Override
        public CommandType type() {
            return CommandType.LIST_INPUTS;
        }
    }

    record GetInput(long requestId, Handle stateMachine, String name) implements Command {
        @Override
        public CommandType type() {
            return CommandType.GET_INPUT;
        }
    }

    record SetInput(long requestId, Handle stateMachine, String name, PropertyValue value) implements Command {
        @Override
        public CommandType type() {
            return CommandType.SET_INPUT;
        }
    }

    record Pointer(long requestId, Handle stateMachine, PointerEvent event) implements Command {
        @Override
        public CommandType type() {
            return CommandType.POINTER_EVENT;
        }
    }

    // Data binding

    /**
     * @param instanceName name of the authored instance for {@link InstanceSource#NAMED}, otherwise ignored
     */
    record CreateInstance(long requestId, Handle file, String viewModel, InstanceSource source, String instanceName,
                          Handle instance) implements Command {
        @Override
        public CommandType type() {
            return CommandType.CREATE_INSTANCE;
        }
    }

    record CreateDefaultInstance(long requestId, Handle file, Handle artboard, Handle instance) implements Command {
        @Override
        public CommandType type() {
            return CommandType.CREATE_DEFAULT_INSTANCE;
        }
    }

    record BindInstance(long requestId, Handle stateMachine, Handle instance) implements Command {
        @Override
        public CommandType type() {
            return CommandType.BIND_INSTANCE;
        }
    }

    record GetProperty(long requestId, Handle instance, String path, PropertyType propertyType) implements Command {
        @Override
        public CommandType type() {
            return CommandType.GET_PROPERTY;
        }
    }

    record SetProperty(long requestId, Handle instance, String path, PropertyValue value) implements Command {
        @Override
        public CommandType type() {
            return CommandType.SET_PROPERTY;
        }
    }

    /**
     * Start reporting changes of a value property. Mutations executed after this command produce a
     * {@link Message.PropertyChanged}; earlier ones never do.
     */
    record SubscribeProperty(long requestId, Handle instance, String path, PropertyType propertyType)
    implements Command {
        @Override
        public CommandType type() {
            return CommandType.SUBSCRIBE_PROPERTY;
        }
    }

    record UnsubscribeProperty(long requestId, Handle instance, String path, PropertyType propertyType)
    implements Command {
        @Override
        public CommandType type() {
            return CommandType.UNSUBSCRIBE_PROPERTY;
        }
    }

    /**
     * @param nested handle the nested instance reference is registered under
     */
    record GetInstanceProperty(long requestId, Handle instance, String path, Handle nested) implements Command {
        @Override
        public CommandType type() {
            return CommandType.GET_INSTANCE_PROPERTY;
        }
    }

    record SetInstanceProperty(long requestId, Handle instance, String path, Handle nested) implements Command {
        @Override
        public CommandType type() {
            return CommandType.SET_INSTANCE_PROPERTY;
        }
    }

    /**
     * @param image an image asset, or an absent handle to clear the property
     */
    record SetImageProperty(long requestId, Handle instance, String path, Handle image) implements Command {
        @Override
        public CommandType type() {
            return CommandType.SET_IMAGE_PROPERTY;
        }
    }

    /**
     * @param file     the file {@code artboard} was instantiated from
     * @param artboard an artboard, or an absent handle to clear the property
     */
    record SetArtboardProperty(long requestId, Handle instance, String path, Handle file, Handle artboard)
    implements Command {
        @Override
        public CommandType type() {
            return CommandType.SET_ARTBOARD_PROPERTY;
        }
    }

    record GetListSize(long requestId, Handle instance, String path) implements Command {
        @Override
        public CommandType type() {
            return CommandType.GET_LIST_SIZE;
        }
    }

    /**
     * @param item handle the item reference is registered under
     */
    record GetListItem(long requestId, Handle instance, String path, int index, Handle item) implements Command {
        @Override
        public CommandType type() {
            return CommandType.GET_LIST_ITEM;
        }
    }

    /**
     * @param index insertion index, -1 to append
     */
    record AddListItem(long requestId, Handle instance, String path, int index, Handle item) implements Command {
        @Override
        public CommandType type() {
            return CommandType.ADD_LIST_ITEM;
        }
    }

    /**
     * Removes {@code item} when it is present, otherwise the item at {@code index}
     */
    record RemoveListItem(long requestId, Handle instance, String path, int index, Handle item) implements Command {
        @Override
        public CommandType type() {
            return CommandType.REMOVE_LIST_ITEM;
        }
    }

    record SwapListItems(long requestId, Handle instance, String path, int indexA, int indexB) implements Command {
        @Override
        public CommandType type() {
            return CommandType.SWAP_LIST_ITEMS;
        }
    }

    // Assets

    record DecodeAsset(long requestId, AssetType assetType, byte[] bytes, Handle asset) implements Command {
        public DecodeAsset {
            Objects.requireNonNull(bytes, "bytes");
            bytes = bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        @Override
        public CommandType type() {
            return CommandType.DECODE_ASSET;
        }

        @Override
        public String toString() {
            return "DecodeAsset[requestId=" + requestId + ", " + assetType + ", asset=" + asset + ", " + bytes.length
                   + " bytes]";
        }
    }

    record RegisterAsset(long requestId, String name, Handle asset) implements Command {
        @Override
        public CommandType type() {
            return CommandType.REGISTER_ASSET;
        }
    }

    record UnregisterAsset(long requestId, AssetType assetType, String name) implements Command {
        @Override
        public CommandType type() {
            return CommandType.UNREGISTER_ASSET;
        }
    }

    // Drawing

    record CreateSurface(long requestId, int width, int height, Handle surface) implements Command {
        @Override
        public CommandType type() {
            return CommandType.CREATE_SURFACE;
        }
    }

    record CreateRenderTarget(long requestId, Handle surface, int sampleCount, Handle renderTarget)
    implements Command {
        @Override
        public CommandType type() {
            return CommandType.CREATE_RENDER_TARGET;
        }
    }

    /**
     * Draw an ordered batch of operations into a surface as one frame, answered by a single
     * {@link Message.Drawn}.
     *
     * @param drawKey client key echoed in the answer, may be absent
     */
    record Draw(long requestId, Handle drawKey, Handle surface, Handle renderTarget, List<DrawEntry> entries,
                DrawConfig config) implements Command {
        public Draw {
            entries = List.copyOf(entries);
            Objects.requireNonNull(config, "config");
        }

        @Override
        public CommandType type() {
            return CommandType.DRAW;
        }
    }

    record ReadPixels(long requestId, Handle surface) implements Command {
        @Override
        public CommandType type() {
            return CommandType.READ_PIXELS;
        }
    }

    /**
     * Release the native object behind any handle
     */
    record Delete(long requestId, Handle handle) implements Command {
        @Override
        public CommandType type() {
            return CommandType.DELETE;
        }
    }
}
