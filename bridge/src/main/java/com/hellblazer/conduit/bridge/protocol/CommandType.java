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

/**
 * Stable tag of every command variant, paired with the record type that must carry it.
 *
 * @author hal.hildebrand
 */
public enum CommandType {
    LOAD_FILE(Command.LoadFile.class),
    LIST_ARTBOARDS(Command.ListArtboards.class),
    LIST_STATE_MACHINES(Command.ListStateMachines.class),
    LIST_VIEW_MODELS(Command.ListViewModels.class),
    LIST_VIEW_MODEL_INSTANCES(Command.ListViewModelInstances.class),
    LIST_VIEW_MODEL_PROPERTIES(Command.ListViewModelProperties.class),
    LIST_ENUMS(Command.ListEnums.class),
    CREATE_ARTBOARD(Command.CreateArtboard.class),
    CREATE_STATE_MACHINE(Command.CreateStateMachine.class),
    RESIZE_ARTBOARD(Command.ResizeArtboard.class),
    RESET_ARTBOARD_SIZE(Command.ResetArtboardSize.class),
    ADVANCE_STATE_MACHINE(Command.AdvanceStateMachine.class),
    LIST_INPUTS(Command.ListInputs.class),
    GET_INPUT(Command.GetInput.class),
    SET_INPUT(Command.SetInput.class),
    POINTER_EVENT(Command.Pointer.class),
    CREATE_INSTANCE(Command.CreateInstance.class),
    CREATE_DEFAULT_INSTANCE(Command.CreateDefaultInstance.class),
    BIND_INSTANCE(Command.BindInstance.class),
    GET_PROPERTY(Command.GetProperty.class),
    SET_PROPERTY(Command.SetProperty.class),
    SUBSCRIBE_PROPERTY(Command.SubscribeProperty.class),
    UNSUBSCRIBE_PROPERTY(Command.UnsubscribeProperty.class),
    GET_INSTANCE_PROPERTY(Command.GetInstanceProperty.class),
    SET_INSTANCE_PROPERTY(Command.SetInstanceProperty.class),
    SET_IMAGE_PROPERTY(Command.SetImageProperty.class),
    SET_ARTBOARD_PROPERTY(Command.SetArtboardProperty.class),
    GET_LIST_SIZE(Command.GetListSize.class),
    GET_LIST_ITEM(Command.GetListItem.class),
    ADD_LIST_ITEM(Command.AddListItem.class),
    REMOVE_LIST_ITEM(Command.RemoveListItem.class),
    SWAP_LIST_ITEMS(Command.SwapListItems.class),
    DECODE_ASSET(Command.DecodeAsset.class),
    REGISTER_ASSET(Command.RegisterAsset.class),
    UNREGISTER_ASSET(Command.UnregisterAsset.class),
    CREATE_SURFACE(Command.CreateSurface.class),
    CREATE_RENDER_TARGET(Command.CreateRenderTarget.class),
    DRAW(Command.Draw.class),
    READ_PIXELS(Command.ReadPixels.class),
    DELETE(Command.Delete.class);

    private final Class<? extends Command> payloadType;

    CommandType(Class<? extends Command> payloadType) {
        this.payloadType = payloadType;
    }

    public Class<? extends Command> getPayloadType() {
        return payloadType;
    }

    /**
     * Whether a command carries the payload its tag declares
     */
    public boolean matches(Command command) {
        return payloadType.isInstance(command);
    }
}
