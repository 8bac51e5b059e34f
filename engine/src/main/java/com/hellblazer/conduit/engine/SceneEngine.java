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

import java.util.List;

/**
 * Operation surface of a single-thread-affinity scene engine: vector animation playback, state machines, data
 * binding, asset decoding and offscreen drawing.
 * <p>
 * Every method other than {@link #getEngineName()} must be invoked on the thread that called
 * {@link #createContext()}, and every object the engine returns must be closed on that same thread. Implementations
 * signal rejected operations with {@link EngineException} and unresolved property paths with
 * {@link PropertyPathNotFoundException}.
 *
 * @author hal.hildebrand
 */
public interface SceneEngine {

    /**
     * Initialize the engine's rendering context on the calling thread, which becomes the context thread.
     */
    void createContext();

    /**
     * Release the rendering context. Must be called on the context thread.
     */
    void destroyContext();

    boolean hasContext();

    /**
     * Get the engine implementation name.
     */
    String getEngineName();

    // Files

    /**
     * Import a scene file from its serialized bytes.
     * @throws EngineException if the bytes are not a valid scene file
     */
    SceneFile importFile(byte[] bytes);

    List<String> artboardNames(SceneFile file);

    List<String> viewModelNames(SceneFile file);

    List<String> instanceNames(SceneFile file, String viewModel);

    List<PropertyDescriptor> viewModelProperties(SceneFile file, String viewModel);

    List<EnumDefinition> enums(SceneFile file);

    // Artboards

    Artboard instantiateArtboard(SceneFile file, Selector selector);

    List<String> stateMachineNames(Artboard artboard);

    /**
     * Resize an artboard, used by the layout fit. Width and height are in device pixels.
     */
    void resizeArtboard(Artboard artboard, float width, float height, float scale);

    void resetArtboardSize(Artboard artboard);

    // State machines

    StateMachine instantiateStateMachine(Artboard artboard, Selector selector);

    /**
     * Advance a state machine.
     * @param seconds elapsed time
     * @return true if the state machine has settled and needs no further advancing
     */
    boolean advance(StateMachine stateMachine, float seconds);

    List<PropertyDescriptor> inputs(StateMachine stateMachine);

    PropertyValue getInput(StateMachine stateMachine, String name);

    /**
     * Set an input. A {@link PropertyValue.TriggerValue} fires a trigger input.
     */
    void setInput(StateMachine stateMachine, String name, PropertyValue value);

    void pointer(StateMachine stateMachine, PointerEvent event);

    /**
     * Bind a view model instance to a state machine for data binding
     */
    void bind(StateMachine stateMachine, BindableInstance instance);

    // Data binding

    /**
     * Create an instance of a view model.
     * @param instanceName required for {@link InstanceSource#NAMED}, ignored otherwise
     */
    BindableInstance instantiateViewModel(SceneFile file, String viewModel, InstanceSource source,
                                          String instanceName);

    /**
     * Create the default instance of the view model an artboard is authored against.
     */
    BindableInstance defaultInstance(SceneFile file, Artboard artboard);

    PropertyValue getProperty(BindableInstance instance, String path, PropertyType type);

    void setProperty(BindableInstance instance, String path, PropertyValue value);

    /**
     * Reference a nested view model instance. The returned object shares state with the parent's property.
     */
    BindableInstance getInstanceProperty(BindableInstance instance, String path);

    void setInstanceProperty(BindableInstance instance, String path, BindableInstance nested);

    int listSize(BindableInstance instance, String path);

    BindableInstance listItem(BindableInstance instance, String path, int index);

    /**
     * Insert an item into a list property.
     * @param index insertion index, or -1 to append
     */
    void addListItem(BindableInstance instance, String path, int index, BindableInstance item);

    void removeListItem(BindableInstance instance, String path, int index);

    void removeListItem(BindableInstance instance, String path, BindableInstance item);

    void swapListItems(BindableInstance instance, String path, int indexA, int indexB);

    /**
     * Set an image property; a null image clears it
     */
    void setImageProperty(BindableInstance instance, String path, DecodedAsset image);

    /**
     * Set an artboard property to an artboard instantiated from {@code file}; a null artboard clears it
     */
    void setArtboardProperty(BindableInstance instance, String path, SceneFile file, Artboard artboard);

    // Assets

    DecodedAsset decodeAsset(AssetType type, byte[] bytes);

    /**
     * Register a decoded asset under the name scene files reference it by
     */
    void registerAsset(String name, DecodedAsset asset);

    void unregisterAsset(AssetType type, String name);

    // Drawing

    Surface createSurface(int width, int height);

    RenderTarget createRenderTarget(Surface surface, int sampleCount);

    /**
     * Clear the surface and draw the operations in order, as one frame.
     */
    void draw(Surface surface, RenderTarget target, List<DrawOperation> operations, DrawConfig config);

    /**
     * @return a copy of the surface contents, RGBA, row major, top row first
     */
    byte[] readPixels(Surface surface);
}
