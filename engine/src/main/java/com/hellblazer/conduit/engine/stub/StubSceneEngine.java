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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.conduit.engine.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stub scene engine for development and testing. Reads JSON scene documents (see {@link SceneDocument}), keeps
 * state machines and view model instances in memory and draws every artboard as its bounding box filled with the
 * artboard's color.
 * <p>
 * Like a native engine it is bound to the thread that created its context: every call made from another thread, or
 * made without a context, fails with {@link EngineException}.
 *
 * @author hal.hildebrand
 */
public class StubSceneEngine implements SceneEngine {
    private static final Logger log = LoggerFactory.getLogger(StubSceneEngine.class);

    private static final int MAX_SURFACE_DIMENSION = 16384;

    private final ObjectMapper                             objectMapper = new ObjectMapper();
    private final Map<AssetType, Map<String, StubAsset>> registeredAssets = new EnumMap<>(AssetType.class);
    private final AtomicInteger                            liveObjects  = new AtomicInteger(0);
    private final AtomicLong                               frames       = new AtomicLong(0);
    private final AtomicLong                               drawnOperations = new AtomicLong(0);
    private volatile Thread                                contextThread;

    public StubSceneEngine() {
        for (var type : AssetType.values()) {
            registeredAssets.put(type, new HashMap<>());
        }
    }

    @Override
    public void createContext() {
        if (contextThread != null) {
            throw new EngineException("Engine context already created on " + contextThread.getName());
        }
        contextThread = Thread.currentThread();
        log.info("Stub scene engine context created on {}", contextThread.getName());
    }

    @Override
    public void destroyContext() {
        checkThread();
        registeredAssets.values().forEach(Map::clear);
        var live = liveObjects.get();
        if (live > 0) {
            log.warn("Destroying stub scene engine context with {} live objects", live);
        }
        contextThread = null;
        log.info("Stub scene engine context destroyed");
    }

    @Override
    public boolean hasContext() {
        return contextThread != null;
    }

    @Override
    public String getEngineName() {
        return "Stub Scene Engine";
    }

    @Override
    public SceneFile importFile(byte[] bytes) {
        checkThread();
        var document = SceneDocument.parse(objectMapper, bytes);
        log.debug("Imported scene file with {} artboards", document.artboards().size());
        return new StubSceneFile(this, document);
    }

    @Override
    public List<String> artboardNames(SceneFile file) {
        var document = own(file, StubSceneFile.class).document;
        return document.artboards().stream().map(SceneDocument.ArtboardDef::name).toList();
    }

    @Override
    public List<String> viewModelNames(SceneFile file) {
        return List.copyOf(own(file, StubSceneFile.class).document.viewModels().keySet());
    }

    @Override
    public List<String> instanceNames(SceneFile file, String viewModel) {
        return List.copyOf(viewModel(own(file, StubSceneFile.class), viewModel).instances().keySet());
    }

    @Override
    public List<PropertyDescriptor> viewModelProperties(SceneFile file, String viewModel) {
        return viewModel(own(file, StubSceneFile.class), viewModel).properties()
                                                                   .stream()
                                                                   .map(p -> new PropertyDescriptor(p.name(),
                                                                                                    p.type()))
                                                                   .toList();
    }

    @Override
    public List<EnumDefinition> enums(SceneFile file) {
        return List.copyOf(own(file, StubSceneFile.class).document.enums().values());
    }

    @Override
    public Artboard instantiateArtboard(SceneFile file, Selector selector) {
        var stubFile = own(file, StubSceneFile.class);
        var artboards = stubFile.document.artboards();
        var def = select(artboards, selector, SceneDocument.ArtboardDef::name, "artboard");
        log.debug("Instantiated artboard {}", def.name());
        return new StubArtboard(this, stubFile, def);
    }

    @Override
    public List<String> stateMachineNames(Artboard artboard) {
        return own(artboard, StubArtboard.class).def.stateMachines()
                                                   .stream()
                                                   .map(SceneDocument.StateMachineDef::name)
                                                   .toList();
    }

    @Override
    public void resizeArtboard(Artboard artboard, float width, float height, float scale) {
        var stub = own(artboard, StubArtboard.class);
        if (!(width > 0) || !(height > 0) || !(scale > 0)) {
            throw new EngineException(
            String.format("Invalid artboard size %.1fx%.1f at scale %.2f", width, height, scale));
        }
        stub.resize(width / scale, height / scale);
    }

    @Override
    public void resetArtboardSize(Artboard artboard) {
        own(artboard, StubArtboard.class).reset();
    }

    @Override
    public StateMachine instantiateStateMachine(Artboard artboard, Selector selector) {
        var stub = own(artboard, StubArtboard.class);
        var def = select(stub.def.stateMachines(), selector, SceneDocument.StateMachineDef::name, "state machine");
        log.debug("Instantiated state machine {} on {}", def.name(), stub.getName());
        return new StubStateMachine(this, stub, def);
    }

    @Override
    public boolean advance(StateMachine stateMachine, float seconds) {
        var stub = own(stateMachine, StubStateMachine.class);
        if (seconds < 0 || Float.isNaN(seconds)) {
            throw new EngineException("Cannot advance by " + seconds + " seconds");
        }
        return stub.advance(seconds);
    }

    @Override
    public List<PropertyDescriptor> inputs(StateMachine stateMachine) {
        return own(stateMachine, StubStateMachine.class).def.inputs()
                                                           .stream()
                                                           .map(i -> new PropertyDescriptor(i.name(), i.type()))
                                                           .toList();
    }

    @Override
    public PropertyValue getInput(StateMachine stateMachine, String name) {
        var stub = own(stateMachine, StubStateMachine.class);
        var value = stub.inputs.get(name);
        if (value == null) {
            throw new EngineException("State machine " + stub.getName() + " has no input named '" + name + "'");
        }
        return value;
    }

    @Override
    public void setInput(StateMachine stateMachine, String name, PropertyValue value) {
        var stub = own(stateMachine, StubStateMachine.class);
        var current = stub.inputs.get(name);
        if (current == null) {
            throw new EngineException("State machine " + stub.getName() + " has no input named '" + name + "'");
        }
        if (current.type() != value.type()) {
            throw new EngineException(
            "Input '" + name + "' of " + stub.getName() + " is " + current.type() + ", not " + value.type());
        }
        if (value.type() == PropertyType.TRIGGER) {
            stub.fire(name);
        } else {
            stub.inputs.put(name, value);
            stub.wake();
        }
    }

    @Override
    public void pointer(StateMachine stateMachine, PointerEvent event) {
        var stub = own(stateMachine, StubStateMachine.class);
        if (!(event.surfaceWidth() > 0) || !(event.surfaceHeight() > 0)) {
            throw new EngineException(
            String.format("Invalid pointer surface %.1fx%.1f", event.surfaceWidth(), event.surfaceHeight()));
        }
        var transform = FitTransform.compute(event.fit(), event.alignment(), event.surfaceWidth(),
                                             event.surfaceHeight(), stub.artboard.getWidth(),
                                             stub.artboard.getHeight(), 1.0f);
        stub.lastPointer = event;
        stub.lastPointerLocal = FitTransform.invert(transform, event.x(), event.y());
        stub.wake();
    }

    @Override
    public void bind(StateMachine stateMachine, BindableInstance instance) {
        var stub = own(stateMachine, StubStateMachine.class);
        stub.bound = own(instance, StubBindableInstance.class).node;
        stub.wake();
    }

    @Override
    public BindableInstance instantiateViewModel(SceneFile file, String viewModel, InstanceSource source,
                                                 String instanceName) {
        var stubFile = own(file, StubSceneFile.class);
        var def = viewModel(stubFile, viewModel);
        var document = stubFile.document;
        ViewModelNode node = switch (source) {
            case BLANK -> ViewModelNode.create(document, def.name(), "", null);
            case DEFAULT -> {
                if (def.instances().isEmpty()) {
                    yield ViewModelNode.create(document, def.name(), "", null);
                }
                var first = def.instances().entrySet().iterator().next();
                yield ViewModelNode.create(document, def.name(), first.getKey(), first.getValue());
            }
            case NAMED -> {
                var values = instanceName == null ? null : def.instances().get(instanceName);
                if (values == null) {
                    throw new EngineException("View model " + def.name() + " has no instance named '" + instanceName
                                              + "'");
                }
                yield ViewModelNode.create(document, def.name(), instanceName, values);
            }
        };
        return new StubBindableInstance(this, node);
    }

    @Override
    public BindableInstance defaultInstance(SceneFile file, Artboard artboard) {
        var stub = own(artboard, StubArtboard.class);
        var viewModel = stub.def.viewModel();
        if (viewModel == null) {
            throw new EngineException("Artboard " + stub.getName() + " has no default view model");
        }
        return instantiateViewModel(file, viewModel, InstanceSource.DEFAULT, null);
    }

    @Override
    public PropertyValue getProperty(BindableInstance instance, String path, PropertyType type) {
        if (!type.isValue()) {
            throw new EngineException(type + " properties are not values");
        }
        var slot = own(instance, StubBindableInstance.class).node.resolve(path, type);
        return slot.owner().value(slot.name());
    }

    @Override
    public void setProperty(BindableInstance instance, String path, PropertyValue value) {
        var slot = own(instance, StubBindableInstance.class).node.resolve(path, value.type());
        slot.owner().setValue(slot.def(), value);
    }

    @Override
    public BindableInstance getInstanceProperty(BindableInstance instance, String path) {
        var slot = own(instance, StubBindableInstance.class).node.resolve(path, PropertyType.VIEW_MODEL);
        return new StubBindableInstance(this, slot.owner().nested(slot.def()));
    }

    @Override
    public void setInstanceProperty(BindableInstance instance, String path, BindableInstance nested) {
        var slot = own(instance, StubBindableInstance.class).node.resolve(path, PropertyType.VIEW_MODEL);
        slot.owner().setNested(slot.def(), own(nested, StubBindableInstance.class).node);
    }

    @Override
    public int listSize(BindableInstance instance, String path) {
        return list(instance, path).size();
    }

    @Override
    public BindableInstance listItem(BindableInstance instance, String path, int index) {
        var items = list(instance, path);
        checkIndex(items, index, path);
        return new StubBindableInstance(this, items.get(index));
    }

    @Override
    public void addListItem(BindableInstance instance, String path, int index, BindableInstance item) {
        var slot = own(instance, StubBindableInstance.class).node.resolve(path, PropertyType.LIST);
        var node = own(item, StubBindableInstance.class).node;
        slot.owner().checkReference(slot.def(), node);
        var items = slot.owner().list(slot.def());
        if (index == -1) {
            items.add(node);
        } else if (index >= 0 && index <= items.size()) {
            items.add(index, node);
        } else {
            throw new EngineException("Insertion index " + index + " out of range for list '" + path + "' of size "
                                      + items.size());
        }
    }

    @Override
    public void removeListItem(BindableInstance instance, String path, int index) {
        var items = list(instance, path);
        checkIndex(items, index, path);
        items.remove(index);
    }

    @Override
    public void removeListItem(BindableInstance instance, String path, BindableInstance item) {
        var items = list(instance, path);
        var node = own(item, StubBindableInstance.class).node;
        if (!items.removeIf(n -> n == node)) {
            throw new EngineException("List '" + path + "' does not contain " + node);
        }
    }

    @Override
    public void swapListItems(BindableInstance instance, String path, int indexA, int indexB) {
        var items = list(instance, path);
        checkIndex(items, indexA, path);
        checkIndex(items, indexB, path);
        var a = items.get(indexA);
        items.set(indexA, items.get(indexB));
        items.set(indexB, a);
    }

    @Override
    public void setImageProperty(BindableInstance instance, String path, DecodedAsset image) {
        var slot = own(instance, StubBindableInstance.class).node.resolve(path, PropertyType.IMAGE);
        if (image != null) {
            var asset = own(image, StubAsset.class);
            if (asset.getAssetType() != AssetType.IMAGE) {
                throw new EngineException("Cannot assign a " + asset.getAssetType() + " asset to image property '"
                                          + path + "'");
            }
            slot.owner().setReference(slot.name(), asset);
        } else {
            slot.owner().setReference(slot.name(), null);
        }
    }

    @Override
    public void setArtboardProperty(BindableInstance instance, String path, SceneFile file, Artboard artboard) {
        var slot = own(instance, StubBindableInstance.class).node.resolve(path, PropertyType.ARTBOARD);
        if (artboard == null) {
            slot.owner().setReference(slot.name(), null);
            return;
        }
        var stubFile = own(file, StubSceneFile.class);
        var stub = own(artboard, StubArtboard.class);
        if (stub.file != stubFile) {
            throw new EngineException(stub + " was not instantiated from " + stubFile);
        }
        slot.owner().setReference(slot.name(), stub);
    }

    @Override
    public DecodedAsset decodeAsset(AssetType type, byte[] bytes) {
        checkThread();
        if (bytes == null || bytes.length == 0) {
            throw new EngineException("Cannot decode an empty " + type + " asset");
        }
        log.debug("Decoded {} asset of {} bytes", type, bytes.length);
        return new StubAsset(this, type, bytes.length);
    }

    @Override
    public void registerAsset(String name, DecodedAsset asset) {
        var stub = own(asset, StubAsset.class);
        if (name == null || name.isEmpty()) {
            throw new EngineException("Asset name must not be empty");
        }
        registeredAssets.get(stub.getAssetType()).put(name, stub);
        log.debug("Registered {} asset '{}'", stub.getAssetType(), name);
    }

    @Override
    public void unregisterAsset(AssetType type, String name) {
        checkThread();
        if (registeredAssets.get(type).remove(name) == null) {
            throw new EngineException("No " + type + " asset registered as '" + name + "'");
        }
        log.debug("Unregistered {} asset '{}'", type, name);
    }

    @Override
    public Surface createSurface(int width, int height) {
        checkThread();
        if (width <= 0 || height <= 0 || width > MAX_SURFACE_DIMENSION || height > MAX_SURFACE_DIMENSION) {
            throw new EngineException("Invalid surface size " + width + "x" + height);
        }
        return new StubSurface(this, width, height);
    }

    @Override
    public RenderTarget createRenderTarget(Surface surface, int sampleCount) {
        var stub = own(surface, StubSurface.class);
        if (sampleCount < 1) {
            throw new EngineException("Sample count must be at least 1: " + sampleCount);
        }
        return new StubRenderTarget(this, stub, sampleCount);
    }

    @Override
    public void draw(Surface surface, RenderTarget target, List<DrawOperation> operations, DrawConfig config) {
        var stubSurface = own(surface, StubSurface.class);
        var stubTarget = own(target, StubRenderTarget.class);
        if (stubTarget.getSurface() != stubSurface) {
            throw new EngineException("Render target does not belong to " + stubSurface);
        }
        // Validate the whole frame before touching any pixel
        var artboards = new ArrayList<StubArtboard>(operations.size());
        for (var operation : operations) {
            artboards.add(own(operation.artboard(), StubArtboard.class));
            if (operation.stateMachine() != null) {
                own(operation.stateMachine(), StubStateMachine.class);
            }
        }
        stubSurface.clear(config.clearColor());
        for (int i = 0; i < operations.size(); i++) {
            var artboard = artboards.get(i);
            var transform = operations.get(i).transform();
            if (transform == null) {
                transform = FitTransform.compute(config.fit(), config.alignment(), stubSurface.getWidth(),
                                                 stubSurface.getHeight(), artboard.getWidth(), artboard.getHeight(),
                                                 config.scale());
            }
            fillBounds(stubSurface, artboard, transform);
        }
        frames.incrementAndGet();
        drawnOperations.addAndGet(operations.size());
    }

    @Override
    public byte[] readPixels(Surface surface) {
        return own(surface, StubSurface.class).pixels.clone();
    }

    /**
     * @return engine objects created and not yet closed
     */
    public int getLiveObjectCount() {
        return liveObjects.get();
    }

    public long getFrameCount() {
        return frames.get();
    }

    public long getDrawnOperationCount() {
        return drawnOperations.get();
    }

    public boolean isAssetRegistered(AssetType type, String name) {
        checkThread();
        return registeredAssets.get(type).containsKey(name);
    }

    /**
     * Number of times a trigger property has fired on an instance
     */
    public int triggerCount(BindableInstance instance, String path) {
        var slot = own(instance, StubBindableInstance.class).node.resolve(path, PropertyType.TRIGGER);
        return slot.owner().triggerCount(slot.name());
    }

    /**
     * Number of times a trigger input has fired on a state machine
     */
    public int triggerCount(StateMachine stateMachine, String input) {
        return own(stateMachine, StubStateMachine.class).triggerCounts.getOrDefault(input, 0);
    }

    /**
     * Last pointer position mapped into artboard space, or null if no pointer event was received
     */
    public float[] lastPointerPosition(StateMachine stateMachine) {
        var local = own(stateMachine, StubStateMachine.class).lastPointerLocal;
        return local == null ? null : local.clone();
    }

    /**
     * Name of the artboard assigned to an artboard property, or null if it is unset
     */
    public String artboardProperty(BindableInstance instance, String path) {
        var slot = own(instance, StubBindableInstance.class).node.resolve(path, PropertyType.ARTBOARD);
        var artboard = (StubArtboard) slot.owner().reference(slot.name());
        return artboard == null ? null : artboard.getName();
    }

    /**
     * The view model instance bound to a state machine, or null
     */
    public String boundInstance(StateMachine stateMachine) {
        var bound = own(stateMachine, StubStateMachine.class).bound;
        return bound == null ? null : bound.toString();
    }

    void checkThread() {
        var thread = contextThread;
        if (thread == null) {
            throw new EngineException("No engine context");
        }
        if (thread != Thread.currentThread()) {
            throw new EngineException(
            "Engine context is bound to " + thread.getName() + " but was called from " + Thread.currentThread()
                                                                                                 .getName());
        }
    }

    void objectCreated() {
        liveObjects.incrementAndGet();
    }

    void objectClosed() {
        liveObjects.decrementAndGet();
    }

    private <T extends AbstractStubObject> T own(EngineObject object, Class<T> type) {
        checkThread();
        if (!type.isInstance(object)) {
            throw new EngineException("Expected a " + type.getSimpleName() + " but got " + object);
        }
        var stub = type.cast(object);
        if (stub.engine != this) {
            throw new EngineException(object + " belongs to another engine");
        }
        stub.ensureOpen();
        return stub;
    }

    private List<ViewModelNode> list(BindableInstance instance, String path) {
        var slot = own(instance, StubBindableInstance.class).node.resolve(path, PropertyType.LIST);
        return slot.owner().list(slot.def());
    }

    private static SceneDocument.ViewModelDef viewModel(StubSceneFile file, String name) {
        var def = name == null ? null : file.document.viewModels().get(name);
        if (def == null) {
            throw new EngineException("Unknown view model: " + name);
        }
        return def;
    }

    private static void checkIndex(List<?> items, int index, String path) {
        if (index < 0 || index >= items.size()) {
            throw new EngineException("Index " + index + " out of range for list '" + path + "' of size "
                                      + items.size());
        }
    }

    private static <T> T select(List<T> candidates, Selector selector, java.util.function.Function<T, String> name,
                                String what) {
        return switch (selector.mode()) {
            case DEFAULT -> {
                if (candidates.isEmpty()) {
                    throw new EngineException("No " + what + " to use as default");
                }
                yield candidates.get(0);
            }
            case NAME -> candidates.stream()
                                   .filter(c -> name.apply(c).equals(selector.name()))
                                   .findFirst()
                                   .orElseThrow(() -> new EngineException("No " + what + " named '"
                                                                          + selector.name() + "'"));
            case INDEX -> {
                if (selector.index() >= candidates.size()) {
                    throw new EngineException(
                    "No " + what + " at index " + selector.index() + " (have " + candidates.size() + ")");
                }
                yield candidates.get(selector.index());
            }
        };
    }

    private static void fillBounds(StubSurface surface, StubArtboard artboard, float[] t) {
        float w = artboard.getWidth();
        float h = artboard.getHeight();
        float minX = Float.POSITIVE_INFINITY, minY = Float.POSITIVE_INFINITY;
        float maxX = Float.NEGATIVE_INFINITY, maxY = Float.NEGATIVE_INFINITY;
        for (float[] corner : new float[][] { { 0, 0 }, { w, 0 }, { 0, h }, { w, h } }) {
            var x = t[0] * corner[0] + t[2] * corner[1] + t[4];
            var y = t[1] * corner[0] + t[3] * corner[1] + t[5];
            minX = Math.min(minX, x);
            minY = Math.min(minY, y);
            maxX = Math.max(maxX, x);
            maxY = Math.max(maxY, y);
        }
        surface.fill(Math.round(minX), Math.round(minY), Math.round(maxX), Math.round(maxY), artboard.def.color());
    }
}
