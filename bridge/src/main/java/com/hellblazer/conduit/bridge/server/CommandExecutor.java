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
package com.hellblazer.conduit.bridge.server;

import com.hellblazer.conduit.bridge.ErrorKind;
import com.hellblazer.conduit.bridge.ProtocolViolationException;
import com.hellblazer.conduit.bridge.protocol.Command;
import com.hellblazer.conduit.bridge.protocol.Message;
import com.hellblazer.conduit.engine.*;
import com.hellblazer.conduit.resource.Handle;
import com.hellblazer.conduit.resource.HandleKind;
import com.hellblazer.conduit.resource.ResourceRegistry;
import com.hellblazer.conduit.resource.UnknownHandleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Executes commands against the resource registry and the scene engine on the command server's thread.
 * <p>
 * Every handle a command references is validated, present and of the expected kind, before the engine is touched.
 * Failures are never thrown: they become a {@link Message.Failure} carrying the command's request id (0 for
 * fire-and-forget commands). The one exception is a command whose tag is missing or does not match its payload,
 * reported as {@link ProtocolViolationException} for the server to close the connection.
 * <p>
 * Request-bearing commands get exactly one terminal answer; fire-and-forget commands are answered only when they
 * fail. Advancing a state machine that settles, and mutating a subscribed property, produce additional unsolicited
 * messages.
 * <p>
 * The set of subscribed properties lives here, on the command server's thread, and changes only when a subscribe,
 * unsubscribe or delete command executes. A mutation is therefore reported exactly when it was queued after the
 * subscription.
 *
 * @author hal.hildebrand
 */
public class CommandExecutor {
    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    private final SceneEngine         engine;
    private final ResourceRegistry    registry;
    private final Consumer<Message>   out;
    private final Map<Topic, Integer> subscribed = new HashMap<>();
    private Handle                    subject;

    private record Topic(Handle instance, String path, PropertyType type) {
    }

    public CommandExecutor(SceneEngine engine, ResourceRegistry registry, Consumer<Message> out) {
        this.engine = engine;
        this.registry = registry;
        this.out = out;
    }

    /**
     * @throws ProtocolViolationException if the command's tag is missing or does not match its payload
     */
    public void execute(Command command) {
        var type = command.type();
        if (type == null) {
            throw new ProtocolViolationException(
            "Command without a type tag: " + command.getClass().getName(), null, command.requestId());
        }
        if (!type.matches(command)) {
            throw new ProtocolViolationException(
            "Tag " + type + " requires a " + type.getPayloadType().getSimpleName() + " payload but got "
            + command.getClass().getName(), type, command.requestId());
        }
        subject = null;
        log.debug("Executing {}", command);
        try {
            dispatch(command);
        } catch (UnknownHandleException e) {
            fail(command, ErrorKind.INVALID_HANDLE, e.getHandle(), e.getMessage());
        } catch (PropertyPathNotFoundException e) {
            fail(command, ErrorKind.PROPERTY_PATH, subject, e.getMessage());
        } catch (EngineException e) {
            fail(command, ErrorKind.NATIVE_OPERATION_FAILED, subject, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure executing {}", command, e);
            fail(command, ErrorKind.NATIVE_OPERATION_FAILED, subject, e.toString());
        }
    }

    private void dispatch(Command command) {
        switch (command.type()) {
            case LOAD_FILE -> loadFile((Command.LoadFile) command);
            case LIST_ARTBOARDS -> {
                var c = (Command.ListArtboards) command;
                var file = resolve(c.file(), HandleKind.FILE, SceneFile.class);
                reply(c, new Message.Names(c.requestId(), c.file(), engine.artboardNames(file)));
            }
            case LIST_STATE_MACHINES -> {
                var c = (Command.ListStateMachines) command;
                var artboard = resolve(c.artboard(), HandleKind.ARTBOARD, Artboard.class);
                reply(c, new Message.Names(c.requestId(), c.artboard(), engine.stateMachineNames(artboard)));
            }
            case LIST_VIEW_MODELS -> {
                var c = (Command.ListViewModels) command;
                var file = resolve(c.file(), HandleKind.FILE, SceneFile.class);
                reply(c, new Message.Names(c.requestId(), c.file(), engine.viewModelNames(file)));
            }
            case LIST_VIEW_MODEL_INSTANCES -> {
                var c = (Command.ListViewModelInstances) command;
                var file = resolve(c.file(), HandleKind.FILE, SceneFile.class);
                reply(c, new Message.Names(c.requestId(), c.file(), engine.instanceNames(file, c.viewModel())));
            }
            case LIST_VIEW_MODEL_PROPERTIES -> {
                var c = (Command.ListViewModelProperties) command;
                var file = resolve(c.file(), HandleKind.FILE, SceneFile.class);
                reply(c, new Message.Descriptors(c.requestId(), c.file(),
                                                 engine.viewModelProperties(file, c.viewModel())));
            }
            case LIST_ENUMS -> {
                var c = (Command.ListEnums) command;
                var file = resolve(c.file(), HandleKind.FILE, SceneFile.class);
                reply(c, new Message.Enums(c.requestId(), c.file(), engine.enums(file)));
            }
            case CREATE_ARTBOARD -> {
                var c = (Command.CreateArtboard) command;
                var file = resolve(c.file(), HandleKind.FILE, SceneFile.class);
                unbound(c.artboard(), HandleKind.ARTBOARD);
                var artboard = engine.instantiateArtboard(file, c.selector());
                register(c, c.artboard(), artboard, "artboard " + artboard.getName());
            }
            case CREATE_STATE_MACHINE -> {
                var c = (Command.CreateStateMachine) command;
                var artboard = resolve(c.artboard(), HandleKind.ARTBOARD, Artboard.class);
                unbound(c.stateMachine(), HandleKind.STATE_MACHINE);
                var stateMachine = engine.instantiateStateMachine(artboard, c.selector());
                register(c, c.stateMachine(), stateMachine, "state machine " + stateMachine.getName());
            }
            case RESIZE_ARTBOARD -> {
                var c = (Command.ResizeArtboard) command;
                var artboard = resolve(c.artboard(), HandleKind.ARTBOARD, Artboard.class);
                engine.resizeArtboard(artboard, c.width(), c.height(), c.scale());
                completed(c, c.artboard());
            }
            case RESET_ARTBOARD_SIZE -> {
                var c = (Command.ResetArtboardSize) command;
                engine.resetArtboardSize(resolve(c.artboard(), HandleKind.ARTBOARD, Artboard.class));
                completed(c, c.artboard());
            }
            case ADVANCE_STATE_MACHINE -> advance((Command.AdvanceStateMachine) command);
            case LIST_INPUTS -> {
                var c = (Command.ListInputs) command;
                var stateMachine = resolve(c.stateMachine(), HandleKind.STATE_MACHINE, StateMachine.class);
                reply(c, new Message.Descriptors(c.requestId(), c.stateMachine(), engine.inputs(stateMachine)));
            }
            case GET_INPUT -> {
                var c = (Command.GetInput) command;
                var stateMachine = resolve(c.stateMachine(), HandleKind.STATE_MACHINE, StateMachine.class);
                reply(c, new Message.Value(c.requestId(), c.stateMachine(), c.name(),
                                           engine.getInput(stateMachine, c.name())));
            }
            case SET_INPUT -> {
                var c = (Command.SetInput) command;
                var stateMachine = resolve(c.stateMachine(), HandleKind.STATE_MACHINE, StateMachine.class);
                engine.setInput(stateMachine, c.name(), c.value());
                completed(c, c.stateMachine());
            }
            case POINTER_EVENT -> {
                var c = (Command.Pointer) command;
                var stateMachine = resolve(c.stateMachine(), HandleKind.STATE_MACHINE, StateMachine.class);
                engine.pointer(stateMachine, c.event());
                completed(c, c.stateMachine());
            }
            case CREATE_INSTANCE -> {
                var c = (Command.CreateInstance) command;
                var file = resolve(c.file(), HandleKind.FILE, SceneFile.class);
                unbound(c.instance(), HandleKind.BINDABLE_INSTANCE);
                var instance = engine.instantiateViewModel(file, c.viewModel(), c.source(), c.instanceName());
                register(c, c.instance(), instance, "instance " + instance.getViewModelName());
            }
            case CREATE_DEFAULT_INSTANCE -> {
                var c = (Command.CreateDefaultInstance) command;
                var file = resolve(c.file(), HandleKind.FILE, SceneFile.class);
                var artboard = resolve(c.artboard(), HandleKind.ARTBOARD, Artboard.class);
                unbound(c.instance(), HandleKind.BINDABLE_INSTANCE);
                var instance = engine.defaultInstance(file, artboard);
                register(c, c.instance(), instance, "default instance of " + artboard.getName());
            }
            case BIND_INSTANCE -> {
                var c = (Command.BindInstance) command;
                var stateMachine = resolve(c.stateMachine(), HandleKind.STATE_MACHINE, StateMachine.class);
                var instance = resolve(c.instance(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
                engine.bind(stateMachine, instance);
                completed(c, c.stateMachine());
            }
            case GET_PROPERTY -> {
                var c = (Command.GetProperty) command;
                var instance = resolve(c.instance(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
                reply(c, new Message.Value(c.requestId(), c.instance(), c.path(),
                                           engine.getProperty(instance, c.path(), c.propertyType())));
            }
            case SET_PROPERTY -> setProperty((Command.SetProperty) command);
            case SUBSCRIBE_PROPERTY -> subscribe((Command.SubscribeProperty) command);
            case UNSUBSCRIBE_PROPERTY -> {
                var c = (Command.UnsubscribeProperty) command;
                subscribed.computeIfPresent(new Topic(c.instance(), c.path(), c.propertyType()),
                                            (topic, count) -> count == 1 ? null : count - 1);
                completed(c, c.instance());
            }
            case GET_INSTANCE_PROPERTY -> {
                var c = (Command.GetInstanceProperty) command;
                var instance = resolve(c.instance(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
                unbound(c.nested(), HandleKind.BINDABLE_INSTANCE);
                var nested = engine.getInstanceProperty(instance, c.path());
                register(c, c.nested(), nested, c.path() + " of " + c.instance());
            }
            case SET_INSTANCE_PROPERTY -> {
                var c = (Command.SetInstanceProperty) command;
                var instance = resolve(c.instance(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
                var nested = resolve(c.nested(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
                engine.setInstanceProperty(instance, c.path(), nested);
                completed(c, c.instance());
            }
            case SET_IMAGE_PROPERTY -> {
                var c = (Command.SetImageProperty) command;
                var instance = resolve(c.instance(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
                var image = c.image() == null || !c.image().isPresent() ? null
                                                                         : resolve(c.image(), HandleKind.IMAGE,
                                                                                   DecodedAsset.class);
                engine.setImageProperty(instance, c.path(), image);
                completed(c, c.instance());
            }
            case SET_ARTBOARD_PROPERTY -> {
                var c = (Command.SetArtboardProperty) command;
                var instance = resolve(c.instance(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
                if (c.artboard() == null || !c.artboard().isPresent()) {
                    engine.setArtboardProperty(instance, c.path(), null, null);
                } else {
                    var file = resolve(c.file(), HandleKind.FILE, SceneFile.class);
                    var artboard = resolve(c.artboard(), HandleKind.ARTBOARD, Artboard.class);
                    engine.setArtboardProperty(instance, c.path(), file, artboard);
                }
                completed(c, c.instance());
            }
            case GET_LIST_SIZE -> {
                var c = (Command.GetListSize) command;
                var instance = resolve(c.instance(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
                reply(c, new Message.Count(c.requestId(), c.instance(), engine.listSize(instance, c.path())));
            }
            case GET_LIST_ITEM -> {
                var c = (Command.GetListItem) command;
                var instance = resolve(c.instance(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
                unbound(c.item(), HandleKind.BINDABLE_INSTANCE);
                var item = engine.listItem(instance, c.path(), c.index());
                register(c, c.item(), item, c.path() + "[" + c.index() + "] of " + c.instance());
            }
            case ADD_LIST_ITEM -> {
                var c = (Command.AddListItem) command;
                var instance = resolve(c.instance(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
                var item = resolve(c.item(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
                engine.addListItem(instance, c.path(), c.index(), item);
                completed(c, c.instance());
            }
            case REMOVE_LIST_ITEM -> {
                var c = (Command.RemoveListItem) command;
                var instance = resolve(c.instance(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
                if (c.item() != null && c.item().isPresent()) {
                    engine.removeListItem(instance, c.path(),
                                          resolve(c.item(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class));
                } else {
                    engine.removeListItem(instance, c.path(), c.index());
                }
                completed(c, c.instance());
            }
            case SWAP_LIST_ITEMS -> {
                var c = (Command.SwapListItems) command;
                var instance = resolve(c.instance(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
                engine.swapListItems(instance, c.path(), c.indexA(), c.indexB());
                completed(c, c.instance());
            }
            case DECODE_ASSET -> {
                var c = (Command.DecodeAsset) command;
                unbound(c.asset(), kindOf(c.assetType()));
                var asset = engine.decodeAsset(c.assetType(), c.bytes());
                register(c, c.asset(), asset, c.assetType() + " asset");
            }
            case REGISTER_ASSET -> {
                var c = (Command.RegisterAsset) command;
                engine.registerAsset(c.name(), resolveAsset(c.asset()));
                completed(c, c.asset());
            }
            case UNREGISTER_ASSET -> {
                var c = (Command.UnregisterAsset) command;
                engine.unregisterAsset(c.assetType(), c.name());
                completed(c, null);
            }
            case CREATE_SURFACE -> {
                var c = (Command.CreateSurface) command;
                unbound(c.surface(), HandleKind.SURFACE);
                var surface = engine.createSurface(c.width(), c.height());
                register(c, c.surface(), surface, "surface " + c.width() + "x" + c.height());
            }
            case CREATE_RENDER_TARGET -> {
                var c = (Command.CreateRenderTarget) command;
                var surface = resolve(c.surface(), HandleKind.SURFACE, Surface.class);
                unbound(c.renderTarget(), HandleKind.RENDER_TARGET);
                var target = engine.createRenderTarget(surface, c.sampleCount());
                register(c, c.renderTarget(), target, "render target of " + c.surface());
            }
            case DRAW -> draw((Command.Draw) command);
            case READ_PIXELS -> {
                var c = (Command.ReadPixels) command;
                var surface = resolve(c.surface(), HandleKind.SURFACE, Surface.class);
                reply(c, new Message.Pixels(c.requestId(), c.surface(), surface.getWidth(), surface.getHeight(),
                                            engine.readPixels(surface)));
            }
            case DELETE -> delete((Command.Delete) command);
        }
    }

    private void loadFile(Command.LoadFile c) {
        unbound(c.file(), HandleKind.FILE);
        var file = engine.importFile(c.bytes());
        register(c, c.file(), file, "scene file");
    }

    private void advance(Command.AdvanceStateMachine c) {
        var stateMachine = resolve(c.stateMachine(), HandleKind.STATE_MACHINE, StateMachine.class);
        var settled = engine.advance(stateMachine, c.seconds());
        completed(c, c.stateMachine());
        if (settled) {
            out.accept(new Message.Settled(c.stateMachine()));
        }
    }

    private void setProperty(Command.SetProperty c) {
        var instance = resolve(c.instance(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
        engine.setProperty(instance, c.path(), c.value());
        completed(c, c.instance());
        var type = c.value().type();
        if (subscribed.containsKey(new Topic(c.instance(), c.path(), type))) {
            // triggers carry no state to read back
            var current = type == PropertyType.TRIGGER ? c.value() : engine.getProperty(instance, c.path(), type);
            out.accept(new Message.PropertyChanged(c.instance(), c.path(), current));
        }
    }

    private void subscribe(Command.SubscribeProperty c) {
        resolve(c.instance(), HandleKind.BINDABLE_INSTANCE, BindableInstance.class);
        if (c.propertyType() == null || !c.propertyType().isValue()) {
            throw new EngineException("Only value properties can be subscribed to, not " + c.propertyType());
        }
        subscribed.merge(new Topic(c.instance(), c.path(), c.propertyType()), 1, Integer::sum);
        completed(c, c.instance());
    }

    private void draw(Command.Draw c) {
        if (c.drawKey() != null && c.drawKey().isPresent() && !c.drawKey().is(HandleKind.DRAW_KEY)) {
            throw new UnknownHandleException(c.drawKey(), UnknownHandleException.Reason.WRONG_KIND,
                                             "Expected a draw key but got " + c.drawKey());
        }
        var surface = resolve(c.surface(), HandleKind.SURFACE, Surface.class);
        var target = resolve(c.renderTarget(), HandleKind.RENDER_TARGET, RenderTarget.class);
        var operations = new ArrayList<DrawOperation>(c.entries().size());
        for (var entry : c.entries()) {
            var artboard = resolve(entry.artboard(), HandleKind.ARTBOARD, Artboard.class);
            var stateMachine = entry.stateMachine().isPresent() ? resolve(entry.stateMachine(),
                                                                          HandleKind.STATE_MACHINE,
                                                                          StateMachine.class) : null;
            operations.add(new DrawOperation(artboard, stateMachine, entry.transform()));
        }
        engine.draw(surface, target, operations, c.config());
        reply(c, new Message.Drawn(c.requestId(), c.drawKey(), c.surface(), operations.size()));
    }

    private void delete(Command.Delete c) {
        var handle = c.handle();
        if (handle == null) {
            throw new UnknownHandleException(null, UnknownHandleException.Reason.ABSENT, "Delete without a handle");
        }
        subject = handle;
        if (handle.kind().isClientOnly()) {
            completed(c, handle);
            return;
        }
        registry.free(handle);
        log.debug("Deleted {}", handle);
        completed(c, handle);
        if (handle.is(HandleKind.BINDABLE_INSTANCE)
            && subscribed.keySet().removeIf(topic -> topic.instance().equals(handle))) {
            out.accept(new Message.SubscriptionsDropped(handle));
        }
    }

    /**
     * Number of distinct properties with live subscriptions
     */
    public int getSubscribedCount() {
        return subscribed.size();
    }

    private DecodedAsset resolveAsset(Handle handle) {
        if (handle != null && handle.isPresent() && !handle.kind().isAsset()) {
            throw new UnknownHandleException(handle, UnknownHandleException.Reason.WRONG_KIND,
                                             "Expected an asset handle but got " + handle);
        }
        return resolve(handle, handle == null ? HandleKind.IMAGE : handle.kind(), DecodedAsset.class);
    }

    private <T> T resolve(Handle handle, HandleKind kind, Class<T> type) {
        if (handle == null) {
            throw new UnknownHandleException(Handle.absent(kind), UnknownHandleException.Reason.ABSENT,
                                             "Missing " + kind.getDisplayName() + " handle");
        }
        if (subject == null) {
            subject = handle;
        }
        return registry.get(handle, kind, type);
    }

    private void unbound(Handle handle, HandleKind kind) {
        if (handle == null) {
            throw new UnknownHandleException(Handle.absent(kind), UnknownHandleException.Reason.ABSENT,
                                             "Missing " + kind.getDisplayName() + " handle");
        }
        registry.checkUnbound(handle, kind);
    }

    private void register(Command c, Handle handle, EngineObject object, String description) {
        try {
            registry.bind(handle, object, description);
        } catch (RuntimeException e) {
            object.close();
            throw e;
        }
        reply(c, new Message.Created(c.requestId(), handle));
    }

    private void completed(Command c, Handle handle) {
        reply(c, new Message.Completed(c.requestId(), handle));
    }

    private void reply(Command c, Message message) {
        if (!c.isFireAndForget()) {
            out.accept(message);
        }
    }

    private void fail(Command c, ErrorKind kind, Handle handle, String detail) {
        if (c.isFireAndForget()) {
            log.warn("Fire-and-forget {} failed ({}): {}", c.type(), kind, detail);
        } else {
            log.warn("Request {} ({}) failed ({}): {}", c.requestId(), c.type(), kind, detail);
        }
        out.accept(new Message.Failure(c.requestId(), c.type(), kind, handle, detail));
    }

    private static HandleKind kindOf(AssetType type) {
        return switch (type) {
            case IMAGE -> HandleKind.IMAGE;
            case AUDIO -> HandleKind.AUDIO;
            case FONT -> HandleKind.FONT;
        };
    }
}
