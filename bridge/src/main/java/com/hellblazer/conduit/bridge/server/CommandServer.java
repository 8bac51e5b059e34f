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

import com.hellblazer.conduit.bridge.BridgeConfiguration;
import com.hellblazer.conduit.bridge.ErrorKind;
import com.hellblazer.conduit.bridge.LifecycleException;
import com.hellblazer.conduit.bridge.ProtocolViolationException;
import com.hellblazer.conduit.bridge.channel.CommandChannel;
import com.hellblazer.conduit.bridge.channel.MessageChannel;
import com.hellblazer.conduit.bridge.protocol.Command;
import com.hellblazer.conduit.bridge.protocol.Message;
import com.hellblazer.conduit.engine.SceneEngine;
import com.hellblazer.conduit.resource.ResourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single worker thread that owns a scene engine context and a resource registry for one session. Commands are
 * executed strictly in the order they were enqueued; results are pushed to the {@link MessageChannel}. The worker
 * blocks only while waiting for the next command.
 * <p>
 * Shutdown refuses new commands, lets the command in flight finish and then, depending on the
 * {@link BridgeConfiguration.ShutdownPolicy}, executes or aborts the commands still queued, releases every registry
 * entry and destroys the engine context on the worker thread. A protocol violation ends the session the same way,
 * aborting whatever is still queued.
 *
 * @author hal.hildebrand
 */
public class CommandServer {
    private static final Logger log = LoggerFactory.getLogger(CommandServer.class);

    private final SceneEngine                       engine;
    private final ResourceRegistry                  registry;
    private final MessageChannel                    messages;
    private final BridgeConfiguration               config;
    private final CommandChannel                    commands = new CommandChannel();
    private final CommandExecutor                   executor;
    private final AtomicReference<ServerState>      state    = new AtomicReference<>(ServerState.STOPPED);
    private final CountDownLatch                    started  = new CountDownLatch(1);
    private final AtomicLong                        executed = new AtomicLong(0);
    private final AtomicLong                        rejected = new AtomicLong(0);
    private volatile Thread                         worker;
    private volatile RuntimeException               startFailure;
    private volatile ProtocolViolationException     violation;

    public CommandServer(SceneEngine engine, ResourceRegistry registry, MessageChannel messages,
                         BridgeConfiguration config) {
        this.engine = engine;
        this.registry = registry;
        this.messages = messages;
        this.config = config;
        this.executor = new CommandExecutor(engine, registry, messages::push);
    }

    /**
     * Spawn the worker thread and wait until it has created the engine context
     *
     * @throws LifecycleException if the server was already started, or the context could not be created in time
     */
    public void start() {
        if (!state.compareAndSet(ServerState.STOPPED, ServerState.STARTING) || worker != null) {
            throw new LifecycleException("Command server cannot be started from state " + state.get());
        }
        var thread = new Thread(this::run, config.getWorkerThreadName());
        thread.setDaemon(true);
        worker = thread;
        thread.start();
        var timeout = config.getStartTimeout();
        try {
            if (!started.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                commands.close();
                throw new LifecycleException("Command server did not start within " + timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            commands.close();
            throw new LifecycleException("Interrupted while starting command server", e);
        }
        var failure = startFailure;
        if (failure != null) {
            throw new LifecycleException("Command server failed to start: " + failure.getMessage(), failure);
        }
    }

    /**
     * Queue a command for execution
     *
     * @return false if the server is not running; a lifecycle error answering the command has been pushed instead
     */
    public boolean enqueue(Command command) {
        if (state.get().acceptsCommands() && commands.offer(command)) {
            return true;
        }
        rejected.incrementAndGet();
        log.debug("Rejected {} while {}", command, state.get());
        messages.push(new Message.Failure(command.requestId(), command.type(), ErrorKind.LIFECYCLE, null,
                                          "Command server is " + state.get()));
        return false;
    }

    /**
     * Stop accepting commands, finish or abort the queued ones and wait for the worker to exit
     */
    public void shutdown() {
        var thread = worker;
        if (thread == null) {
            return;
        }
        if (thread == Thread.currentThread()) {
            throw new IllegalStateException("Command server cannot shut itself down from the worker thread");
        }
        if (state.compareAndSet(ServerState.RUNNING, ServerState.DRAINING)) {
            log.info("Command server draining {} queued commands ({})", commands.size(),
                     config.getShutdownPolicy());
        }
        commands.close();
        try {
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LifecycleException("Interrupted while stopping command server", e);
        }
    }

    public ServerState getState() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == ServerState.RUNNING;
    }

    /**
     * @return the violation that closed the connection, or null
     */
    public ProtocolViolationException getViolation() {
        return violation;
    }

    public long getExecutedCount() {
        return executed.get();
    }

    public long getRejectedCount() {
        return rejected.get();
    }

    public int getQueuedCount() {
        return commands.size();
    }

    public Thread getWorkerThread() {
        return worker;
    }

    private void run() {
        try {
            registry.claim();
            engine.createContext();
        } catch (RuntimeException e) {
            log.error("Failed to create {} context", engine.getEngineName(), e);
            startFailure = e;
            state.set(ServerState.STOPPED);
            started.countDown();
            return;
        }
        state.compareAndSet(ServerState.STARTING, ServerState.RUNNING);
        log.info("Command server running on {} ({})", Thread.currentThread().getName(), engine.getEngineName());
        started.countDown();
        try {
            serve();
        } finally {
            teardown();
        }
    }

    private void serve() {
        while (true) {
            Command command;
            try {
                command = commands.take();
            } catch (InterruptedException e) {
                log.warn("Command server interrupted, aborting queued commands");
                state.set(ServerState.DRAINING);
                commands.close();
                abortRemaining("Command server was interrupted");
                return;
            }
            if (command == null) {
                return;
            }
            if (state.get() == ServerState.DRAINING
            && config.getShutdownPolicy() == BridgeConfiguration.ShutdownPolicy.ABORT) {
                abort(command, "Command server shut down before executing the command");
                continue;
            }
            try {
                executor.execute(command);
                executed.incrementAndGet();
            } catch (ProtocolViolationException e) {
                log.error("Protocol violation, closing connection: {}", e.getMessage());
                violation = e;
                state.set(ServerState.DRAINING);
                commands.close();
                messages.push(new Message.Failure(command.requestId(), e.getOrigin(), ErrorKind.PROTOCOL, null,
                                                  e.getMessage()));
                abortRemaining("Connection closed after a protocol violation");
                return;
            }
        }
    }

    private void abortRemaining(String reason) {
        for (var command : commands.drainRemaining()) {
            abort(command, reason);
        }
    }

    private void abort(Command command, String reason) {
        messages.push(new Message.Failure(command.requestId(), command.type(), ErrorKind.LIFECYCLE, null, reason));
    }

    private void teardown() {
        try {
            registry.close();
        } catch (RuntimeException e) {
            log.error("Failed to release session resources", e);
        }
        try {
            engine.destroyContext();
        } catch (RuntimeException e) {
            log.error("Failed to destroy {} context", engine.getEngineName(), e);
        }
        state.set(ServerState.STOPPED);
        log.info("Command server stopped after {} commands", executed.get());
    }
}
