package com.praga.bootstrap;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide holder of the {@link ServerContext} created at bootstrap. Only one may be set at a time.
 */
public final class GlobalContext {

    private static final AtomicReference<ServerContext> CURRENT = new AtomicReference<>();

    private GlobalContext() {
    }

    /**
     * @throws IllegalStateException if a context is already set
     */
    public static void set(ServerContext context) {
        Objects.requireNonNull(context, "context");
        if (!CURRENT.compareAndSet(null, context)) {
            throw new IllegalStateException("Server context already initialized; clear it before creating another");
        }
    }

    /**
     * @throws IllegalStateException if no context has been set
     */
    public static ServerContext get() {
        ServerContext context = CURRENT.get();
        if (context == null) {
            throw new IllegalStateException("Server context not initialized; call PragaBootstrap.initialize() first");
        }
        return context;
    }

    public static boolean isInitialized() {
        return CURRENT.get() != null;
    }

    /** Removes the current context and returns it, or {@code null}. Does not close it. */
    public static ServerContext clear() {
        return CURRENT.getAndSet(null);
    }
}
