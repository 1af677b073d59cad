package com.eainde.atlas.support;

import com.eainde.atlas.tools.AbstractToolCapability;
import com.eainde.atlas.tools.ToolCapability;
import com.eainde.atlas.tools.ToolResult;
import com.eainde.atlas.tools.ToolSchema;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Small capabilities with controllable behavior.
 */
public final class TestTools {

    private TestTools() {
    }

    public static ToolCapability failing(String name, String error) {
        return new AbstractToolCapability(name, "Always fails", ToolSchema.empty()) {
            @Override
            protected ToolResult invoke(Map<String, Object> arguments) {
                throw new IllegalStateException(error);
            }
        };
    }

    public static ToolCapability constant(String name, Object payload) {
        return new AbstractToolCapability(name, "Returns a constant", ToolSchema.empty()) {
            @Override
            protected ToolResult invoke(Map<String, Object> arguments) {
                return ToolResult.success(payload);
            }
        };
    }

    /**
     * Sleeps before answering; interruptible.
     */
    public static ToolCapability slow(String name, long millis) {
        return new AbstractToolCapability(name, "Answers slowly", ToolSchema.empty()) {
            @Override
            protected ToolResult invoke(Map<String, Object> arguments) {
                try {
                    Thread.sleep(millis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return ToolResult.failure("interrupted");
                }
                return ToolResult.success(name + " done");
            }
        };
    }

    /**
     * Returns a future that only completes once {@code release} is counted down.
     */
    public static ToolCapability gated(String name, CountDownLatch release) {
        return new ToolCapability() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String description() {
                return "Waits for a gate";
            }

            @Override
            public ToolSchema schema() {
                return ToolSchema.empty();
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> validatedArguments) {
                return CompletableFuture.supplyAsync(() -> {
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return ToolResult.success(name + " released");
                });
            }
        };
    }

    /**
     * Never answers on its own. Counts down {@code interrupted} once its worker is interrupted.
     */
    public static ToolCapability hanging(String name, CountDownLatch interrupted) {
        return new AbstractToolCapability(name, "Never answers", ToolSchema.empty()) {
            @Override
            protected ToolResult invoke(Map<String, Object> arguments) {
                try {
                    new CountDownLatch(1).await();
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return ToolResult.failure("interrupted");
            }
        };
    }
}
