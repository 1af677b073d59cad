package com.eainde.atlas.tools;

import com.eainde.atlas.error.DuplicateCapabilityException;
import com.eainde.atlas.error.ToolArgumentsException;
import com.eainde.atlas.error.UnknownCapabilityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTest {

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
    }

    // =========================================================================
    //  Helper: minimal capability echoing its validated arguments
    // =========================================================================

    private static ToolCapability echo(String name, AtomicReference<Map<String, Object>> seen) {
        return new AbstractToolCapability(name, "Echo " + name,
                ToolSchema.builder().required("text", FieldType.STRING, "Text to echo").build()) {
            @Override
            protected ToolResult invoke(Map<String, Object> arguments) {
                seen.set(arguments);
                return ToolResult.success(arguments.get("text"));
            }
        };
    }

    private static ToolCapability echo(String name) {
        return echo(name, new AtomicReference<>());
    }

    // =========================================================================
    //  register() / get()
    // =========================================================================

    @Nested
    @DisplayName("register() and get()")
    class RegisterAndGet {

        @Test
        @DisplayName("get returns the very capability that was registered")
        void registerThenGet() {
            ToolCapability capability = echo("echo");

            registry.register(capability);

            assertThat(registry.get("echo")).isSameAs(capability);
            assertThat(registry.contains("echo")).isTrue();
            assertThat(registry.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("a repeated name is rejected and the first registration kept")
        void duplicateRejected() {
            ToolCapability first = echo("echo");
            registry.register(first);

            assertThatThrownBy(() -> registry.register(echo("echo")))
                    .isInstanceOf(DuplicateCapabilityException.class)
                    .hasMessageContaining("echo");
            assertThat(registry.get("echo")).isSameAs(first);
        }

        @Test
        @DisplayName("get on an unregistered name fails with UnknownCapabilityException")
        void unknownName() {
            registry.register(echo("echo"));

            assertThatThrownBy(() -> registry.get("search_hotels"))
                    .isInstanceOf(UnknownCapabilityException.class)
                    .hasMessageContaining("search_hotels");
        }

        @Test
        @DisplayName("registration after freeze() is refused")
        void frozen() {
            registry.register(echo("a"));
            registry.freeze();

            assertThat(registry.isFrozen()).isTrue();
            assertThatThrownBy(() -> registry.register(echo("b")))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(registry.size()).isEqualTo(1);
        }
    }

    // =========================================================================
    //  manifest()
    // =========================================================================

    @Nested
    @DisplayName("manifest()")
    class Manifest {

        @Test
        @DisplayName("preserves insertion order and can be iterated repeatedly")
        void orderedAndRestartable() {
            registry.register(echo("weather"));
            registry.register(echo("flights"));
            registry.register(echo("hotels"));

            Iterable<ToolManifestEntry> manifest = registry.manifest();
            List<String> first = new ArrayList<>();
            List<String> second = new ArrayList<>();
            manifest.forEach(e -> first.add(e.name()));
            manifest.forEach(e -> second.add(e.name()));

            assertThat(first).containsExactly("weather", "flights", "hotels");
            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("entries carry description and schema")
        void entryContents() {
            registry.register(echo("echo"));

            ToolManifestEntry entry = registry.manifest().iterator().next();

            assertThat(entry.description()).isEqualTo("Echo echo");
            assertThat(entry.schema().requiredNames()).containsExactly("text");
        }
    }

    // =========================================================================
    //  createCallables()
    // =========================================================================

    @Nested
    @DisplayName("createCallables()")
    class Callables {

        @Test
        @DisplayName("callables validate before executing")
        void validatesFirst() {
            AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
            registry.register(echo("echo", seen));
            ToolCallable callable = registry.createCallables().get("echo");

            assertThatThrownBy(() -> callable.invoke(Map.of("other", 1)))
                    .isInstanceOf(ToolArgumentsException.class)
                    .hasMessageContaining("text");
            assertThat(seen.get()).isNull();
        }

        @Test
        @DisplayName("callables hand only declared, validated arguments to the capability")
        void executesWithValidatedArguments() {
            AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
            registry.register(echo("echo", seen));

            ToolResult result = registry.createCallables().get("echo")
                    .invoke(Map.of("text", "hi", "extra", true)).join();

            assertThat(result.success()).isTrue();
            assertThat(result.payload()).isEqualTo("hi");
            assertThat(seen.get()).containsOnlyKeys("text");
        }

        @Test
        @DisplayName("callable map follows registration order")
        void ordered() {
            registry.register(echo("b"));
            registry.register(echo("a"));

            assertThat(registry.createCallables().keySet()).containsExactly("b", "a");
        }
    }
}
