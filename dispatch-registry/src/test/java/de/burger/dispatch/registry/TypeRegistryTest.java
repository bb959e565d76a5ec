package de.burger.dispatch.registry;

import de.burger.dispatch.capability.Capability;
import de.burger.dispatch.config.Configuration;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypeRegistryTest {

    private final TypeRegistry<Capability<String, String>> registry = new TypeRegistry<>();

    @Test
    void createsInstanceBehavingLikeConstructorResult() {
        registry.register("upper", () -> String::toUpperCase);
        assertThat(registry.create("upper").perform("abc")).isEqualTo("ABC");
    }

    @Test
    void everyCreateBuildsNewInstance() {
        AtomicInteger built = new AtomicInteger();
        registry.register("echo", () -> {
            int serial = built.incrementAndGet();
            return input -> input + "#" + serial;
        });
        Capability<String, String> first = registry.create("echo");
        Capability<String, String> second = registry.create("echo");
        assertThat(first).isNotSameAs(second);
        assertThat(first.perform("x")).isEqualTo("x#1");
        assertThat(second.perform("x")).isEqualTo("x#2");
        assertThat(built).hasValue(2);
    }

    @Test
    void unknownKeyFailsNamingTheKey() {
        registry.register("a", () -> input -> "a");
        assertThatThrownBy(() -> registry.create("missing"))
            .isInstanceOf(UnknownKeyException.class)
            .hasMessageContaining("missing")
            .satisfies(e -> {
                UnknownKeyException unknown = (UnknownKeyException) e;
                assertThat(unknown.key()).isEqualTo("missing");
                assertThat(unknown.knownKeys()).containsExactly("a");
            });
    }

    @Test
    void reRegistrationReplacesPriorBinding() {
        registry.register("k", () -> input -> "f");
        registry.register("k", () -> input -> "g");
        assertThat(registry.create("k").perform("x")).isEqualTo("g");
        assertThat(registry.listKeys()).containsExactly("k");
    }

    @Test
    void listKeysPreservesInsertionOrderWithoutDuplicates() {
        registry.register("a", () -> input -> "a");
        registry.register("b", () -> input -> "b");
        registry.register("c", () -> input -> "c");
        registry.register("a", () -> input -> "a2");
        assertThat(registry.listKeys()).containsExactly("a", "b", "c");
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    void listKeysIsSnapshot() {
        registry.register("a", () -> input -> "a");
        List<String> snapshot = registry.listKeys();
        registry.register("b", () -> input -> "b");
        assertThat(snapshot).containsExactly("a");
        assertThatThrownBy(() -> snapshot.add("z")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void constructorFailureIsWrappedWithCause() {
        IOException boom = new IOException("disk gone");
        registry.register("broken", configuration -> {
            throw boom;
        });
        assertThatThrownBy(() -> registry.create("broken"))
            .isInstanceOf(ConstructionException.class)
            .hasMessageContaining("broken")
            .hasMessageContaining("disk gone")
            .hasCause(boom);
    }

    @Test
    void uncheckedConstructorFailureIsWrappedToo() {
        registry.register("broken", () -> {
            throw new IllegalStateException("nope");
        });
        assertThatThrownBy(() -> registry.create("broken"))
            .isInstanceOf(ConstructionException.class)
            .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void interruptedConstructorKeepsInterruptStatus() {
        registry.register("interrupted", configuration -> {
            throw new InterruptedException("stop");
        });
        try {
            assertThatThrownBy(() -> registry.create("interrupted"))
                .isInstanceOf(ConstructionException.class)
                .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void causeWithoutMessageIsDescribedByType() {
        registry.register("silent", () -> {
            throw new UnsupportedOperationException();
        });
        assertThatThrownBy(() -> registry.create("silent"))
            .isInstanceOf(ConstructionException.class)
            .hasMessage("Constructor for key 'silent' failed: java.lang.UnsupportedOperationException");
    }

    @Test
    void nullFromConstructorIsConstructionFailure() {
        registry.register("null", () -> null);
        assertThatThrownBy(() -> registry.create("null"))
            .isInstanceOf(ConstructionException.class)
            .hasMessageContaining("returned null");
    }

    @Test
    void configurationIsPassedToConstructor() {
        registry.register("prefix", configuration -> {
            String prefix = configuration.getString("prefix", "");
            return input -> prefix + input;
        });
        Configuration configuration = Configuration.builder().with("prefix", ">> ").build();
        assertThat(registry.create("prefix", configuration).perform("hi")).isEqualTo(">> hi");
        assertThat(registry.create("prefix").perform("hi")).isEqualTo("hi");
    }

    @Test
    void createDoesNotChangeRegistry() {
        registry.register("a", () -> input -> "a");
        registry.create("a");
        assertThatThrownBy(() -> registry.create("b")).isInstanceOf(UnknownKeyException.class);
        assertThat(registry.listKeys()).containsExactly("a");
        assertThat(registry.contains("a")).isTrue();
        assertThat(registry.contains("b")).isFalse();
    }

    @Test
    void blankKeyIsRejected() {
        assertThatThrownBy(() -> registry.register(" ", () -> input -> input))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void hostSideFallbackToDefaultKey() {
        registry.register("default", () -> input -> "fallback:" + input);
        Capability<String, String> capability;
        try {
            capability = registry.create("exotic");
        } catch (UnknownKeyException e) {
            capability = registry.create("default");
        }
        assertThat(capability.perform("x")).isEqualTo("fallback:x");
    }
}
