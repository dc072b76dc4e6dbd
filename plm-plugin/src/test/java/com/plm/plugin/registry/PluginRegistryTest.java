package com.plm.plugin.registry;

import com.plm.common.config.PluginConfig;
import com.plm.plugin.InstallOptions;
import com.plm.plugin.PluginException;
import com.plm.plugin.TestPlugin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PluginRegistryTest {

    PluginRegistry registry;
    TestPlugin alpha;
    List<String> transitions;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistry();
        alpha = new TestPlugin("alpha");
        transitions = new CopyOnWriteArrayList<>();
        registry.addListener((name, from, to) -> transitions.add(name + ":" + from + "->" + to));
    }

    private static PluginException failureOf(CompletableFuture<?> future) {
        CompletionException e = assertThrows(CompletionException.class, future::join);
        PluginException pe = PluginException.unwrap(e);
        assertNotNull(pe, "expected a PluginException but got " + e.getCause());
        return pe;
    }

    private LifecycleOutcome install(String name, String version, InstallOptions options) {
        return registry.install(name, version, options, OperationTrace.disabled()).join();
    }

    @Nested
    class Registration {

        @Test
        void registerUsesMetadataName() {
            PluginEntry entry = registry.register(alpha);

            assertEquals("alpha", entry.getName());
            assertEquals(LifecycleState.REGISTERED, entry.getState());
            assertTrue(registry.contains("alpha"));
            assertEquals(List.of("alpha:UNREGISTERED->REGISTERED"), transitions);
        }

        @Test
        void duplicateNameIsRejected() {
            registry.register(alpha);

            PluginException e = assertThrows(PluginException.class,
                    () -> registry.register(new TestPlugin("alpha")));
            assertEquals(PluginException.Kind.ALREADY_REGISTERED, e.getKind());
            assertEquals(1, registry.size());
        }

        @Test
        void blankNameIsRejected() {
            PluginException e = assertThrows(PluginException.class, () -> registry.register("  ", alpha));
            assertEquals(PluginException.Kind.INVALID_ARGUMENT, e.getKind());
            assertEquals(0, registry.size());
        }

        @Test
        void configMustCarryTheSameName() {
            PluginException e = assertThrows(PluginException.class,
                    () -> registry.register("alpha", alpha, PluginConfig.of("beta", "1.0.0")));
            assertEquals(PluginException.Kind.INVALID_ARGUMENT, e.getKind());
        }

        @Test
        void listsInRegistrationOrder() {
            registry.register(new TestPlugin("zeta"));
            registry.register(alpha);
            registry.register(new TestPlugin("mu"));

            assertEquals(List.of("zeta", "alpha", "mu"),
                    registry.listPlugins().stream().map(PluginSummary::name).toList());
        }

        @Test
        void attachAndDetachConfig() {
            registry.register(alpha);
            PluginConfig config = PluginConfig.of("alpha", "2.0.0");

            registry.attachConfig(config);
            assertSame(config, registry.require("alpha").getConfig());
            assertTrue(registry.describe("alpha").orElseThrow().configured());

            registry.detachConfig("alpha");
            assertNull(registry.require("alpha").getConfig());
        }
    }

    @Nested
    class Transitions {

        @Test
        void fullLifecycleIsObservedInOrder() {
            registry.register(alpha);
            registry.initializeOne("alpha").join();
            LifecycleOutcome installed = install("alpha", "1.0.0", InstallOptions.defaults());
            registry.uninstall("alpha", "1.0.0", InstallOptions.defaults(), OperationTrace.disabled()).join();
            registry.shutdownOne("alpha").join();

            assertEquals("installed:alpha@1.0.0", installed.descriptor());
            assertTrue(installed.applied());
            assertEquals(List.of(
                    "alpha:UNREGISTERED->REGISTERED",
                    "alpha:REGISTERED->INITIALIZED",
                    "alpha:INITIALIZED->INSTALLED",
                    "alpha:INSTALLED->INITIALIZED",
                    "alpha:INITIALIZED->SHUTTING_DOWN",
                    "alpha:SHUTTING_DOWN->SHUTDOWN"), transitions);
            assertEquals(1, alpha.shutdownCalls.get());
        }

        @Test
        void installBeforeInitializeIsInvalidState() {
            registry.register(alpha);

            PluginException e = assertThrows(PluginException.class,
                    () -> registry.install("alpha", "1.0.0", InstallOptions.defaults(), OperationTrace.disabled()));
            assertEquals(PluginException.Kind.INVALID_STATE, e.getKind());
            assertEquals(LifecycleState.REGISTERED, registry.require("alpha").getState());
            assertEquals(0, alpha.installCalls.get());
        }

        @Test
        void secondInstallNeedsForce() {
            registry.register(alpha);
            registry.initializeOne("alpha").join();
            install("alpha", "1.0.0", InstallOptions.defaults());

            PluginException e = assertThrows(PluginException.class,
                    () -> install("alpha", "1.0.1", InstallOptions.defaults()));
            assertEquals(PluginException.Kind.INVALID_STATE, e.getKind());

            LifecycleOutcome forced = install("alpha", "1.0.1", InstallOptions.builder().force(true).build());
            assertEquals(LifecycleState.INSTALLED, forced.previousState());
            assertEquals(LifecycleState.INSTALLED, forced.state());
            assertEquals(2, alpha.installCalls.get());
        }

        @Test
        void uninstallFromInitializedNeedsForce() {
            registry.register(alpha);
            registry.initializeOne("alpha").join();

            PluginException e = assertThrows(PluginException.class, () -> registry.uninstall("alpha", "1.0.0",
                    InstallOptions.defaults(), OperationTrace.disabled()));
            assertEquals(PluginException.Kind.INVALID_STATE, e.getKind());

            LifecycleOutcome forced = registry.uninstall("alpha", "1.0.0",
                    InstallOptions.builder().force(true).build(), OperationTrace.disabled()).join();
            assertEquals(LifecycleState.INITIALIZED, forced.state());
            assertEquals(1, alpha.uninstallCalls.get());
        }

        @Test
        void malformedVersionIsRejectedBeforeTheHook() {
            registry.register(alpha);
            registry.initializeOne("alpha").join();

            PluginException e = assertThrows(PluginException.class,
                    () -> install("alpha", "latest", InstallOptions.defaults()));
            assertEquals(PluginException.Kind.INVALID_ARGUMENT, e.getKind());
            assertEquals(0, alpha.installCalls.get());
        }

        @Test
        void unknownPluginIsNotFound() {
            PluginException e = assertThrows(PluginException.class, () -> registry.initializeOne("ghost"));
            assertEquals(PluginException.Kind.NOT_FOUND, e.getKind());
        }

        @Test
        void dryRunLeavesEverythingAlone() {
            registry.register(alpha);
            registry.initializeOne("alpha").join();
            transitions.clear();

            LifecycleOutcome outcome = install("alpha", "1.0.0", InstallOptions.builder().dryRun(true).build());

            assertFalse(outcome.applied());
            assertEquals("dry-run:alpha@1.0.0", outcome.descriptor());
            assertEquals(LifecycleState.INITIALIZED, registry.require("alpha").getState());
            assertEquals(0, alpha.installCalls.get());
            assertTrue(transitions.isEmpty());
        }
    }

    @Nested
    class HookFailures {

        @Test
        void failedInitializeStaysRegisteredAndCanBeRetried() {
            registry.register(alpha);
            alpha.failOn("initialize");

            PluginException e = failureOf(registry.initializeOne("alpha"));
            assertEquals(PluginException.Kind.INITIALIZATION_FAILED, e.getKind());
            assertEquals("alpha", e.getPluginName());
            PluginEntry entry = registry.require("alpha");
            assertEquals(LifecycleState.REGISTERED, entry.getState());
            assertNotNull(entry.getLastError());

            alpha.recover("initialize");
            registry.initializeOne("alpha").join();
            assertEquals(LifecycleState.INITIALIZED, entry.getState());
            assertNull(entry.getLastError());
        }

        @Test
        void installHookThrowingSynchronouslyRollsBack() {
            registry.register(alpha);
            registry.initializeOne("alpha").join();
            alpha.throwOn("install");

            PluginException e = failureOf(registry.install("alpha", "1.0.0",
                    InstallOptions.defaults(), OperationTrace.disabled()));
            assertEquals(PluginException.Kind.INSTALL_FAILED, e.getKind());
            assertEquals(LifecycleState.INITIALIZED, registry.require("alpha").getState());
        }

        @Test
        void failedShutdownRollsBackAndKeepsEntry() {
            registry.register(alpha);
            registry.initializeOne("alpha").join();
            install("alpha", "1.0.0", InstallOptions.defaults());
            alpha.failOn("shutdown");
            transitions.clear();

            PluginException e = failureOf(registry.shutdownOne("alpha"));

            assertEquals(PluginException.Kind.SHUTDOWN_FAILED, e.getKind());
            assertTrue(registry.contains("alpha"));
            assertEquals(LifecycleState.INSTALLED, registry.require("alpha").getState());
            assertEquals(List.of("alpha:INSTALLED->SHUTTING_DOWN", "alpha:SHUTTING_DOWN->INSTALLED"), transitions);
        }

        @Test
        void failingListenerDoesNotBreakTheTransition() {
            registry.addListener((name, from, to) -> {
                throw new IllegalStateException("listener bug");
            });
            registry.register(alpha);

            registry.initializeOne("alpha").join();

            assertEquals(LifecycleState.INITIALIZED, registry.require("alpha").getState());
        }
    }

    @Nested
    class Shutdown {

        @Test
        void shutdownRetiresEntryAndAllowsReRegistration() {
            registry.register(alpha);
            registry.initializeOne("alpha").join();
            registry.shutdownOne("alpha").join();

            assertFalse(registry.contains("alpha"));
            assertEquals(LifecycleState.SHUTDOWN, registry.describe("alpha").orElseThrow().state());
            assertEquals(1, registry.listRetired().size());

            PluginException e = assertThrows(PluginException.class, () -> registry.initializeOne("alpha"));
            assertEquals(PluginException.Kind.NOT_FOUND, e.getKind());

            registry.register(new TestPlugin("alpha"));
            assertEquals(LifecycleState.REGISTERED, registry.describe("alpha").orElseThrow().state());
            assertTrue(registry.listRetired().isEmpty());
        }

        @Test
        void registeredEntryIsUnregisteredWithoutHook() {
            registry.register(alpha);

            LifecycleOutcome outcome = registry.unregister("alpha").join();

            assertEquals(LifecycleState.UNREGISTERED, outcome.state());
            assertEquals(0, alpha.shutdownCalls.get());
            assertFalse(registry.contains("alpha"));
        }

        @Test
        void busyPluginDoesNotHoldUpOthers() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            TestPlugin busy = new TestPlugin("busy").async("install", () -> {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            TestPlugin idle = new TestPlugin("idle");
            registry.register(busy);
            registry.register(idle);
            registry.initializeOne("busy").join();
            registry.initializeOne("idle").join();
            CompletableFuture<LifecycleOutcome> installing = registry.install("busy", "1.0.0",
                    InstallOptions.defaults(), OperationTrace.disabled());

            CompletableFuture<BatchReport> all = registry.shutdownAll();

            assertEquals(1, idle.shutdownCalls.get());
            assertFalse(registry.contains("idle"));
            assertEquals(0, busy.shutdownCalls.get());
            assertFalse(all.isDone());

            release.countDown();
            assertEquals(LifecycleState.INSTALLED, installing.get(5, TimeUnit.SECONDS).state());
            BatchReport report = all.get(5, TimeUnit.SECONDS);
            assertTrue(report.isSuccess());
            assertEquals(1, busy.shutdownCalls.get());
            assertEquals(0, registry.size());
        }

        @Test
        void queuedOperationTimesOutWithoutBlockingCaller() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            alpha.async("install", () -> {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            registry.register(alpha);
            registry.initializeOne("alpha").join();
            registry.setPermitTimeout(Duration.ofMillis(100));
            CompletableFuture<LifecycleOutcome> installing = registry.install("alpha", "1.0.0",
                    InstallOptions.defaults(), OperationTrace.disabled());

            CompletableFuture<LifecycleOutcome> queued = registry.shutdownOne("alpha");

            assertFalse(queued.isDone());
            assertEquals(PluginException.Kind.TIMEOUT, failureOf(queued).getKind());
            release.countDown();
            installing.get(5, TimeUnit.SECONDS);
            assertEquals(0, alpha.shutdownCalls.get());
            registry.shutdownOne("alpha").join();
            assertEquals(1, alpha.shutdownCalls.get());
        }

        @Test
        void shutdownAllCollectsFailures() {
            TestPlugin beta = new TestPlugin("beta").failOn("shutdown");
            TestPlugin gamma = new TestPlugin("gamma");
            registry.register(alpha);
            registry.register(beta);
            registry.register(gamma);
            registry.initializeOne("alpha").join();
            registry.initializeOne("beta").join();

            BatchReport report = registry.shutdownAll().join();

            assertFalse(report.isSuccess());
            assertEquals(2, report.outcomes().size());
            assertEquals(1, report.failures().size());
            assertEquals("beta", report.failures().get(0).plugin());
            assertEquals(PluginException.Kind.SHUTDOWN_FAILED, report.failures().get(0).kind());
            assertEquals(1, alpha.shutdownCalls.get());
            assertEquals(0, gamma.shutdownCalls.get());
            assertEquals(List.of("beta"), registry.entries().stream().map(PluginEntry::getName).toList());
        }
    }
}
