// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.trellis.extension.handler;

import org.trellis.extension.DependencyCycleException;
import org.trellis.extension.EnablingExtensionException;
import org.trellis.extension.ExtensionDescriptor;
import org.trellis.extension.PackageMetadata;
import org.trellis.extension.RegistrationRecord;
import org.trellis.extension.Route;
import org.trellis.extension.RouteSet;
import org.trellis.extension.UnknownExtensionException;
import org.trellis.extension.spi.Extension;
import org.trellis.extension.spi.ExtensionContext;
import org.trellis.extension.spi.ExtensionFactory;
import org.trellis.extension.spi.HookPointRegistry;
import org.trellis.extension.spi.TemplateHook;

import com.google.common.util.concurrent.Uninterruptibles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Unit tests for {@link ExtensionManager}.
 */
@DisplayName("ExtensionManager Unit Tests")
public class ExtensionManagerTest {

    @TempDir
    Path tempDir;

    @Mock
    private ExtensionListener listener;

    private AutoCloseable mocks;
    private Path staticRoot;
    private ExtensionManagerConfig config;
    private StaticDiscoverySource source;
    private InMemoryRegistrationStore store;
    private RouteTable routes;
    private ActiveComponentList components;
    private TemplateTagLibraryCache tagCache;
    private HookPointRegistry hookPoints;
    private ExtensionManagerDirectory directory;
    private ExtensionManager manager;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        staticRoot = tempDir.resolve("static");
        config = ExtensionManagerConfig.builder()
                .key("trellis.test")
                .staticRoot(staticRoot)
                .addInstalledComponent("trellis.core")
                .build();
        source = new StaticDiscoverySource();
        store = new InMemoryRegistrationStore();
        routes = new RouteTable();
        components = new ActiveComponentList(config.getInstalledComponents());
        tagCache = new TemplateTagLibraryCache(components);
        hookPoints = new HookPointRegistry();
        directory = new ExtensionManagerDirectory();
        manager = newManager(SchemaMigrator.NOOP);
        manager.addListener(listener);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private ExtensionManager newManager(SchemaMigrator migrator) {
        return ExtensionManager.builder(config)
                .discoverySource(source)
                .registrationStore(store)
                .routeRegistrar(routes)
                .componentDirectory(components)
                .templateTagCache(tagCache)
                .schemaMigrator(migrator)
                .hookPoints(hookPoints)
                .directory(directory)
                .build();
    }

    private TestFactory register(TestFactory factory) throws IOException {
        Path assets = tempDir.resolve("packages").resolve(factory.name()).resolve("htdocs");
        Files.createDirectories(assets.resolve("js"));
        Files.write(assets.resolve("js").resolve("app.js"), "init();".getBytes(StandardCharsets.UTF_8));
        source.add(new DiscoveredExtension(factory, PackageMetadata.of(factory.name(), "1.0"), assets));
        return factory;
    }

    private Path installedAssets(String id) {
        return staticRoot.resolve(id);
    }

    private RegistrationRecord record(String id) {
        return store.findById(id).orElseThrow(AssertionError::new);
    }

    // ==================== Enable Tests ====================

    @Nested
    @DisplayName("Enable Tests")
    class EnableTests {

        @Test
        @DisplayName("UT-HANDLER-EM-001: Enable installs assets, activates component and notifies")
        void testEnable_InstallsAndInitializes() throws Exception {
            // Given
            TestFactory factory = register(new TestFactory("audit"));
            manager.discover();
            long invalidations = tagCache.getInvalidationCount();

            // When
            Extension instance = manager.enable("audit");

            // Then
            Assertions.assertTrue(manager.isEnabled("audit"));
            Assertions.assertSame(instance, manager.getEnabledExtension("audit").get());
            Assertions.assertTrue(Files.isRegularFile(installedAssets("audit").resolve("js").resolve("app.js")));
            Assertions.assertTrue(record("audit").isInstalled());
            Assertions.assertTrue(record("audit").isEnabled());
            Assertions.assertTrue(manager.getInstalledExtension("audit").isEnabled());
            Assertions.assertTrue(components.contains("audit"));
            Assertions.assertTrue(tagCache.getLibraries().contains("audit.templatetags"));
            Assertions.assertTrue(tagCache.getInvalidationCount() > invalidations);
            Assertions.assertEquals(1, TemplateHook.byName(hookPoints, "navigation").size());
            Assertions.assertSame(manager, instance.getHost());
            Assertions.assertEquals(1, factory.created.size());
            Mockito.verify(listener).extensionInitialized(instance);
        }

        @Test
        @DisplayName("UT-HANDLER-EM-002: Enabling twice returns the live instance without side effects")
        void testEnable_Idempotent() throws Exception {
            // Given
            TestFactory factory = register(new TestFactory("audit")
                    .configurable(RouteSet.of(new Route("", "settings"))));
            manager.discover();
            Extension first = manager.enable("audit");

            // When
            Extension second = manager.enable("audit");

            // Then
            Assertions.assertSame(first, second);
            Assertions.assertEquals(1, factory.created.size());
            Assertions.assertEquals(1, routes.size());
            Mockito.verify(listener, Mockito.times(1)).extensionInitialized(Mockito.any());
        }

        @Test
        @DisplayName("UT-HANDLER-EM-003: Enabling an undiscovered id fails")
        void testEnable_Unknown() {
            // When
            UnknownExtensionException e = Assertions.assertThrows(UnknownExtensionException.class,
                    () -> manager.enable("missing"));

            // Then
            Assertions.assertEquals("missing", e.getExtensionId());
            Mockito.verifyNoInteractions(listener);
        }

        @Test
        @DisplayName("UT-HANDLER-EM-004: Requirements are enabled and notified first")
        void testEnable_RequirementsFirst() throws Exception {
            // Given
            register(new TestFactory("base"));
            register(new TestFactory("reports", "base"));
            manager.discover();

            // When
            Extension reports = manager.enable("reports");

            // Then
            Extension base = manager.getEnabledExtension("base").orElseThrow(AssertionError::new);
            InOrder inOrder = Mockito.inOrder(listener);
            inOrder.verify(listener).extensionInitialized(base);
            inOrder.verify(listener).extensionInitialized(reports);
            Assertions.assertEquals(Arrays.asList(base, reports), new ArrayList<>(manager.getEnabledExtensions()));
            Assertions.assertEquals(Collections.singletonList(base.getDescriptor()),
                    reports.getDescriptor().getResolvedRequirements());
        }

        @Test
        @DisplayName("UT-HANDLER-EM-005: Undiscovered requirement fails naming the missing id")
        void testEnable_UnknownRequirement() throws Exception {
            // Given
            register(new TestFactory("reports", "base"));
            manager.discover();

            // When
            UnknownExtensionException e = Assertions.assertThrows(UnknownExtensionException.class,
                    () -> manager.enable("reports"));

            // Then
            Assertions.assertEquals("base", e.getExtensionId());
            Assertions.assertFalse(manager.isEnabled("reports"));
            Assertions.assertFalse(record("reports").isEnabled());
        }

        @Test
        @DisplayName("UT-HANDLER-EM-006: Requirement cycle is rejected before any side effect")
        void testEnable_Cycle() throws Exception {
            // Given
            register(new TestFactory("a", "b"));
            register(new TestFactory("b", "a"));
            manager.discover();

            // When
            DependencyCycleException e = Assertions.assertThrows(DependencyCycleException.class,
                    () -> manager.enable("a"));

            // Then
            Assertions.assertEquals(Arrays.asList("a", "b", "a"), e.getCycle());
            Assertions.assertTrue(manager.getEnabledExtensions().isEmpty());
            Assertions.assertFalse(record("a").isInstalled());
            Assertions.assertFalse(record("b").isInstalled());
            Assertions.assertFalse(Files.exists(installedAssets("a")));
            Mockito.verifyNoInteractions(listener);
        }

        @Test
        @DisplayName("UT-HANDLER-EM-007: Configurable extension gets admin routes under its prefix")
        void testEnable_AdminRoutes() throws Exception {
            // Given
            register(new TestFactory("audit").configurable(RouteSet.of(new Route("", "settings"))));
            register(new TestFactory("plain").withRoutes(RouteSet.of(new Route("", "ignored"))));
            manager.discover();

            // When
            manager.enable("audit");
            manager.enable("plain");

            // Then
            Assertions.assertEquals(1, routes.size());
            Route installed = routes.getRoutes().get(0);
            Assertions.assertEquals("/admin/extensions/audit/config/", installed.getPattern());
            Assertions.assertEquals("settings", routes.resolve("/admin/extensions/audit/config/").get().getTarget());
            Assertions.assertEquals("/admin/extensions/", manager.getAdminUrl());
        }

        @Test
        @DisplayName("UT-HANDLER-EM-008: Settings saved by the extension persist in its record")
        void testEnable_SettingsPersist() throws Exception {
            // Given
            register(new TestFactory("audit"));
            manager.discover();
            Extension instance = manager.enable("audit");

            // When
            instance.getSettings().set("retention_days", 30);
            instance.getSettings().save();

            // Then
            Assertions.assertTrue(record("audit").getSettings().contains("retention_days"));
            Assertions.assertEquals(30, instance.getSettings().getInt("retention_days", 0));
        }
    }

    // ==================== Install Failure Tests ====================

    @Nested
    @DisplayName("Install Failure Tests")
    class InstallFailureTests {

        @Test
        @DisplayName("UT-HANDLER-EM-009: Asset copy failure aborts enable without notification")
        void testEnable_AssetCopyFails() throws Exception {
            // Given
            TestFactory factory = new TestFactory("audit");
            source.add(new DiscoveredExtension(factory, PackageMetadata.of("audit", "1.0"),
                    tempDir.resolve("no-such-htdocs")));
            manager.discover();

            // When
            EnablingExtensionException e = Assertions.assertThrows(EnablingExtensionException.class,
                    () -> manager.enable("audit"));

            // Then
            Assertions.assertTrue(e.isInstallFailure());
            Assertions.assertFalse(record("audit").isInstalled());
            Assertions.assertFalse(record("audit").isEnabled());
            Assertions.assertFalse(manager.isEnabled("audit"));
            Assertions.assertTrue(factory.created.isEmpty());
            Assertions.assertFalse(Files.exists(installedAssets("audit")));
            Mockito.verifyNoInteractions(listener);
        }

        @Test
        @DisplayName("UT-HANDLER-EM-010: Migration failure removes assets and the temporary component")
        void testEnable_MigrationFails() throws Exception {
            // Given
            List<Boolean> componentVisible = new ArrayList<>();
            ExtensionManager failing = newManager(descriptor -> {
                componentVisible.add(components.contains(descriptor.getComponentName()));
                throw new MigrationException("column exists");
            });
            failing.addListener(listener);
            register(new TestFactory("audit"));
            failing.discover();

            // When
            EnablingExtensionException e = Assertions.assertThrows(EnablingExtensionException.class,
                    () -> failing.enable("audit"));

            // Then
            Assertions.assertTrue(e.isInstallFailure());
            Assertions.assertEquals(Collections.singletonList(true), componentVisible);
            Assertions.assertFalse(components.contains("audit"));
            Assertions.assertFalse(Files.exists(installedAssets("audit")));
            Assertions.assertFalse(record("audit").isInstalled());
            Mockito.verifyNoInteractions(listener);
        }

        @Test
        @DisplayName("UT-HANDLER-EM-011: Schema migration runs only on first install")
        void testEnable_MigratesOnce() throws Exception {
            // Given
            AtomicInteger migrations = new AtomicInteger();
            ExtensionManager counting = newManager(descriptor -> migrations.incrementAndGet());
            register(new TestFactory("audit"));
            counting.discover();

            // When
            counting.enable("audit");
            counting.disable("audit");
            counting.enable("audit");

            // Then
            Assertions.assertEquals(1, migrations.get());
            Assertions.assertTrue(Files.isDirectory(installedAssets("audit")), "Assets placed again on re-enable");
        }

        @Test
        @DisplayName("UT-HANDLER-EM-012: Initialization failure drains hooks and resets the record")
        void testEnable_InitializeFails() throws Exception {
            // Given
            TestFactory factory = register(new TestFactory("audit").failOnInitialize());
            manager.discover();

            // When
            EnablingExtensionException e = Assertions.assertThrows(EnablingExtensionException.class,
                    () -> manager.enable("audit"));

            // Then
            Assertions.assertFalse(e.isInstallFailure());
            Assertions.assertTrue(factory.created.get(0).isShutdown());
            Assertions.assertTrue(TemplateHook.byName(hookPoints, "navigation").isEmpty());
            Assertions.assertFalse(record("audit").isEnabled());
            Assertions.assertTrue(record("audit").isInstalled());
            Assertions.assertFalse(Files.exists(installedAssets("audit")));
            Assertions.assertFalse(components.contains("audit"));
            Mockito.verifyNoInteractions(listener);
        }
    }

    // ==================== Disable Tests ====================

    @Nested
    @DisplayName("Disable Tests")
    class DisableTests {

        @Test
        @DisplayName("UT-HANDLER-EM-013: Disable undoes what enable did and keeps installed")
        void testDisable_UndoesEnable() throws Exception {
            // Given
            register(new TestFactory("audit").configurable(RouteSet.of(new Route("", "settings"))));
            manager.discover();
            Extension instance = manager.enable("audit");

            // When
            manager.disable("audit");

            // Then
            Assertions.assertFalse(manager.isEnabled("audit"));
            Assertions.assertTrue(instance.isShutdown());
            Assertions.assertTrue(TemplateHook.byName(hookPoints, "navigation").isEmpty());
            Assertions.assertEquals(0, routes.size());
            Assertions.assertFalse(components.contains("audit"));
            Assertions.assertTrue(components.contains("trellis.core"));
            Assertions.assertFalse(Files.exists(installedAssets("audit")));
            Assertions.assertFalse(record("audit").isEnabled());
            Assertions.assertTrue(record("audit").isInstalled());
            Assertions.assertFalse(manager.getInstalledExtension("audit").isEnabled());
            Mockito.verify(listener).extensionUninitialized(instance);
        }

        @Test
        @DisplayName("UT-HANDLER-EM-014: Disabling a known but disabled id does nothing")
        void testDisable_NotEnabled() throws Exception {
            // Given
            register(new TestFactory("audit"));
            manager.discover();

            // When
            manager.disable("audit");

            // Then
            Assertions.assertFalse(record("audit").isEnabled());
            Mockito.verify(listener, Mockito.never()).extensionUninitialized(Mockito.any());
        }

        @Test
        @DisplayName("UT-HANDLER-EM-015: Disabling an unknown id fails")
        void testDisable_Unknown() {
            Assertions.assertThrows(UnknownExtensionException.class, () -> manager.disable("missing"));
        }

        @Test
        @DisplayName("UT-HANDLER-EM-016: Dependents are disabled and notified first")
        void testDisable_DependentsFirst() throws Exception {
            // Given
            register(new TestFactory("base"));
            register(new TestFactory("reports", "base"));
            register(new TestFactory("unrelated"));
            manager.discover();
            Extension reports = manager.enable("reports");
            Extension base = manager.getEnabledExtension("base").get();
            manager.enable("unrelated");

            // When
            manager.disable("base");

            // Then
            InOrder inOrder = Mockito.inOrder(listener);
            inOrder.verify(listener).extensionUninitialized(reports);
            inOrder.verify(listener).extensionUninitialized(base);
            Assertions.assertFalse(manager.isEnabled("reports"));
            Assertions.assertFalse(record("reports").isEnabled());
            Assertions.assertTrue(manager.isEnabled("unrelated"));
            Assertions.assertEquals(Collections.singletonList("reports"), manager.getDependents("base"));
        }

        @Test
        @DisplayName("UT-HANDLER-EM-017: Failing listener does not undo the transition")
        void testListenerFailure() throws Exception {
            // Given
            ExtensionListener failing = Mockito.mock(ExtensionListener.class);
            Mockito.doThrow(new IllegalStateException("listener broke"))
                    .when(failing).extensionInitialized(Mockito.any());
            manager.removeListener(listener);
            manager.addListener(failing);
            manager.addListener(listener);
            register(new TestFactory("audit"));
            manager.discover();

            // When
            Extension instance = manager.enable("audit");

            // Then
            Assertions.assertTrue(manager.isEnabled("audit"));
            Assertions.assertTrue(record("audit").isEnabled());
            Mockito.verify(listener).extensionInitialized(instance);
        }

        @Test
        @DisplayName("UT-HANDLER-EM-018: Dependents of an unknown id cannot be listed")
        void testGetDependents_Unknown() {
            Assertions.assertThrows(UnknownExtensionException.class, () -> manager.getDependents("missing"));
        }
    }

    // ==================== Discovery Tests ====================

    @Nested
    @DisplayName("Discovery Tests")
    class DiscoveryTests {

        @Test
        @DisplayName("UT-HANDLER-EM-019: Discovery creates one registration per package")
        void testDiscover_CreatesRecords() throws Exception {
            // Given
            register(new TestFactory("audit"));
            register(new TestFactory("reports"));

            // When
            DiscoveryResult first = manager.discover();
            DiscoveryResult second = manager.discover();

            // Then
            Assertions.assertEquals(Arrays.asList("audit", "reports"), first.getAdded());
            Assertions.assertFalse(second.hasChanges());
            Assertions.assertEquals(2, store.findAll().size());
            Assertions.assertEquals("audit", record("audit").getName());
            Assertions.assertFalse(record("audit").isInstalled());
            Assertions.assertEquals(2, manager.getInstalledExtensions().size());
            Assertions.assertTrue(manager.getEnabledExtensions().isEmpty());
        }

        @Test
        @DisplayName("UT-HANDLER-EM-020: Packages recorded as enabled come back on discovery")
        void testDiscover_RestoresEnabled() throws Exception {
            // Given
            AtomicInteger migrations = new AtomicInteger();
            RegistrationRecord existing = store.create("audit", "Audit Trail");
            existing.setInstalled(true);
            existing.setEnabled(true);
            ExtensionManager restarted = newManager(descriptor -> migrations.incrementAndGet());
            restarted.addListener(listener);
            register(new TestFactory("audit"));

            // When
            DiscoveryResult result = restarted.discover();

            // Then
            Assertions.assertTrue(result.getFailed().isEmpty());
            Assertions.assertTrue(restarted.isEnabled("audit"));
            Assertions.assertEquals(0, migrations.get());
            Assertions.assertEquals("Audit Trail", record("audit").getName());
            Assertions.assertTrue(restarted.getInstalledExtension("audit").isInstalled());
            Mockito.verify(listener).extensionInitialized(restarted.getEnabledExtension("audit").get());
        }

        @Test
        @DisplayName("UT-HANDLER-EM-021: Vanished package is disabled and forgotten")
        void testDiscover_Vanished() throws Exception {
            // Given
            register(new TestFactory("audit"));
            manager.discover();
            Extension instance = manager.enable("audit");
            source.remove("audit");

            // When
            DiscoveryResult result = manager.discover();

            // Then
            Assertions.assertEquals(Collections.singletonList("audit"), result.getRemoved());
            Assertions.assertTrue(instance.isShutdown());
            Mockito.verify(listener).extensionUninitialized(instance);
            Assertions.assertThrows(UnknownExtensionException.class, () -> manager.enable("audit"));
            Assertions.assertThrows(UnknownExtensionException.class, () -> manager.getInstalledExtension("audit"));
            Assertions.assertTrue(store.findById("audit").isPresent(), "Registration is never deleted");
        }

        @Test
        @DisplayName("UT-HANDLER-EM-022: Rediscovery keeps the descriptor of an unchanged version")
        void testDiscover_ReusesDescriptor() throws Exception {
            // Given
            TestFactory factory = register(new TestFactory("audit"));
            manager.discover();
            ExtensionDescriptor original = manager.getInstalledExtension("audit");

            // When
            manager.discover();
            ExtensionDescriptor same = manager.getInstalledExtension("audit");
            source.add(new DiscoveredExtension(factory, PackageMetadata.of("audit", "2.0"), null));
            manager.discover();
            ExtensionDescriptor upgraded = manager.getInstalledExtension("audit");

            // Then
            Assertions.assertSame(original, same);
            Assertions.assertNotSame(original, upgraded);
            Assertions.assertEquals("2.0", upgraded.getVersion());
        }

        @Test
        @DisplayName("UT-HANDLER-EM-023: Failing package is reported while others load")
        void testDiscover_FailingPackage() throws Exception {
            // Given
            store.create("broken", "broken").setEnabled(true);
            register(new TestFactory("broken").failOnInitialize());
            register(new TestFactory("audit"));

            // When
            DiscoveryResult result = manager.discover();

            // Then
            Assertions.assertEquals(Collections.singletonList("broken"), result.getFailed());
            Assertions.assertTrue(result.getAdded().contains("audit"));
            Assertions.assertFalse(manager.isEnabled("broken"));
            Assertions.assertFalse(record("broken").isEnabled());
        }

        @Test
        @DisplayName("UT-HANDLER-EM-026: Package name reaching outside the static root is rejected")
        void testDiscover_AssetPathOutsideStaticRoot() throws Exception {
            // Given
            Path kept = Files.createDirectories(staticRoot.resolve("other")).resolve("keep.css");
            Files.write(kept, "body {}".getBytes(StandardCharsets.UTF_8));
            Path hostFile = tempDir.resolve("host.conf");
            Files.write(hostFile, "port=80".getBytes(StandardCharsets.UTF_8));
            String absolute = tempDir.resolve("elsewhere").toAbsolutePath().toString();
            source.add(new DiscoveredExtension(new TestFactory("parent"), PackageMetadata.of("..", "1.0"), null));
            source.add(new DiscoveredExtension(new TestFactory("nested"), PackageMetadata.of("a/../..", "1.0"), null));
            source.add(new DiscoveredExtension(new TestFactory("absolute"), PackageMetadata.of(absolute, "1.0"), null));
            source.add(new DiscoveredExtension(new TestFactory("deep"), PackageMetadata.of("a/b", "1.0"), null));
            register(new TestFactory("audit"));

            // When
            DiscoveryResult result = manager.discover();

            // Then
            Assertions.assertEquals(Arrays.asList("parent", "nested", "absolute", "deep"), result.getFailed());
            Assertions.assertEquals(Collections.singletonList("audit"), result.getAdded());
            Assertions.assertThrows(UnknownExtensionException.class, () -> manager.enable("parent"));
            Assertions.assertThrows(UnknownExtensionException.class, () -> manager.enable("absolute"));
            manager.enable("audit");
            manager.disable("audit");
            Assertions.assertTrue(Files.isRegularFile(kept));
            Assertions.assertTrue(Files.isRegularFile(hostFile));
            Assertions.assertEquals(staticRoot.resolve("audit"), manager.getInstalledExtension("audit").getStaticAssetPath());
        }
    }

    // ==================== Shutdown Tests ====================

    @Nested
    @DisplayName("Shutdown Tests")
    class ShutdownTests {

        @Test
        @DisplayName("UT-HANDLER-EM-024: Shutdown stops dependents first and keeps records enabled")
        void testShutdown() throws Exception {
            // Given
            register(new TestFactory("base"));
            register(new TestFactory("reports", "base"));
            manager.discover();
            Extension reports = manager.enable("reports");
            Extension base = manager.getEnabledExtension("base").get();

            // When
            manager.shutdown();

            // Then
            InOrder inOrder = Mockito.inOrder(listener);
            inOrder.verify(listener).extensionUninitialized(reports);
            inOrder.verify(listener).extensionUninitialized(base);
            Assertions.assertTrue(manager.getEnabledExtensions().isEmpty());
            Assertions.assertTrue(record("base").isEnabled());
            Assertions.assertTrue(record("reports").isEnabled());
        }

        @Test
        @DisplayName("UT-HANDLER-EM-025: Manager registers itself in its directory")
        void testDirectoryRegistration() {
            // When
            ExtensionManager second = newManager(SchemaMigrator.NOOP);

            // Then
            Assertions.assertEquals(Arrays.asList(manager, second), directory.getManagers());
            Assertions.assertEquals("trellis.test", second.getKey());
        }
    }

    // ==================== Concurrency Tests ====================

    @Nested
    @DisplayName("Concurrency Tests")
    class ConcurrencyTests {

        @Test
        @DisplayName("UT-HANDLER-EM-027: Concurrent enable and disable of one id are serialized")
        void testConcurrentEnableDisable() throws Exception {
            // Given
            AtomicInteger migrations = new AtomicInteger();
            AtomicInteger running = new AtomicInteger();
            AtomicInteger overlaps = new AtomicInteger();
            ExtensionManager shared = newManager(descriptor -> {
                if (running.incrementAndGet() > 1) {
                    overlaps.incrementAndGet();
                }
                migrations.incrementAndGet();
                Uninterruptibles.sleepUninterruptibly(50, TimeUnit.MILLISECONDS);
                running.decrementAndGet();
            });
            AtomicInteger initialized = new AtomicInteger();
            AtomicInteger uninitialized = new AtomicInteger();
            shared.addListener(listener);
            shared.addListener(new ExtensionListener() {
                @Override
                public void extensionInitialized(Extension extension) {
                    initialized.incrementAndGet();
                }

                @Override
                public void extensionUninitialized(Extension extension) {
                    uninitialized.incrementAndGet();
                }
            });
            TestFactory factory = register(new TestFactory("audit"));
            shared.discover();

            int threadCount = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            try {
                // When: every thread enables the same id at once
                CountDownLatch startLatch = new CountDownLatch(1);
                List<Future<Extension>> enables = new ArrayList<>();
                for (int i = 0; i < threadCount; i++) {
                    enables.add(executor.submit(() -> {
                        startLatch.await();
                        return shared.enable("audit");
                    }));
                }
                startLatch.countDown();
                Set<Extension> instances = new HashSet<>();
                for (Future<Extension> enable : enables) {
                    instances.add(enable.get(10, TimeUnit.SECONDS));
                }

                // Then
                Assertions.assertEquals(1, instances.size());
                Assertions.assertEquals(1, migrations.get());
                Assertions.assertEquals(1, factory.created.size());
                Mockito.verify(listener, Mockito.times(1)).extensionInitialized(Mockito.any());

                // When: enables and disables interleave
                CountDownLatch mixedLatch = new CountDownLatch(1);
                List<Future<Object>> mixed = new ArrayList<>();
                for (int i = 0; i < threadCount * 2; i++) {
                    boolean enable = i % 2 == 0;
                    mixed.add(executor.submit(() -> {
                        mixedLatch.await();
                        if (enable) {
                            shared.enable("audit");
                        } else {
                            shared.disable("audit");
                        }
                        return null;
                    }));
                }
                mixedLatch.countDown();
                for (Future<Object> operation : mixed) {
                    operation.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            // Then
            long live = factory.created.stream().filter(extension -> !extension.isShutdown()).count();
            boolean enabled = shared.isEnabled("audit");
            Assertions.assertEquals(enabled ? 1 : 0, live);
            Assertions.assertEquals(enabled, record("audit").isEnabled());
            Assertions.assertEquals(factory.created.size(), initialized.get());
            Assertions.assertEquals(initialized.get() - live, uninitialized.get());
            Assertions.assertEquals(1, migrations.get());
            Assertions.assertEquals(0, overlaps.get());
        }
    }

    /**
     * Factory with configurable requirements, routes and failure mode.
     */
    static final class TestFactory implements ExtensionFactory {
        private final String id;
        private final List<String> requirements;
        private boolean configurable;
        private RouteSet adminRoutes = RouteSet.empty();
        private boolean failOnInitialize;
        private final List<TestExtension> created = new ArrayList<>();

        TestFactory(String id, String... requirements) {
            this.id = id;
            this.requirements = Arrays.asList(requirements);
        }

        TestFactory configurable(RouteSet routes) {
            this.configurable = true;
            this.adminRoutes = routes;
            return this;
        }

        TestFactory withRoutes(RouteSet routes) {
            this.adminRoutes = routes;
            return this;
        }

        TestFactory failOnInitialize() {
            this.failOnInitialize = true;
            return this;
        }

        @Override
        public String name() {
            return id;
        }

        @Override
        public List<String> requirements() {
            return requirements;
        }

        @Override
        public boolean isConfigurable() {
            return configurable;
        }

        @Override
        public Extension create(ExtensionContext context) {
            TestExtension extension = new TestExtension(context, this);
            created.add(extension);
            return extension;
        }
    }

    /**
     * Extension that registers one navigation hook on initialize.
     */
    static final class TestExtension extends Extension {
        private final TestFactory factory;

        TestExtension(ExtensionContext context, TestFactory factory) {
            super(context);
            this.factory = factory;
        }

        @Override
        public void initialize() {
            new TemplateHook(this, "navigation", getId() + "/nav.html");
            if (factory.failOnInitialize) {
                throw new IllegalStateException("initialize failed for " + getId());
            }
        }

        @Override
        public RouteSet getAdminRoutes() {
            return factory.adminRoutes;
        }
    }
}
