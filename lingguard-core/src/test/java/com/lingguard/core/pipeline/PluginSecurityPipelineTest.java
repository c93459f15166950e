package com.lingguard.core.pipeline;

import com.lingguard.api.exception.InvalidArgumentException;
import com.lingguard.api.exception.PermissionDeniedException;
import com.lingguard.api.http.FetchRequest;
import com.lingguard.api.http.FetchResponse;
import com.lingguard.api.manifest.EndpointKind;
import com.lingguard.api.manifest.PluginManifest;
import com.lingguard.api.permission.Permission;
import com.lingguard.api.permission.PluginOperation;
import com.lingguard.api.security.RiskLevel;
import com.lingguard.api.security.SecurityLevel;
import com.lingguard.core.TestManifests;
import com.lingguard.core.config.SecurityConfig;
import com.lingguard.core.event.EventBus;
import com.lingguard.core.event.monitor.SecurityEvents.PluginDetectedEvent;
import com.lingguard.core.event.monitor.SecurityEvents.PluginRegisteredEvent;
import com.lingguard.core.event.monitor.SecurityEvents.PluginRejectedEvent;
import com.lingguard.core.exception.CallNotPermittedException;
import com.lingguard.core.exception.PluginRegistrationException;
import com.lingguard.core.exception.SandboxViolationException;
import com.lingguard.core.host.InMemoryHost;
import com.lingguard.core.integrity.ContentHasher;
import com.lingguard.core.integrity.IntegrityVerifier;
import com.lingguard.core.permission.PermissionManager;
import com.lingguard.core.sandbox.SandboxExecutor;
import com.lingguard.core.spi.HttpTransport;
import com.lingguard.core.spi.SecurityErrorReporter;
import com.lingguard.core.validation.ConfigValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PluginSecurityPipeline 单元测试")
class PluginSecurityPipelineTest {

    @Mock
    private HttpTransport transport;

    @Mock
    private SecurityErrorReporter errorReporter;

    private InMemoryHost host;
    private EventBus eventBus;
    private PluginSecurityPipeline pipeline;

    private final List<PluginRegisteredEvent> registered = new CopyOnWriteArrayList<>();
    private final List<PluginRejectedEvent> rejected = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        host = new InMemoryHost(transport);
        eventBus = new EventBus();
        eventBus.subscribe("test", PluginRegisteredEvent.class, registered::add);
        eventBus.subscribe("test", PluginRejectedEvent.class, rejected::add);
        pipeline = new PluginSecurityPipeline(SecurityConfig.defaults(), host.toBridge(), errorReporter, eventBus);
    }

    @AfterEach
    void tearDown() {
        pipeline.shutdown();
    }

    private static PluginManifest signedAmazon() {
        return TestManifests.signed(TestManifests.amazonOrders().build());
    }

    private PluginSecurityPipeline pipelineWith(SecurityConfig config, ContentHasher hasher, PluginScorer scorer) {
        return new PluginSecurityPipeline(config,
                new ConfigValidator(config),
                new IntegrityVerifier(config, hasher, errorReporter, eventBus),
                new PermissionManager(config, host.toBridge()),
                new SandboxExecutor(config, errorReporter, eventBus, transport),
                errorReporter,
                eventBus,
                scorer);
    }

    @Nested
    @DisplayName("注册")
    class RegisterTests {

        @Test
        @DisplayName("签名清单应注册成功并按声明授权")
        void signedManifestShouldRegister() {
            RegistrationOutcome outcome = pipeline.register(signedAmazon());

            assertEquals(SecurityLevel.SECURE, outcome.validation().getSecurityLevel());
            assertEquals(100.0, outcome.integrity().getTrustScore());
            assertEquals(RiskLevel.LOW, outcome.integrity().getRiskLevel());
            assertFalse(outcome.replaced());
            assertTrue(pipeline.getPermissionManager().has("amz-1", Permission.NETWORK_ACCESS));
            assertTrue(pipeline.getPermissionManager().has("amz-1", Permission.NOTIFICATIONS));
            assertEquals(1, registered.size());
            assertTrue(pipeline.find("amz-1").isPresent());
        }

        @Test
        @DisplayName("危险文件类型在校验阶段被拒绝")
        void dangerousFileTypeShouldBeRejected() {
            PluginManifest manifest = TestManifests.signed(
                    TestManifests.amazonOrders().clearFileTypes().fileType("exe").build());

            PluginRegistrationException error = assertThrows(PluginRegistrationException.class,
                    () -> pipeline.register(manifest));

            assertEquals(SecurityLevel.CRITICAL, error.getValidation().getSecurityLevel());
            assertNull(error.getIntegrity());
            assertEquals(1, rejected.size());
            assertTrue(pipeline.list().isEmpty());
            verify(errorReporter).report(eq(error), eq("Plugin Registration Rejected"), anyMap());
        }

        @Test
        @DisplayName("未签名清单在完整性阶段被拒绝")
        void unsignedManifestShouldBeRejected() {
            PluginRegistrationException error = assertThrows(PluginRegistrationException.class,
                    () -> pipeline.register(TestManifests.amazonOrders().build()));

            assertNotNull(error.getIntegrity());
            assertFalse(error.getIntegrity().isValid());
            assertEquals(SecurityLevel.SECURE, error.getValidation().getSecurityLevel());
            assertFalse(pipeline.getPermissionManager().has("amz-1", Permission.NETWORK_ACCESS));
        }

        @Test
        @DisplayName("重复 id 应替换已有清单")
        void duplicateIdShouldReplace() {
            pipeline.register(signedAmazon());

            RegistrationOutcome second = pipeline.register(
                    TestManifests.signed(TestManifests.amazonOrders().name("Amazon Orders v2").build()));

            assertTrue(second.replaced());
            assertEquals(1, pipeline.list().size());
            assertEquals("Amazon Orders v2", pipeline.find("amz-1").orElseThrow().getName());
        }

        @Test
        @DisplayName("达到注册上限后拒绝新插件")
        void shouldEnforceMaxPlugins() {
            PluginSecurityPipeline small = new PluginSecurityPipeline(
                    SecurityConfig.defaults().toBuilder().maxPlugins(1).build(),
                    host.toBridge(), errorReporter, eventBus);
            try {
                small.register(signedAmazon());

                assertThrows(PluginRegistrationException.class, () -> small.register(
                        TestManifests.signed(TestManifests.amazonOrders().id("ebay-1").build())));
            } finally {
                small.shutdown();
            }
        }

        @Test
        @DisplayName("并发注册不同插件时不能突破注册上限")
        void concurrentRegistrationShouldRespectMaxPlugins() throws Exception {
            PluginSecurityPipeline small = new PluginSecurityPipeline(
                    SecurityConfig.defaults().toBuilder().maxPlugins(1).build(),
                    host.toBridge(), errorReporter, eventBus);
            int threads = 16;
            List<PluginManifest> manifests = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                manifests.add(TestManifests.signed(TestManifests.amazonOrders().id("shop-" + i).build()));
            }
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger accepted = new AtomicInteger();
            AtomicInteger refused = new AtomicInteger();
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (PluginManifest manifest : manifests) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        try {
                            small.register(manifest);
                            accepted.incrementAndGet();
                        } catch (PluginRegistrationException e) {
                            refused.incrementAndGet();
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }

                assertEquals(1, accepted.get());
                assertEquals(threads - 1, refused.get());
                assertEquals(1, small.list().size());
                String winner = small.list().get(0).getId();
                manifests.stream()
                        .map(PluginManifest::getId)
                        .filter(id -> !id.equals(winner))
                        .forEach(id -> assertFalse(small.getPermissionManager().has(id, Permission.NETWORK_ACCESS)));
            } finally {
                pool.shutdownNow();
                small.shutdown();
            }
        }

        @Test
        @DisplayName("来源元数据检查结果随注册结论返回，不阻断注册")
        void provenanceShouldBeAdvisory() {
            RegistrationOutcome signedOutcome = pipeline.register(signedAmazon());
            assertTrue(signedOutcome.provenance().getErrors().isEmpty());

            PluginManifest httpStatus = TestManifests.signed(TestManifests.amazonOrders()
                    .id("ebay-1")
                    .endpoint(EndpointKind.STATUS, "http://status.example/ping")
                    .build());
            RegistrationOutcome httpOutcome = pipeline.register(httpStatus);

            assertTrue(httpOutcome.provenance().getWarnings().stream()
                    .anyMatch(w -> w.contains("HTTP endpoints")));
            assertTrue(pipeline.find("ebay-1").isPresent());
        }

        @Test
        @DisplayName("注销应撤销授权并移除监听器")
        void unregisterShouldRevokeEverything() {
            pipeline.register(signedAmazon());
            List<PluginRegisteredEvent> pluginListener = new CopyOnWriteArrayList<>();
            eventBus.subscribe("amz-1", PluginRegisteredEvent.class, pluginListener::add);

            assertTrue(pipeline.unregister("amz-1"));

            assertTrue(pipeline.find("amz-1").isEmpty());
            assertFalse(pipeline.getPermissionManager().has("amz-1", Permission.NETWORK_ACCESS));
            pipeline.register(TestManifests.signed(TestManifests.amazonOrders().id("ebay-1").build()));
            assertTrue(pluginListener.isEmpty());
            assertFalse(pipeline.unregister("amz-1"));
        }

        @Test
        @DisplayName("按扩展名查找应归一化")
        void findByFileTypeShouldNormalize() {
            pipeline.register(signedAmazon());

            assertEquals(1, pipeline.findByFileType(".CSV").size());
            assertTrue(pipeline.findByFileType("pdf").isEmpty());
        }
    }

    @Nested
    @DisplayName("文件检测")
    class DetectTests {

        @Test
        @DisplayName("专用插件优先于通用插件")
        void specificPluginShouldBeatGeneric() {
            pipeline.register(signedAmazon());
            pipeline.register(TestManifests.signed(TestManifests.amazonOrders()
                    .id("generic-tabular")
                    .name("Generic Tabular")
                    .fileType("xlsx")
                    .build()));
            List<PluginDetectedEvent> detected = new CopyOnWriteArrayList<>();
            eventBus.subscribe("test", PluginDetectedEvent.class, detected::add);

            PluginManifest best = pipeline.detectBestPlugin("orders-2024.CSV").orElseThrow();

            assertEquals("amz-1", best.getId());
            assertEquals(1, detected.size());
            assertEquals("amz-1", detected.get(0).getPluginId());
            assertEquals(65, detected.get(0).getScore());
        }

        @Test
        @DisplayName("文件名提示可以压过更高的版本加分")
        void filenameHintShouldWin() {
            pipeline.register(signedAmazon());
            pipeline.register(TestManifests.signed(TestManifests.amazonOrders()
                    .id("ebay-1")
                    .version("2.0.0")
                    .build()));

            assertEquals("ebay-1", pipeline.detectBestPlugin("export.csv").orElseThrow().getId());
            assertEquals("amz-1", pipeline.detectBestPlugin("amz_export.csv").orElseThrow().getId());
        }

        @Test
        @DisplayName("无兼容插件时返回空并发布事件")
        void noCandidateShouldReturnEmpty() {
            pipeline.register(signedAmazon());
            List<PluginDetectedEvent> detected = new CopyOnWriteArrayList<>();
            eventBus.subscribe("test", PluginDetectedEvent.class, detected::add);

            assertTrue(pipeline.detectBestPlugin("report.pdf").isEmpty());
            assertTrue(pipeline.detectBestPlugin(null).isEmpty());

            assertEquals(2, detected.size());
            assertNull(detected.get(0).getPluginId());
        }

        @Test
        @DisplayName("打分出错时上报并返回空")
        void scorerFailureShouldBeReported() {
            PluginSecurityPipeline failing = pipelineWith(SecurityConfig.defaults(), new ContentHasher(),
                    (manifest, filename) -> {
                        throw new IllegalStateException("scorer unavailable");
                    });
            try {
                failing.register(signedAmazon());

                assertTrue(failing.detectBestPlugin("orders.csv").isEmpty());
                verify(errorReporter).report(any(IllegalStateException.class), eq("Plugin Detection"), anyMap());
            } finally {
                failing.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("安全总览")
    class IntegrityInfoTests {

        @Test
        @DisplayName("已注册的签名插件应为 SECURE")
        void registeredPluginShouldBeSecure() {
            pipeline.register(signedAmazon());

            PluginIntegrityInfo info = pipeline.integrityInfo("amz-1");

            assertEquals(PluginIntegrityInfo.OverallStatus.SECURE, info.status());
            assertEquals(SecurityLevel.SECURE, info.validation().getSecurityLevel());
            assertEquals(100.0, info.integrity().getTrustScore());
            assertEquals("amz-1", info.report().pluginId());
            assertEquals("PASS", info.report().overallStatus());
            assertTrue(info.permissions().has(Permission.NETWORK_ACCESS));
        }

        @Test
        @DisplayName("重新验证失败时应为 RISKY")
        void failedReverificationShouldBeRisky() {
            PluginManifest manifest = signedAmazon();
            ContentHasher hasher = mock(ContentHasher.class);
            when(hasher.hash(manifest))
                    .thenReturn(manifest.getContentHash())
                    .thenThrow(new IllegalStateException("digest unavailable"));
            PluginSecurityPipeline flaky = pipelineWith(SecurityConfig.defaults(), hasher, new DefaultPluginScorer());
            try {
                flaky.register(manifest);

                PluginIntegrityInfo info = flaky.integrityInfo("amz-1");

                assertEquals(PluginIntegrityInfo.OverallStatus.RISKY, info.status());
                assertFalse(info.integrity().isValid());
                assertEquals("FAIL", info.report().overallStatus());
            } finally {
                flaky.shutdown();
            }
        }

        @Test
        @DisplayName("未注册插件应抛出异常")
        void unknownPluginShouldThrow() {
            InvalidArgumentException error = assertThrows(InvalidArgumentException.class,
                    () -> pipeline.integrityInfo("ghost"));
            assertEquals("pluginId", error.getParamName());
        }
    }

    @Nested
    @DisplayName("执行")
    class ExecuteTests {

        @Test
        @DisplayName("未注册插件不能执行")
        void unregisteredPluginShouldBeRefused() {
            assertThrows(CallNotPermittedException.class,
                    () -> pipeline.execute("ghost", (context, signal) -> "never"));
        }

        @Test
        @DisplayName("任务通过受限上下文访问宿主能力")
        void taskShouldUseConstrainedContext() {
            pipeline.register(signedAmazon());

            String result = pipeline.execute("amz-1", (context, signal) -> {
                context.showNotification("Imported 3 orders");
                return context.getPluginId();
            });

            assertEquals("amz-1", result);
            assertEquals(List.of("Imported 3 orders"), host.getNotifications());
        }

        @Test
        @DisplayName("缺少能力的操作不会进入沙箱")
        void missingCapabilityShouldFailFast() {
            pipeline.register(signedAmazon());

            PermissionDeniedException error = assertThrows(PermissionDeniedException.class,
                    () -> pipeline.execute("amz-1", PluginOperation.CLIPBOARD_ACCESS,
                            (context, signal) -> context.readClipboard()));

            assertEquals("clipboard", error.getCapability());
            assertEquals(0, pipeline.getSandbox().getActiveOperationCount());
        }

        @Test
        @DisplayName("send 先检查请求内容再发出")
        void sendShouldInspectBeforeFetching() throws Exception {
            pipeline.register(signedAmazon());
            FetchRequest clean = FetchRequest.get("https://good.example/status");
            FetchResponse ok = new FetchResponse(200, "{}", Map.of());
            when(transport.send(eq(clean), any(Duration.class))).thenReturn(ok);

            assertSame(ok, pipeline.send("amz-1", clean));

            FetchRequest evil = FetchRequest.builder()
                    .url("https://good.example/up")
                    .method("POST")
                    .body("{\"note\":\"eval(document.cookie)\"}")
                    .build();
            assertThrows(SandboxViolationException.class, () -> pipeline.send("amz-1", evil));
        }

        @Test
        @DisplayName("默认权限的插件网络请求被拒绝，授予后成功")
        void networkShouldRequireGrant() throws Exception {
            PluginManifest noUpload = TestManifests.signed(TestManifests.amazonOrders()
                    .clearCapabilities()
                    .capability("dataValidation")
                    .build());
            pipeline.register(noUpload);
            FetchRequest request = FetchRequest.get("https://good.example/status");

            PermissionDeniedException error = assertThrows(PermissionDeniedException.class,
                    () -> pipeline.execute("amz-1", (context, signal) -> context.fetch(request)));
            assertEquals("networkAccess", error.getCapability());
            verifyNoInteractions(transport);

            FetchResponse ok = new FetchResponse(200, "{}", Map.of());
            when(transport.send(eq(request), any(Duration.class))).thenReturn(ok);
            pipeline.getPermissionManager().grant("amz-1", Map.of(Permission.NETWORK_ACCESS, true));

            assertSame(ok, pipeline.execute("amz-1", (context, signal) -> context.fetch(request)));
        }
    }
}
