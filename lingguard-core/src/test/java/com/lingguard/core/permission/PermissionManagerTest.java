package com.lingguard.core.permission;

import com.lingguard.api.exception.PermissionDeniedException;
import com.lingguard.api.http.FetchRequest;
import com.lingguard.api.http.FetchResponse;
import com.lingguard.api.permission.ConstrainedContext;
import com.lingguard.api.permission.Permission;
import com.lingguard.api.permission.PermissionCheckResult;
import com.lingguard.api.permission.PluginOperation;
import com.lingguard.api.permission.PluginPermissions;
import com.lingguard.core.config.SecurityConfig;
import com.lingguard.core.host.InMemoryHost;
import com.lingguard.core.spi.HttpTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PermissionManager 单元测试")
class PermissionManagerTest {

    private static final String PLUGIN = "amz-1";

    @Mock
    private HttpTransport transport;

    private InMemoryHost host;
    private PermissionManager manager;

    @BeforeEach
    void setUp() {
        host = new InMemoryHost(transport);
        manager = new PermissionManager(SecurityConfig.defaults(), host.toBridge());
    }

    @Nested
    @DisplayName("授予与撤销")
    class GrantRevokeTests {

        @Test
        @DisplayName("未登记插件只有 fileUpload")
        void unknownPluginShouldHaveDefaults() {
            assertTrue(manager.has(PLUGIN, Permission.FILE_UPLOAD));
            assertFalse(manager.has(PLUGIN, Permission.NETWORK_ACCESS));
            assertEquals(PluginPermissions.defaults(), manager.getPermissions(PLUGIN));
        }

        @Test
        @DisplayName("空授予等同于默认记录")
        void emptyGrantShouldEqualDefaults() {
            manager.grant(PLUGIN, Map.of());

            assertEquals(PluginPermissions.defaults(), manager.getPermissions(PLUGIN));
        }

        @Test
        @DisplayName("授予应合并而不是覆盖")
        void grantShouldMerge() {
            manager.grant(PLUGIN, Map.of(Permission.CLIPBOARD, true));
            manager.grant(PLUGIN, Map.of(Permission.NOTIFICATIONS, true));

            assertTrue(manager.has(PLUGIN, Permission.CLIPBOARD));
            assertTrue(manager.has(PLUGIN, Permission.NOTIFICATIONS));
            assertTrue(manager.has(PLUGIN, Permission.FILE_UPLOAD));
        }

        @Test
        @DisplayName("可以显式收回默认授予的 fileUpload")
        void grantFalseShouldRevokeSingleCapability() {
            manager.grant(PLUGIN, Map.of(Permission.FILE_UPLOAD, false));

            assertFalse(manager.has(PLUGIN, Permission.FILE_UPLOAD));
        }

        @Test
        @DisplayName("revokeAll 后恢复默认记录")
        void revokeAllShouldRestoreDefaults() {
            manager.grant(PLUGIN, Map.of(Permission.NETWORK_ACCESS, true, Permission.FILE_UPLOAD, false));

            manager.revokeAll(PLUGIN);

            assertEquals(PluginPermissions.defaults(), manager.getPermissions(PLUGIN));
        }
    }

    @Nested
    @DisplayName("操作检查")
    class CheckOperationTests {

        @Test
        @DisplayName("应报告缺失的能力")
        void shouldReportMissingCapability() {
            PermissionCheckResult result = manager.checkOperation(PLUGIN, PluginOperation.NETWORK_REQUEST);

            assertFalse(result.allowed());
            assertEquals(List.of("networkAccess"), result.missingCapabilities());
            assertTrue(result.knownOperation());
        }

        @Test
        @DisplayName("按名称检查已知操作")
        void shouldResolveOperationByName() {
            assertTrue(manager.checkOperation(PLUGIN, "fileUpload").allowed());
        }

        @Test
        @DisplayName("默认策略放行未知操作并标记")
        void unknownOperationShouldBeAllowedByDefault() {
            PermissionCheckResult result = manager.checkOperation(PLUGIN, "teleport");

            assertTrue(result.allowed());
            assertFalse(result.knownOperation());
            assertTrue(result.missingCapabilities().isEmpty());
        }

        @Test
        @DisplayName("生产配置拒绝未知操作")
        void unknownOperationShouldBeDeniedInProduction() {
            PermissionManager strict = new PermissionManager(SecurityConfig.production(), host.toBridge());

            assertFalse(strict.checkOperation(PLUGIN, "teleport").allowed());
        }
    }

    @Nested
    @DisplayName("按声明自动授权")
    class AutoGrantTests {

        @Test
        @DisplayName("声明上传应授予网络与通知")
        void fileUploadShouldGrantNetworkAndNotifications() {
            manager.autoGrant(PLUGIN, Set.of("fileUpload"));

            assertTrue(manager.has(PLUGIN, Permission.NETWORK_ACCESS));
            assertTrue(manager.has(PLUGIN, Permission.NOTIFICATIONS));
            assertFalse(manager.has(PLUGIN, Permission.CLIPBOARD));
        }

        @Test
        @DisplayName("仅批量处理只授予通知")
        void batchOnlyShouldGrantNotifications() {
            manager.autoGrant(PLUGIN, Set.of("batchProcessing"));

            assertTrue(manager.has(PLUGIN, Permission.NOTIFICATIONS));
            assertFalse(manager.has(PLUGIN, Permission.NETWORK_ACCESS));
        }

        @Test
        @DisplayName("手动录入只授予网络")
        void manualEntryShouldGrantNetwork() {
            manager.autoGrant(PLUGIN, Set.of("manualEntry"));

            assertTrue(manager.has(PLUGIN, Permission.NETWORK_ACCESS));
            assertFalse(manager.has(PLUGIN, Permission.NOTIFICATIONS));
        }
    }

    @Nested
    @DisplayName("受限上下文")
    class ConstrainedContextTests {

        @Test
        @DisplayName("默认权限下网络请求被拒绝，授予后成功")
        void networkShouldBeDeniedUntilGranted() throws Exception {
            FetchRequest request = FetchRequest.get("https://good.example/up");

            PermissionDeniedException denied = assertThrows(PermissionDeniedException.class,
                    () -> manager.buildConstrainedContext(PLUGIN).fetch(request));
            assertEquals("networkAccess", denied.getCapability());
            verifyNoInteractions(transport);

            FetchResponse ok = new FetchResponse(200, "{}", Map.of());
            when(transport.send(eq(request), any(Duration.class))).thenReturn(ok);
            manager.grant(PLUGIN, Map.of(Permission.NETWORK_ACCESS, true));

            assertSame(ok, manager.buildConstrainedContext(PLUGIN).fetch(request));
        }

        @Test
        @DisplayName("未授予的能力都抛出并指明能力名")
        void deniedCapabilitiesShouldNameCapability() {
            ConstrainedContext context = manager.buildConstrainedContext(PLUGIN);

            assertEquals("localStorage", assertThrows(PermissionDeniedException.class,
                    () -> context.setLocalStorage("k", "v")).getCapability());
            assertEquals("cookies", assertThrows(PermissionDeniedException.class,
                    context::getCookies).getCapability());
            assertEquals("notifications", assertThrows(PermissionDeniedException.class,
                    () -> context.showNotification("hi")).getCapability());
            assertEquals("clipboard", assertThrows(PermissionDeniedException.class,
                    context::readClipboard).getCapability());
            assertEquals("deviceInfo", assertThrows(PermissionDeniedException.class,
                    context::getDeviceInfo).getCapability());
        }

        @Test
        @DisplayName("上下文构建后权限变化不影响已有上下文")
        void contextShouldSnapshotPermissions() {
            ConstrainedContext before = manager.buildConstrainedContext(PLUGIN);
            manager.grant(PLUGIN, Map.of(Permission.CLIPBOARD, true));

            assertThrows(PermissionDeniedException.class, before::readClipboard);
            assertEquals("", manager.buildConstrainedContext(PLUGIN).readClipboard());
        }

        @Test
        @DisplayName("存储键按插件加前缀")
        void storageShouldBeNamespaced() {
            manager.grant(PLUGIN, Map.of(Permission.LOCAL_STORAGE, true));
            ConstrainedContext context = manager.buildConstrainedContext(PLUGIN);

            context.setLocalStorage("lastImport", "2024-05-01");

            assertEquals("2024-05-01", host.getStorage().get("plugin_amz-1_lastImport"));
            assertEquals("2024-05-01", context.getLocalStorage("lastImport").orElseThrow());
        }

        @Test
        @DisplayName("会话与认证 Cookie 应被剔除")
        void sessionCookiesShouldBeStripped() {
            host.setCookieHeader("theme=dark; session_id=abc; authToken=xyz; lang=en");
            manager.grant(PLUGIN, Map.of(Permission.COOKIES, true));

            assertEquals("theme=dark; lang=en", manager.buildConstrainedContext(PLUGIN).getCookies());
        }

        @Test
        @DisplayName("通知与剪贴板内容应被截断")
        void notificationAndClipboardShouldBeTruncated() {
            manager.grant(PLUGIN, Map.of(Permission.NOTIFICATIONS, true, Permission.CLIPBOARD, true));
            ConstrainedContext context = manager.buildConstrainedContext(PLUGIN);

            context.showNotification("x".repeat(150));
            context.writeClipboard("y".repeat(1500));

            assertEquals(100, host.getNotifications().get(0).length());
            assertEquals(1000, host.getClipboard().length());
        }

        @Test
        @DisplayName("上传应带上插件 ID")
        void uploadShouldCarryPluginId() {
            manager.buildConstrainedContext(PLUGIN).uploadFile("orders.csv", new byte[] { 1, 2, 3 });

            assertEquals(List.of("amz-1/orders.csv"), host.getUploadedFiles());
        }
    }
}
