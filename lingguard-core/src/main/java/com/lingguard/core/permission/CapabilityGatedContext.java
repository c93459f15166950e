package com.lingguard.core.permission;

import com.lingguard.api.http.FetchRequest;
import com.lingguard.api.http.FetchResponse;
import com.lingguard.api.permission.ConstrainedContext;
import com.lingguard.api.permission.DeviceInfo;
import com.lingguard.api.permission.Permission;
import com.lingguard.api.permission.PluginPermissions;
import com.lingguard.core.exception.InvocationException;
import com.lingguard.core.spi.ClipboardAccess;
import com.lingguard.core.spi.CookieJar;
import com.lingguard.core.spi.DeviceInfoProvider;
import com.lingguard.core.spi.FileUploader;
import com.lingguard.core.spi.HostBridge;
import com.lingguard.core.spi.HttpTransport;
import com.lingguard.core.spi.NotificationSink;
import com.lingguard.core.spi.PluginStorage;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 受能力约束的上下文实现
 * <p>
 * 构建时按权限记录为每个宿主能力选定真实实现或拒绝桩，调用时不再做策略判断。
 * 真实实现带有防御性边界：存储键加命名空间、剔除会话 Cookie、截断通知与剪贴板内容。
 * </p>
 */
final class CapabilityGatedContext implements ConstrainedContext {

    static final int MAX_NOTIFICATION_LENGTH = 100;
    static final int MAX_CLIPBOARD_LENGTH = 1000;
    static final String NOTIFICATION_TITLE = "Plugin Notification";

    private final String pluginId;
    private final Duration fetchTimeout;

    private final FileUploader uploader;
    private final HttpTransport transport;
    private final PluginStorage storage;
    private final CookieJar cookieJar;
    private final NotificationSink notifications;
    private final ClipboardAccess clipboard;
    private final DeviceInfoProvider deviceInfo;

    CapabilityGatedContext(String pluginId, PluginPermissions permissions, HostBridge bridge, Duration fetchTimeout) {
        this.pluginId = pluginId;
        this.fetchTimeout = fetchTimeout;

        this.uploader = gate(permissions, Permission.FILE_UPLOAD, FileUploader.class, bridge.getFileUploader());
        this.transport = gate(permissions, Permission.NETWORK_ACCESS, HttpTransport.class, bridge.getHttpTransport());
        this.storage = gate(permissions, Permission.LOCAL_STORAGE, PluginStorage.class, bridge.getStorage());
        this.cookieJar = gate(permissions, Permission.COOKIES, CookieJar.class, bridge.getCookieJar());
        this.notifications = gate(permissions, Permission.NOTIFICATIONS, NotificationSink.class,
                bridge.getNotificationSink());
        this.clipboard = gate(permissions, Permission.CLIPBOARD, ClipboardAccess.class, bridge.getClipboard());
        this.deviceInfo = gate(permissions, Permission.DEVICE_INFO, DeviceInfoProvider.class,
                bridge.getDeviceInfoProvider());
    }

    private <T> T gate(PluginPermissions permissions, Permission permission, Class<T> type, T real) {
        return permissions.has(permission) ? real : DeniedCapabilityProxy.create(type, pluginId, permission);
    }

    @Override
    public String getPluginId() {
        return pluginId;
    }

    @Override
    public void uploadFile(String fileName, byte[] content) {
        uploader.upload(pluginId, fileName, content);
    }

    @Override
    public FetchResponse fetch(FetchRequest request) {
        try {
            return transport.send(request, fetchTimeout);
        } catch (IOException e) {
            throw new InvocationException(pluginId, "Network request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvocationException(pluginId, "Network request interrupted", e);
        }
    }

    @Override
    public Optional<String> getLocalStorage(String key) {
        return storage.get(namespaced(key));
    }

    @Override
    public void setLocalStorage(String key, String value) {
        storage.put(namespaced(key), value);
    }

    @Override
    public String getCookies() {
        String header = cookieJar.cookieHeader();
        if (header == null || header.isBlank()) {
            return "";
        }
        return Arrays.stream(header.split(";"))
                .map(String::trim)
                .filter(cookie -> !cookie.isEmpty())
                .filter(cookie -> !cookie.startsWith("session") && !cookie.startsWith("auth"))
                .collect(Collectors.joining("; "));
    }

    @Override
    public void showNotification(String message) {
        notifications.show(NOTIFICATION_TITLE, truncate(message, MAX_NOTIFICATION_LENGTH));
    }

    @Override
    public String readClipboard() {
        return clipboard.read();
    }

    @Override
    public void writeClipboard(String text) {
        clipboard.write(truncate(text, MAX_CLIPBOARD_LENGTH));
    }

    @Override
    public DeviceInfo getDeviceInfo() {
        return deviceInfo.snapshot();
    }

    private String namespaced(String key) {
        return "plugin_" + pluginId + "_" + key;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }

    @Override
    public String toString() {
        return "ConstrainedContext{" + pluginId + "}";
    }
}
