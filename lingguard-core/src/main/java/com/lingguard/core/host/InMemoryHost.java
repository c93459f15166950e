package com.lingguard.core.host;

import com.lingguard.api.permission.DeviceInfo;
import com.lingguard.core.spi.ClipboardAccess;
import com.lingguard.core.spi.HostBridge;
import com.lingguard.core.spi.HttpTransport;
import com.lingguard.core.spi.PluginStorage;
import lombok.Getter;
import lombok.Setter;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 内存版宿主能力
 * <p>
 * 用于无界面宿主与测试：存储、通知、剪贴板、上传记录都保存在内存中。
 * </p>
 */
public class InMemoryHost {

    @Getter
    private final Map<String, String> storage = new ConcurrentHashMap<>();

    @Getter
    private final List<String> notifications = new CopyOnWriteArrayList<>();

    @Getter
    private final List<String> uploadedFiles = new CopyOnWriteArrayList<>();

    @Getter
    @Setter
    private volatile String cookieHeader = "";

    @Getter
    @Setter
    private volatile String clipboard = "";

    @Getter
    @Setter
    private volatile DeviceInfo deviceInfo = new DeviceInfo(
            "LingGuard/" + System.getProperty("java.version"),
            System.getProperty("user.language", "en"),
            System.getProperty("os.name", "unknown"),
            0, 0);

    private final HttpTransport httpTransport;

    public InMemoryHost() {
        this(new JdkHttpTransport());
    }

    public InMemoryHost(HttpTransport httpTransport) {
        this.httpTransport = httpTransport;
    }

    public HostBridge toBridge() {
        return HostBridge.builder()
                .fileUploader((pluginId, fileName, content) -> uploadedFiles.add(pluginId + "/" + fileName))
                .httpTransport(httpTransport)
                .storage(new PluginStorage() {
                    @Override
                    public Optional<String> get(String key) {
                        return Optional.ofNullable(storage.get(key));
                    }

                    @Override
                    public void put(String key, String value) {
                        storage.put(key, value);
                    }
                })
                .cookieJar(() -> cookieHeader)
                .notificationSink((title, body) -> notifications.add(body))
                .clipboard(new ClipboardAccess() {
                    @Override
                    public String read() {
                        return clipboard;
                    }

                    @Override
                    public void write(String text) {
                        clipboard = text;
                    }
                })
                .deviceInfoProvider(() -> deviceInfo)
                .build();
    }
}
