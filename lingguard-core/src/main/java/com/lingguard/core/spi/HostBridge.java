package com.lingguard.core.spi;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * 宿主能力集合
 * <p>
 * 受限上下文在能力被授予时委托给这里的实现。
 * </p>
 */
@Getter
@Builder
public class HostBridge {

    @NonNull
    private final FileUploader fileUploader;

    @NonNull
    private final HttpTransport httpTransport;

    @NonNull
    private final PluginStorage storage;

    @NonNull
    private final CookieJar cookieJar;

    @NonNull
    private final NotificationSink notificationSink;

    @NonNull
    private final ClipboardAccess clipboard;

    @NonNull
    private final DeviceInfoProvider deviceInfoProvider;
}
