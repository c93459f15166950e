package com.lingguard.api.permission;

import com.lingguard.api.http.FetchRequest;
import com.lingguard.api.http.FetchResponse;

import java.util.Optional;

/**
 * 受能力约束的插件上下文
 * <p>
 * 每个方法在构建时已绑定到真实实现或拒绝桩：
 * 能力未授予时调用会抛出 {@link com.lingguard.api.exception.PermissionDeniedException}，
 * 不会静默返回空结果。
 * </p>
 *
 * @author LingGuard
 */
public interface ConstrainedContext {

    String getPluginId();

    /**
     * 上传文件（需要 fileUpload）
     */
    void uploadFile(String fileName, byte[] content);

    /**
     * 发起网络请求（需要 networkAccess）
     */
    FetchResponse fetch(FetchRequest request);

    /**
     * 读取插件命名空间下的存储项（需要 localStorage）
     */
    Optional<String> getLocalStorage(String key);

    /**
     * 写入插件命名空间下的存储项（需要 localStorage）
     */
    void setLocalStorage(String key, String value);

    /**
     * 读取 Cookie，会话与认证类 Cookie 已被剔除（需要 cookies）
     */
    String getCookies();

    /**
     * 展示通知，消息会被截断（需要 notifications）
     */
    void showNotification(String message);

    /**
     * 读取剪贴板（需要 clipboard）
     */
    String readClipboard();

    /**
     * 写入剪贴板，内容会被截断（需要 clipboard）
     */
    void writeClipboard(String text);

    /**
     * 设备信息快照（需要 deviceInfo）
     */
    DeviceInfo getDeviceInfo();
}
