package com.lingguard.api.permission;

/**
 * 设备信息快照
 */
public record DeviceInfo(String userAgent, String language, String platform, int screenWidth, int screenHeight) {
}
