package com.lingguard.core.spi;

/**
 * 宿主文件上传能力
 */
public interface FileUploader {

    void upload(String pluginId, String fileName, byte[] content);
}
