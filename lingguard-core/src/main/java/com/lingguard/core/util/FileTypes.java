package com.lingguard.core.util;

import java.util.Locale;
import java.util.Set;

/**
 * 文件类型常量与归一化
 */
public final class FileTypes {

    /**
     * 常见且安全的类型，超出此集合给出警告
     */
    public static final Set<String> COMMONLY_SAFE = Set.of(
            "jpg", "jpeg", "png", "gif", "webp", "bmp", "tiff", "svg",
            "pdf", "csv", "txt", "json", "xml",
            "doc", "docx", "xls", "xlsx");

    /**
     * 可执行文件、脚本、可携带可执行内容的归档
     */
    public static final Set<String> DANGEROUS = Set.of(
            "exe", "bat", "cmd", "com", "pif", "scr", "vbs", "js",
            "jar", "app", "dmg", "pkg", "deb", "rpm", "msi",
            "ps1", "sh", "php", "asp", "aspx", "jsp",
            "pl", "py", "rb", "go", "rs");

    private FileTypes() {
    }

    /**
     * 小写并去掉前导点
     */
    public static String normalize(String type) {
        if (type == null) {
            return "";
        }
        String t = type.trim().toLowerCase(Locale.ROOT);
        return t.startsWith(".") ? t.substring(1) : t;
    }
}
