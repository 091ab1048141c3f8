package com.metagen.common.util;

import java.util.Base64;

/**
 * 媒体文件编码工具类。
 */
public final class MediaUtils {

    private MediaUtils() {
    }

    /**
     * 字节数组转 Base64 字符串。
     */
    public static String toBase64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    /**
     * 根据文件扩展名推断 MIME 类型。
     */
    public static String getMimeType(String fileName) {
        if (fileName == null) return "image/jpeg";
        String lower = fileName.toLowerCase();
        if (lower.endsWith(".png")) return "image/png";
        if (lower.endsWith(".gif")) return "image/gif";
        if (lower.endsWith(".webp")) return "image/webp";
        if (lower.endsWith(".svg")) return "image/svg+xml";
        if (lower.endsWith(".mp4")) return "video/mp4";
        if (lower.endsWith(".mov")) return "video/quicktime";
        return "image/jpeg";
    }

    /**
     * 构建 data URI（用于视觉 API 调用）。
     */
    public static String toDataUri(String base64, String mimeType) {
        return "data:" + mimeType + ";base64," + base64;
    }
}
