package org.example.kbsync.utils;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * 抽取内容的规范化与摘要。cloud 与 local 两侧必须使用同一套规则，
 * 否则幂等提交会被误判为冲突。
 */
public final class ContentHashes {

    private ContentHashes() {
    }

    /**
     * 统一换行符并去掉首尾空白
     */
    public static String canonicalize(String content) {
        if (content == null) {
            return "";
        }
        return content.replace("\r\n", "\n").replace('\r', '\n').strip();
    }

    public static String sha256(String content) {
        return DigestUtils.sha256Hex(canonicalize(content).getBytes(StandardCharsets.UTF_8));
    }

    public static boolean matches(String content, String expectedHash) {
        return expectedHash != null && expectedHash.equalsIgnoreCase(sha256(content));
    }
}
