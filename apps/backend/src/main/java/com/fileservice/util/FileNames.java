package com.fileservice.util;

import java.util.Locale;

public final class FileNames {

    static final int MAX_LENGTH = 120;

    private FileNames() {}

    /**
     * 去掉路径分隔、只保留常见字符，避免过长（尽量保留扩展名）。
     */
    public static String sanitize(String s) {
        if (s == null || s.isBlank()) return "unnamed";
        String base = s.trim().replaceAll("[/\\\\]+", "_").replaceAll("[^a-zA-Z0-9._-]", "_");
        return truncate(base, MAX_LENGTH);
    }

    /**
     * 截断到 maxLength 个字符以内，尽量保留扩展名。
     */
    public static String truncate(String name, int maxLength) {
        if (name == null || name.length() <= maxLength) return name;

        String ext = extension(name);
        if (ext == null || ext.length() >= maxLength / 2) {
            return name.substring(0, maxLength);
        }
        String suffix = name.substring(name.length() - ext.length() - 1);
        return name.substring(0, maxLength - suffix.length()) + suffix;
    }

    /** 小写扩展名；没有扩展名返回 null */
    public static String extension(String filename) {
        if (filename == null) return null;
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String name = filename.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) return null;
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
