package com.calai.catalog.translation.dto;

import java.util.regex.Pattern;

public final class TranslationConstraints {

    /** 例：en、zh-TW、pt_BR；不允許 ':' 以免跟快取 key 的分段撞到 */
    public static final String LOCALE_REGEX = "^[A-Za-z0-9_-]{1,10}$";
    public static final String LOCALE_MESSAGE = "must be 1-10 letters, digits, '-' or '_'";
    public static final String NOT_BLANK_REGEX = "(?s).*\\S.*";

    public static final int KEY_MAX = 255;
    public static final int VALUE_MAX = 4096;
    public static final int TAG_MAX = 255;

    private static final Pattern LOCALE = Pattern.compile(LOCALE_REGEX);

    private TranslationConstraints() {}

    public static boolean isValidLocale(String locale) {
        return locale != null && LOCALE.matcher(locale).matches();
    }
}
