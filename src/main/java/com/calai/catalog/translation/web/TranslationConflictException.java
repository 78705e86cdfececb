package com.calai.catalog.translation.web;

/** (key, locale) 已被另一筆佔用：寫入前檢查到，或 DB unique constraint 擋下的競態 */
public class TranslationConflictException extends RuntimeException {

    private final String key;
    private final String locale;

    public TranslationConflictException(String key, String locale) {
        super("Translation with this key and locale already exists");
        this.key = key;
        this.locale = locale;
    }

    public TranslationConflictException(String key, String locale, Throwable cause) {
        this(key, locale);
        initCause(cause);
    }

    public String key() { return key; }
    public String locale() { return locale; }
}
