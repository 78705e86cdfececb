package com.calai.catalog.translation.web;

/** 必填欄位缺少或格式不對；在任何寫入之前就丟出，不需要 rollback */
public class TranslationValidationException extends IllegalArgumentException {

    private final String field;

    public TranslationValidationException(String field, String message) {
        super(field + " " + message);
        this.field = field;
    }

    public String field() { return field; }

    /** 不含欄位名的原始訊息 */
    public String reason() {
        return getMessage().substring(field.length() + 1);
    }
}
