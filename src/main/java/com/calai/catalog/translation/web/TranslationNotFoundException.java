package com.calai.catalog.translation.web;

public class TranslationNotFoundException extends RuntimeException {

    private final Long translationId;

    public TranslationNotFoundException(Long translationId) {
        super("TRANSLATION_NOT_FOUND");
        this.translationId = translationId;
    }

    public Long translationId() { return translationId; }
}
