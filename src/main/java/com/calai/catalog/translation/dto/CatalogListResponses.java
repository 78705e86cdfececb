package com.calai.catalog.translation.dto;

import java.util.List;

public final class CatalogListResponses {

    private CatalogListResponses() {}

    public record Locales(List<String> locales) {}

    public record Tags(List<String> tags) {}

    public record Message(String message) {}
}
