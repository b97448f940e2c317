package com.mead.oncology.model;

public record GuidelineReference(
        String name,
        String url
) {
}
