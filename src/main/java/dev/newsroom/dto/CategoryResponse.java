package dev.newsroom.dto;

import dev.newsroom.entity.Category;

public record CategoryResponse(String id, String name) {

    public static CategoryResponse from(Category category) {
        return new CategoryResponse(String.valueOf(category.getId()), category.getName());
    }
}
