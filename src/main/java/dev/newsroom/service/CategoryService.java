package dev.newsroom.service;

import dev.newsroom.dto.CategoryResponse;
import dev.newsroom.repository.CategoryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

@Service
@RequiredArgsConstructor
public class CategoryService {

    private final CategoryRepository categoryRepository;

    public Flux<CategoryResponse> listCategories() {
        return categoryRepository.findAllOrderByName().map(CategoryResponse::from);
    }
}
