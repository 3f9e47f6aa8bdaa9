package dev.newsroom.service;

import dev.newsroom.entity.Category;
import dev.newsroom.repository.CategoryRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CategoryServiceTest {

    @Mock
    private CategoryRepository categoryRepository;

    @InjectMocks
    private CategoryService categoryService;

    @Test
    @DisplayName("lists categories with string ids in repository order")
    void shouldListCategories() {
        when(categoryRepository.findAllOrderByName()).thenReturn(Flux.just(
                Category.builder().id(1L).name("Politics").build(),
                Category.builder().id(2L).name("Sports").build()));

        StepVerifier.create(categoryService.listCategories())
                .assertNext(c -> assertThat(c.id()).isEqualTo("1"))
                .assertNext(c -> assertThat(c.name()).isEqualTo("Sports"))
                .verifyComplete();
    }
}
