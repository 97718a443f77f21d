package com.homelibrary.catalog.unit.service;

import com.homelibrary.catalog.config.CatalogProperties;
import com.homelibrary.catalog.dto.request.CategoryRequest;
import com.homelibrary.catalog.entity.Category;
import com.homelibrary.catalog.exception.BlockedByInvariantException;
import com.homelibrary.catalog.exception.DuplicateResourceException;
import com.homelibrary.catalog.repository.BookRepository;
import com.homelibrary.catalog.repository.CategoryRepository;
import com.homelibrary.catalog.rules.ViolationType;
import com.homelibrary.catalog.service.CategoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CategoryServiceTest {

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private BookRepository bookRepository;

    private CatalogProperties catalogProperties;
    private CategoryService categoryService;

    @BeforeEach
    void setUp() {
        catalogProperties = new CatalogProperties();
        categoryService = new CategoryService(categoryRepository, bookRepository, catalogProperties);
    }

    @Test
    void deleteCategory_defaultCategory_isNeverDeletable() {
        Category general = TestData.category("General");
        general.setId(catalogProperties.getDefaultCategoryId());
        when(categoryRepository.findById(general.getId())).thenReturn(Optional.of(general));

        BlockedByInvariantException ex = catchThrowableOfType(
            () -> categoryService.delete(general.getId()), BlockedByInvariantException.class);

        assertThat(ex.getViolations()).singleElement()
            .satisfies(v -> assertThat(v.type()).isEqualTo(ViolationType.DEFAULT_CATEGORY));
        verify(categoryRepository, never()).delete(any());
    }

    @Test
    void deleteCategory_inUse_isBlockedWithLinkedCount() {
        Category fiction = TestData.category("Fiction");
        when(categoryRepository.findById(fiction.getId())).thenReturn(Optional.of(fiction));
        when(bookRepository.countByCategoryId(fiction.getId())).thenReturn(4L);

        BlockedByInvariantException ex = catchThrowableOfType(
            () -> categoryService.delete(fiction.getId()), BlockedByInvariantException.class);

        assertThat(ex.getViolations()).singleElement()
            .satisfies(v -> {
                assertThat(v.type()).isEqualTo(ViolationType.CATEGORY_HAS_BOOKS);
                assertThat(v.linkedCount()).isEqualTo(4L);
            });
    }

    @Test
    void deleteCategory_unused_isDeleted() {
        Category spare = TestData.category("Spare");
        when(categoryRepository.findById(spare.getId())).thenReturn(Optional.of(spare));
        when(bookRepository.countByCategoryId(spare.getId())).thenReturn(0L);

        categoryService.delete(spare.getId());

        verify(categoryRepository).delete(spare);
    }

    @Test
    void createCategory_withDuplicateName_throwsDuplicateResourceException() {
        when(categoryRepository.existsByNameIgnoreCase("general")).thenReturn(true);

        assertThatThrownBy(() -> categoryService.create(new CategoryRequest(null, "general", null, null)))
            .isInstanceOf(DuplicateResourceException.class)
            .hasMessageContaining("general");

        verify(categoryRepository, never()).save(any());
    }
}
