package com.homelibrary.catalog.service;

import com.homelibrary.catalog.config.CatalogProperties;
import com.homelibrary.catalog.dto.request.CategoryRequest;
import com.homelibrary.catalog.dto.response.CategoryResponse;
import com.homelibrary.catalog.entity.Category;
import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.exception.BlockedByInvariantException;
import com.homelibrary.catalog.exception.DuplicateResourceException;
import com.homelibrary.catalog.exception.ResourceNotFoundException;
import com.homelibrary.catalog.mapper.TaxonomyMapper;
import com.homelibrary.catalog.repository.BookRepository;
import com.homelibrary.catalog.repository.CategoryRepository;
import com.homelibrary.catalog.rules.InvariantViolation;
import com.homelibrary.catalog.rules.ViolationType;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

    private final CategoryRepository categoryRepository;
    private final BookRepository bookRepository;
    private final CatalogProperties catalogProperties;

    @Transactional(readOnly = true)
    public Page<CategoryResponse> findAll(Pageable pageable) {
        return categoryRepository.findAll(pageable)
            .map(this::toResponse);
    }

    @Transactional(readOnly = true)
    public CategoryResponse findById(UUID id) {
        return toResponse(load(id));
    }

    @Transactional
    public CategoryResponse create(CategoryRequest request) {
        if (request.id() != null && categoryRepository.existsById(request.id())) {
            throw new DuplicateResourceException(EntityKind.CATEGORY, "id", request.id());
        }
        if (categoryRepository.existsByNameIgnoreCase(request.name())) {
            throw new DuplicateResourceException(EntityKind.CATEGORY, "name", request.name());
        }
        Category saved = categoryRepository.save(TaxonomyMapper.toCategory(request));
        return TaxonomyMapper.toResponse(saved, 0);
    }

    @Transactional
    public CategoryResponse update(UUID id, CategoryRequest request) {
        Category category = load(id);
        if (categoryRepository.existsByNameIgnoreCaseAndIdNot(request.name(), id)) {
            throw new DuplicateResourceException(EntityKind.CATEGORY, "name", request.name());
        }
        TaxonomyMapper.updateCategory(category, request);
        return toResponse(categoryRepository.save(category));
    }

    @Transactional
    public void delete(UUID id) {
        Category category = load(id);
        if (id.equals(catalogProperties.getDefaultCategoryId())) {
            throw new BlockedByInvariantException("Cannot delete category \"" + category.getName() + "\"",
                List.of(InvariantViolation.of(ViolationType.DEFAULT_CATEGORY, EntityKind.CATEGORY,
                    id, category.getName(), "is the default category")));
        }
        long bookCount = bookRepository.countByCategoryId(id);
        if (bookCount > 0) {
            log.warn("Refused to delete category {} ({}): {} book(s) linked", category.getName(), id, bookCount);
            throw new BlockedByInvariantException("Cannot delete category \"" + category.getName() + "\"",
                List.of(InvariantViolation.withCount(ViolationType.CATEGORY_HAS_BOOKS, EntityKind.CATEGORY,
                    id, category.getName(), "is still used by " + bookCount + " book(s)", bookCount)));
        }
        categoryRepository.delete(category);
        log.info("Deleted category {} ({})", category.getName(), id);
    }

    private Category load(UUID id) {
        return categoryRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.CATEGORY, id));
    }

    private CategoryResponse toResponse(Category category) {
        return TaxonomyMapper.toResponse(category, bookRepository.countByCategoryId(category.getId()));
    }
}
