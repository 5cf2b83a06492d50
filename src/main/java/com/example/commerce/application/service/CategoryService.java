package com.example.commerce.application.service;

import com.example.commerce.application.dto.CategoryCommand;
import com.example.commerce.application.dto.CategoryView;
import com.example.commerce.domain.exception.InvalidStateException;
import com.example.commerce.domain.exception.NotFoundException;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.Slug;
import com.example.commerce.infrastructure.persistence.entity.CategoryEntity;
import com.example.commerce.infrastructure.persistence.mapper.CatalogPersistenceMapper;
import com.example.commerce.infrastructure.persistence.repository.CategoryRepository;
import com.example.commerce.infrastructure.persistence.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryService.class);
    private static final Sort DISPLAY_ORDER = Sort.by("sortOrder").and(Sort.by("name"));

    private final CategoryRepository categoryRepository;
    private final ProductRepository productRepository;
    private final CatalogPersistenceMapper mapper;

    public CategoryService(CategoryRepository categoryRepository, ProductRepository productRepository,
                           CatalogPersistenceMapper mapper) {
        this.categoryRepository = categoryRepository;
        this.productRepository = productRepository;
        this.mapper = mapper;
    }

    @Transactional(readOnly = true)
    public List<CategoryView> listCategories(boolean includeInactive) {
        List<CategoryEntity> categories = includeInactive
                ? categoryRepository.findAll(DISPLAY_ORDER)
                : categoryRepository.findByActiveTrue(DISPLAY_ORDER);
        return categories.stream().map(mapper::toView).toList();
    }

    @Transactional(readOnly = true)
    public CategoryView getCategory(String categoryId) {
        return mapper.toView(load(categoryId));
    }

    @Transactional
    public CategoryView createCategory(CategoryCommand command, Actor actor) {
        actor.requireAnyRole(Role.ADMIN);
        CategoryEntity category = new CategoryEntity();
        category.setName(command.name());
        category.setSlug(Slug.unique(command.name(), categoryRepository::existsBySlug));
        category.setActive(command.active() == null || command.active());
        apply(category, command);
        CategoryEntity saved = categoryRepository.save(category);
        log.info("Category {} created with slug {}", saved.getId(), saved.getSlug());
        return mapper.toView(saved);
    }

    @Transactional
    public CategoryView updateCategory(String categoryId, CategoryCommand command, Actor actor) {
        actor.requireAnyRole(Role.ADMIN);
        CategoryEntity category = load(categoryId);
        if (command.name() != null && !command.name().equals(category.getName())) {
            category.setName(command.name());
            category.setSlug(Slug.unique(command.name(), categoryRepository::existsBySlug));
        }
        if (command.active() != null) {
            category.setActive(command.active());
        }
        apply(category, command);
        return mapper.toView(category);
    }

    /**
     * Deletes an unused category.
     *
     * @throws InvalidStateException while products or child categories reference it
     */
    @Transactional
    public void deleteCategory(String categoryId, Actor actor) {
        actor.requireAnyRole(Role.ADMIN);
        CategoryEntity category = load(categoryId);
        if (productRepository.existsByCategory_Id(categoryId)) {
            throw new InvalidStateException("Cannot delete category with products");
        }
        if (categoryRepository.existsByParent_Id(categoryId)) {
            throw new InvalidStateException("Cannot delete category with subcategories");
        }
        categoryRepository.delete(category);
        log.info("Category {} deleted by {}", categoryId, actor.userId());
    }

    private void apply(CategoryEntity category, CategoryCommand command) {
        if (command.description() != null) category.setDescription(command.description());
        if (command.image() != null) category.setImage(command.image());
        if (command.sortOrder() != null) category.setSortOrder(command.sortOrder());
        if (command.parentId() != null) {
            if (command.parentId().equals(category.getId())) {
                throw new InvalidStateException("A category cannot be its own parent");
            }
            category.setParent(load(command.parentId()));
        }
    }

    private CategoryEntity load(String categoryId) {
        return categoryRepository.findById(categoryId)
                .orElseThrow(() -> new NotFoundException("Category", categoryId));
    }
}
