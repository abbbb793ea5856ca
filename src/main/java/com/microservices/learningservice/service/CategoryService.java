package com.microservices.learningservice.service;

import com.microservices.learningservice.dto.CategoryRequest;
import com.microservices.learningservice.dto.CategoryResponse;
import com.microservices.learningservice.exception.AuthenticationRequiredException;
import com.microservices.learningservice.exception.DuplicateResourceException;
import com.microservices.learningservice.exception.InvalidRequestException;
import com.microservices.learningservice.exception.PermissionDeniedException;
import com.microservices.learningservice.exception.ResourceNotFoundException;
import com.microservices.learningservice.model.Category;
import com.microservices.learningservice.model.Course;
import com.microservices.learningservice.repository.CategoryRepository;
import com.microservices.learningservice.repository.CourseRepository;
import com.microservices.learningservice.security.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryService {

    private final CategoryRepository categoryRepository;
    private final CourseRepository courseRepository;

    @Transactional(readOnly = true)
    public List<CategoryResponse> listActive() {
        Map<Long, Long> counts = new HashMap<>();
        for (Object[] row : categoryRepository.countPublishedCoursesPerCategory()) {
            counts.put((Long) row[0], (Long) row[1]);
        }
        return categoryRepository.findByActiveTrueOrderByTitle().stream()
                .map(c -> CategoryResponse.from(c, counts.getOrDefault(c.getId(), 0L)))
                .toList();
    }

    @Transactional(readOnly = true)
    public CategoryResponse getCategory(Long id) {
        Category category = categoryRepository.findById(id)
                .filter(Category::isActive)
                .orElseThrow(() -> ResourceNotFoundException.of("Category", id));
        return CategoryResponse.from(category, null);
    }

    @Transactional
    public CategoryResponse create(Actor actor, CategoryRequest request) {
        requireAdmin(actor);
        if (request.getTitle() == null || request.getTitle().isBlank()) {
            throw new InvalidRequestException("title", "Title is required");
        }
        String title = request.getTitle().trim();
        if (categoryRepository.existsByTitleIgnoreCase(title)) {
            throw new DuplicateResourceException("Category already exists: " + title);
        }
        Category category = new Category();
        category.setTitle(title);
        category.setIconSrc(request.getIconSrc());
        category.setDescription(request.getDescription());
        if (request.getActive() != null) {
            category.setActive(request.getActive());
        }
        Category saved = categoryRepository.save(category);
        log.info("Category created: {} ({})", saved.getTitle(), saved.getId());
        return CategoryResponse.from(saved, 0L);
    }

    @Transactional
    public CategoryResponse update(Actor actor, Long id, CategoryRequest request) {
        requireAdmin(actor);
        Category category = categoryRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.of("Category", id));
        if (request.getTitle() != null && !request.getTitle().trim().equalsIgnoreCase(category.getTitle())) {
            String title = request.getTitle().trim();
            if (title.isEmpty()) {
                throw new InvalidRequestException("title", "Title must not be blank");
            }
            if (categoryRepository.existsByTitleIgnoreCase(title)) {
                throw new DuplicateResourceException("Category already exists: " + title);
            }
            category.setTitle(title);
        }
        if (request.getIconSrc() != null) {
            category.setIconSrc(request.getIconSrc());
        }
        if (request.getDescription() != null) {
            category.setDescription(request.getDescription());
        }
        if (request.getActive() != null) {
            category.setActive(request.getActive());
        }
        return CategoryResponse.from(categoryRepository.save(category), null);
    }

    @Transactional
    public void delete(Actor actor, Long id) {
        requireAdmin(actor);
        Category category = categoryRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.of("Category", id));
        // course_categories is owned by Course; detach before deleting
        for (Course course : courseRepository.findByCategoryId(id)) {
            course.getCategories().removeIf(c -> c.getId().equals(id));
        }
        categoryRepository.delete(category);
        log.info("Category deleted: {}", id);
    }

    private static void requireAdmin(Actor actor) {
        if (actor.isAnonymous()) {
            throw new AuthenticationRequiredException();
        }
        if (!actor.isAdmin()) {
            throw new PermissionDeniedException("Only administrators can manage categories");
        }
    }
}
