package com.microservices.learningservice.service;

import com.microservices.learningservice.TestData;
import com.microservices.learningservice.dto.CategoryRequest;
import com.microservices.learningservice.dto.CategoryResponse;
import com.microservices.learningservice.exception.AuthenticationRequiredException;
import com.microservices.learningservice.exception.DuplicateResourceException;
import com.microservices.learningservice.exception.PermissionDeniedException;
import com.microservices.learningservice.model.Category;
import com.microservices.learningservice.model.Course;
import com.microservices.learningservice.model.RoleName;
import com.microservices.learningservice.repository.CategoryRepository;
import com.microservices.learningservice.repository.CourseRepository;
import com.microservices.learningservice.security.Actor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CategoryServiceTest {

    @Mock
    private CategoryRepository categoryRepository;
    @Mock
    private CourseRepository courseRepository;

    private CategoryService categoryService;

    private final Actor admin = Actor.authenticated(1L, RoleName.ADMIN, false);

    @BeforeEach
    void setUp() {
        categoryService = new CategoryService(categoryRepository, courseRepository);
    }

    private static Category category(Long id, String title) {
        Category category = new Category();
        category.setId(id);
        category.setTitle(title);
        return category;
    }

    private static CategoryRequest request(String title) {
        CategoryRequest request = new CategoryRequest();
        request.setTitle(title);
        return request;
    }

    @Test
    void listingCountsPublishedCourses() {
        List<Object[]> counts = new ArrayList<>();
        counts.add(new Object[]{1L, 3L});
        when(categoryRepository.countPublishedCoursesPerCategory()).thenReturn(counts);
        when(categoryRepository.findByActiveTrueOrderByTitle())
                .thenReturn(List.of(category(1L, "Design"), category(2L, "Programming")));

        List<CategoryResponse> categories = categoryService.listActive();

        assertThat(categories).extracting(CategoryResponse::getCoursesCount).containsExactly(3L, 0L);
    }

    @Test
    void onlyAdministratorsManageCategories() {
        Actor teacher = Actor.authenticated(2L, RoleName.TEACHER, false);

        assertThatThrownBy(() -> categoryService.create(teacher, request("Design")))
                .isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> categoryService.delete(Actor.ANONYMOUS, 1L))
                .isInstanceOf(AuthenticationRequiredException.class);
        verifyNoInteractions(categoryRepository);
    }

    @Test
    void staffCanCreateCategory() {
        Actor staff = Actor.authenticated(3L, null, true);
        when(categoryRepository.existsByTitleIgnoreCase("Data Science")).thenReturn(false);
        when(categoryRepository.save(any(Category.class))).thenAnswer(inv -> inv.getArgument(0));

        CategoryResponse created = categoryService.create(staff, request("  Data Science "));

        assertThat(created.getTitle()).isEqualTo("Data Science");
        assertThat(created.getCoursesCount()).isZero();
        assertThat(created.isActive()).isTrue();
    }

    @Test
    void categoryTitlesAreUnique() {
        when(categoryRepository.existsByTitleIgnoreCase("design")).thenReturn(true);

        assertThatThrownBy(() -> categoryService.create(admin, request("design")))
                .isInstanceOf(DuplicateResourceException.class);
        verify(categoryRepository, never()).save(any());
    }

    @Test
    void deletingCategoryDetachesItFromCourses() {
        Category design = category(4L, "Design");
        Course course = TestData.course(10L, TestData.user(1L, "teacher@example.com"), true);
        course.getCategories().add(design);
        when(categoryRepository.findById(4L)).thenReturn(Optional.of(design));
        when(courseRepository.findByCategoryId(4L)).thenReturn(List.of(course));

        categoryService.delete(admin, 4L);

        assertThat(course.getCategories()).isEmpty();
        verify(categoryRepository).delete(design);
    }
}
