package com.microservices.learningservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "lessons", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"module_id", "order_number"})
})
@Getter
@Setter
@NoArgsConstructor
public class Lesson {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "module_id", nullable = false)
    private CourseModule module;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LessonType lessonType = LessonType.VIDEO;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column
    private String videoUrl;

    @Column(nullable = false)
    private Integer durationMinutes = 0;

    @Column(name = "order_number", nullable = false)
    private Integer orderNumber = 0;

    @Column(nullable = false)
    private boolean published = false;

    @Column(nullable = false)
    private boolean freePreview = false;

    @OneToMany(mappedBy = "lesson", cascade = CascadeType.REMOVE)
    private List<LessonProgress> progress = new ArrayList<>();

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public Course getCourse() {
        return module.getCourse();
    }

    public enum LessonType {
        VIDEO, TEXT, QUIZ, ASSIGNMENT, LIVE
    }
}
