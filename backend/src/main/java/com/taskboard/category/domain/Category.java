package com.taskboard.category.domain;

import com.taskboard.user.domain.User;
import com.taskboard.workspace.domain.Workspace;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "categories")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Category {

    public static final String DEFAULT_COLOR = "#3B82F6";
    public static final String COLOR_PATTERN = "^#[0-9A-Fa-f]{6}$";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "workspace_id", nullable = false)
    private Workspace workspace;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 7)
    private String color;

    @Column(nullable = false)
    private int position;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by")
    private User createdBy;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

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

    @Builder
    public Category(Workspace workspace, String name, String color, int position, User createdBy) {
        this.workspace = workspace;
        this.name = name;
        this.color = color == null ? DEFAULT_COLOR : color;
        this.position = position;
        this.createdBy = createdBy;
    }

    public void rename(String name) {
        this.name = name;
    }

    public void changeColor(String color) {
        this.color = color;
    }
}
