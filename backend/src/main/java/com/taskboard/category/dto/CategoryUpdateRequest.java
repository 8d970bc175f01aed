package com.taskboard.category.dto;

import com.taskboard.category.domain.Category;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Partial update. A {@code null} field is left unchanged.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryUpdateRequest {

    private Long workspaceId;

    @Size(min = 1, max = 100, message = "Category name must be between 1 and 100 characters")
    private String name;

    @Pattern(regexp = Category.COLOR_PATTERN, message = "Color must be a valid hex color (e.g., #3B82F6)")
    private String color;

    @Min(value = 0, message = "Position must be a non-negative integer")
    private Integer position;
}
