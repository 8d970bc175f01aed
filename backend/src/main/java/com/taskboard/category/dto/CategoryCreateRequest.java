package com.taskboard.category.dto;

import com.taskboard.category.domain.Category;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryCreateRequest {

    // may also come from the workspaceId query parameter
    private Long workspaceId;

    @NotBlank(message = "Category name is required")
    @Size(max = 100, message = "Category name must be 100 characters or less")
    private String name;

    @Pattern(regexp = Category.COLOR_PATTERN, message = "Color must be a valid hex color (e.g., #3B82F6)")
    private String color;
}
