package com.taskboard.category.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryReorderRequest {

    @NotEmpty(message = "categoryIds array is required")
    private List<Long> categoryIds;
}
