package com.taskboard.category.mapper;

import com.taskboard.category.domain.Category;
import com.taskboard.category.dto.CategoryResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface CategoryMapper {

    @Mapping(source = "category.workspace.id", target = "workspaceId")
    @Mapping(source = "category.createdBy.id", target = "createdBy")
    @Mapping(source = "taskCount", target = "taskCount")
    CategoryResponse toResponse(Category category, long taskCount);
}
