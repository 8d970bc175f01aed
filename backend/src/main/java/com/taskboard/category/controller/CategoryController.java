package com.taskboard.category.controller;

import com.taskboard.category.dto.CategoryCreateRequest;
import com.taskboard.category.dto.CategoryReorderRequest;
import com.taskboard.category.dto.CategoryResponse;
import com.taskboard.category.dto.CategoryUpdateRequest;
import com.taskboard.category.service.CategoryService;
import com.taskboard.common.controller.WorkspaceIdResolver;
import com.taskboard.common.dto.MessageResponse;
import com.taskboard.user.domain.User;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.taskboard.common.controller.ResponseHelper.created;
import static com.taskboard.common.controller.ResponseHelper.ok;

@RestController
@RequestMapping("/api/categories")
@RequiredArgsConstructor
public class CategoryController {

    private final CategoryService categoryService;

    @GetMapping
    public ResponseEntity<List<CategoryResponse>> getCategories(
            @RequestParam(required = false) Long workspaceId,
            @AuthenticationPrincipal User user) {
        Long resolved = WorkspaceIdResolver.resolve(workspaceId, null);
        return ok(categoryService.getCategories(user.getId(), resolved));
    }

    @GetMapping("/{categoryId}")
    public ResponseEntity<CategoryResponse> getCategory(
            @PathVariable Long categoryId,
            @RequestParam(required = false) Long workspaceId,
            @AuthenticationPrincipal User user) {
        Long resolved = WorkspaceIdResolver.resolve(workspaceId, null);
        return ok(categoryService.getCategory(user.getId(), resolved, categoryId));
    }

    @PostMapping
    public ResponseEntity<CategoryResponse> createCategory(
            @Valid @RequestBody CategoryCreateRequest request,
            @RequestParam(required = false) Long workspaceId,
            @AuthenticationPrincipal User user) {
        Long resolved = WorkspaceIdResolver.resolve(workspaceId, request.getWorkspaceId());
        return created(categoryService.createCategory(user, resolved, request));
    }

    @PatchMapping("/reorder")
    public ResponseEntity<List<CategoryResponse>> reorderCategories(
            @Valid @RequestBody CategoryReorderRequest request,
            @AuthenticationPrincipal User user) {
        return ok(categoryService.reorderCategories(user.getId(), request.getCategoryIds()));
    }

    @PutMapping("/{categoryId}")
    public ResponseEntity<CategoryResponse> updateCategory(
            @PathVariable Long categoryId,
            @Valid @RequestBody CategoryUpdateRequest request,
            @RequestParam(required = false) Long workspaceId,
            @AuthenticationPrincipal User user) {
        Long resolved = WorkspaceIdResolver.resolve(workspaceId, request.getWorkspaceId());
        return ok(categoryService.updateCategory(user.getId(), resolved, categoryId, request));
    }

    @DeleteMapping("/{categoryId}")
    public ResponseEntity<MessageResponse> deleteCategory(
            @PathVariable Long categoryId,
            @RequestParam(required = false) Long workspaceId,
            @AuthenticationPrincipal User user) {
        Long resolved = WorkspaceIdResolver.resolve(workspaceId, null);
        categoryService.deleteCategory(user.getId(), resolved, categoryId);
        return ok(new MessageResponse("Category deleted successfully"));
    }
}
