package com.taskboard.task.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Target of a drag-and-drop move. Without {@code categoryId} the task stays in its current list.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPositionRequest {

    private Long workspaceId;

    private Long categoryId;

    @NotNull(message = "Position is required")
    @Min(value = 0, message = "Position must be a non-negative integer")
    private Integer position;
}
