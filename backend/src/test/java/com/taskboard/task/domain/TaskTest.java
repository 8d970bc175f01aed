package com.taskboard.task.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Task 도메인 테스트")
class TaskTest {

    private Task newTask(TaskStatus status) {
        return Task.builder()
                .title("Write docs")
                .status(status)
                .position(0)
                .build();
    }

    @Test
    @DisplayName("완료 상태로 생성하면 완료 시각이 기록된다")
    void createdCompleted_SetsCompletedAt() {
        Task task = newTask(TaskStatus.COMPLETED);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.getCompletedAt()).isNotNull();
    }

    @Test
    @DisplayName("기본 상태와 우선순위가 적용된다")
    void defaults() {
        Task task = newTask(null);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.TODO);
        assertThat(task.getPriority()).isEqualTo(TaskPriority.MEDIUM);
        assertThat(task.getCompletedAt()).isNull();
    }

    @Test
    @DisplayName("완료에서 다른 상태로 바꾸면 완료 시각이 지워진다")
    void leavingCompleted_ClearsCompletedAt() {
        Task task = newTask(TaskStatus.COMPLETED);

        task.changeStatus(TaskStatus.IN_PROGRESS);

        assertThat(task.getCompletedAt()).isNull();
    }

    @Test
    @DisplayName("이미 완료된 태스크를 다시 완료해도 완료 시각은 유지된다")
    void completedAgain_KeepsCompletedAt() {
        Task task = newTask(TaskStatus.COMPLETED);
        LocalDateTime first = task.getCompletedAt();

        task.changeStatus(TaskStatus.COMPLETED);

        assertThat(task.getCompletedAt()).isEqualTo(first);
    }

    @Test
    @DisplayName("상위 태스크가 있으면 카테고리를 갖지 않는다")
    void subtask_HasNoCategory() {
        Task parent = newTask(null);
        Task subtask = Task.builder()
                .parentTask(parent)
                .title("Step")
                .position(0)
                .build();

        assertThat(subtask.isSubtask()).isTrue();
        assertThat(subtask.getCategory()).isNull();
    }
}
