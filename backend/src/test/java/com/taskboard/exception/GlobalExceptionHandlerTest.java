package com.taskboard.exception;

import com.taskboard.common.dto.ErrorResponse;
import com.taskboard.config.TaskboardProperties;
import com.taskboard.workspace.domain.WorkspaceRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler 단위 테스트")
class GlobalExceptionHandlerTest {

    private TaskboardProperties properties;
    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        properties = new TaskboardProperties();
        handler = new GlobalExceptionHandler(properties);
    }

    @Test
    @DisplayName("워크스페이스 ID 누락은 400으로 응답한다")
    void missingWorkspaceId_BadRequest() {
        // when
        ResponseEntity<ErrorResponse> response = handler.handleInvalidRequest(new MissingWorkspaceIdException());

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getMessage()).isEqualTo("workspace_id is required");
        assertThat(response.getBody().getDetails()).isNull();
    }

    @Test
    @DisplayName("역할 부족은 403과 필요한 역할 정보를 담아 응답한다")
    void insufficientRole_ForbiddenWithDetails() {
        // when
        ResponseEntity<ErrorResponse> response = handler.handleInsufficientRole(
                new InsufficientRoleException(List.of(WorkspaceRole.ADMIN, WorkspaceRole.MEMBER), WorkspaceRole.VIEWER));

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(response.getBody().getMessage())
                .isEqualTo("This action requires one of these roles: admin, member. Your role: viewer");
        assertThat(response.getBody().getDetails())
                .containsEntry("requiredRoles", List.of("admin", "member"))
                .containsEntry("actualRole", "viewer");
    }

    @Test
    @DisplayName("멤버가 아닌 경우 403으로 응답한다")
    void accessDenied_Forbidden() {
        // when
        ResponseEntity<ErrorResponse> response = handler.handleAccessDenied(
                new AccessDeniedException("You do not have access to this workspace"));

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(response.getBody().getError()).isEqualTo("Forbidden");
    }

    @Test
    @DisplayName("태스크가 남은 카테고리 삭제는 409와 태스크 수를 담아 응답한다")
    void categoryNotEmpty_ConflictWithTaskCount() {
        // when
        ResponseEntity<ErrorResponse> response = handler.handleCategoryNotEmpty(new CategoryNotEmptyException(3));

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getDetails()).containsEntry("taskCount", 3L);
    }

    @Test
    @DisplayName("중복 초대는 409로 응답한다")
    void pendingInvitation_Conflict() {
        // when
        ResponseEntity<ErrorResponse> response = handler.handleConflict(
                new InvitationAlreadyPendingException("An invitation is already pending for this email"));

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    @DisplayName("예상하지 못한 예외는 설정에 따라 메시지를 숨긴다")
    void runtimeException_HidesMessageWhenDisabled() {
        // given
        properties.getErrors().setExposeDetails(false);

        // when
        ResponseEntity<ErrorResponse> response = handler.handleRuntimeException(new IllegalStateException("db down"));

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getMessage()).isEqualTo("An unexpected error occurred");
    }

    @Test
    @DisplayName("상세 노출이 켜져 있으면 예외 메시지를 그대로 응답한다")
    void runtimeException_ExposesMessage() {
        // when
        ResponseEntity<ErrorResponse> response = handler.handleRuntimeException(new IllegalStateException("db down"));

        // then
        assertThat(response.getBody().getMessage()).isEqualTo("db down");
    }
}
