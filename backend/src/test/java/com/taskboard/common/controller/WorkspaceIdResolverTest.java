package com.taskboard.common.controller;

import com.taskboard.exception.MissingWorkspaceIdException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WorkspaceIdResolver 단위 테스트")
class WorkspaceIdResolverTest {

    @Test
    @DisplayName("path 값이 query와 body보다 우선한다")
    void resolve_PathWins() {
        // when
        Long result = WorkspaceIdResolver.resolve(1L, 2L, 3L);

        // then
        assertThat(result).isEqualTo(1L);
    }

    @Test
    @DisplayName("path가 없으면 query 값을 사용한다")
    void resolve_QueryBeforeBody() {
        // when
        Long result = WorkspaceIdResolver.resolve(2L, 3L);

        // then
        assertThat(result).isEqualTo(2L);
    }

    @Test
    @DisplayName("query가 없으면 body 값을 사용한다")
    void resolve_BodyFallback() {
        // when
        Long result = WorkspaceIdResolver.resolve(null, 3L);

        // then
        assertThat(result).isEqualTo(3L);
    }

    @Test
    @DisplayName("어디에도 없으면 MissingWorkspaceIdException이 발생한다")
    void resolve_Missing() {
        // when & then
        assertThatThrownBy(() -> WorkspaceIdResolver.resolve(null, null, null))
                .isInstanceOf(MissingWorkspaceIdException.class)
                .hasMessage("workspace_id is required");
    }
}
