package com.taskboard.workspace.controller;

import com.taskboard.common.dto.MessageResponse;
import com.taskboard.user.domain.User;
import com.taskboard.workspace.dto.MemberResponse;
import com.taskboard.workspace.dto.MemberRoleUpdateRequest;
import com.taskboard.workspace.dto.WorkspaceCreateRequest;
import com.taskboard.workspace.dto.WorkspaceDeleteResponse;
import com.taskboard.workspace.dto.WorkspaceResponse;
import com.taskboard.workspace.dto.WorkspaceUpdateRequest;
import com.taskboard.workspace.service.WorkspaceMemberService;
import com.taskboard.workspace.service.WorkspaceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.taskboard.common.controller.ResponseHelper.created;
import static com.taskboard.common.controller.ResponseHelper.ok;

@RestController
@RequestMapping("/api/workspaces")
@RequiredArgsConstructor
public class WorkspaceController {

    private final WorkspaceService workspaceService;
    private final WorkspaceMemberService workspaceMemberService;

    /**
     * 워크스페이스를 생성합니다.
     * 생성자는 owner(admin)가 되고 기본 카테고리와 시작 태스크가 함께 만들어집니다.
     */
    @PostMapping
    public ResponseEntity<WorkspaceResponse> createWorkspace(
            @Valid @RequestBody WorkspaceCreateRequest request,
            @AuthenticationPrincipal User user) {
        return created(workspaceService.createWorkspace(user, request));
    }

    @GetMapping
    public ResponseEntity<List<WorkspaceResponse>> getMyWorkspaces(@AuthenticationPrincipal User user) {
        return ok(workspaceService.getMyWorkspaces(user.getId()));
    }

    @GetMapping("/{workspaceId}")
    public ResponseEntity<WorkspaceResponse> getWorkspace(
            @PathVariable Long workspaceId,
            @AuthenticationPrincipal User user) {
        return ok(workspaceService.getWorkspace(user.getId(), workspaceId));
    }

    @PutMapping("/{workspaceId}")
    public ResponseEntity<WorkspaceResponse> updateWorkspace(
            @PathVariable Long workspaceId,
            @Valid @RequestBody WorkspaceUpdateRequest request,
            @AuthenticationPrincipal User user) {
        return ok(workspaceService.updateWorkspace(user.getId(), workspaceId, request));
    }

    /**
     * 워크스페이스와 하위 데이터를 모두 삭제합니다. Owner만 가능합니다.
     */
    @DeleteMapping("/{workspaceId}")
    public ResponseEntity<WorkspaceDeleteResponse> deleteWorkspace(
            @PathVariable Long workspaceId,
            @AuthenticationPrincipal User user) {
        return ok(workspaceService.deleteWorkspace(user.getId(), workspaceId));
    }

    @GetMapping("/{workspaceId}/members")
    public ResponseEntity<List<MemberResponse>> getMembers(
            @PathVariable Long workspaceId,
            @AuthenticationPrincipal User user) {
        return ok(workspaceService.getMembers(user.getId(), workspaceId));
    }

    @PatchMapping("/{workspaceId}/members/{memberId}")
    public ResponseEntity<MemberResponse> updateMemberRole(
            @PathVariable Long workspaceId,
            @PathVariable Long memberId,
            @Valid @RequestBody MemberRoleUpdateRequest request,
            @AuthenticationPrincipal User user) {
        return ok(workspaceMemberService.updateMemberRole(user.getId(), workspaceId, memberId, request.getRole()));
    }

    /**
     * 멤버를 제거합니다. 본인이 나가는 경우는 admin 권한이 필요 없습니다.
     */
    @DeleteMapping("/{workspaceId}/members/{memberId}")
    public ResponseEntity<MessageResponse> removeMember(
            @PathVariable Long workspaceId,
            @PathVariable Long memberId,
            @AuthenticationPrincipal User user) {
        String message = workspaceMemberService.removeMember(user.getId(), workspaceId, memberId);
        return ok(new MessageResponse(message));
    }
}
