package com.taskboard.workspace.controller;

import com.taskboard.common.dto.MessageResponse;
import com.taskboard.user.domain.User;
import com.taskboard.workspace.dto.AcceptInvitationResponse;
import com.taskboard.workspace.dto.InvitationInfoResponse;
import com.taskboard.workspace.dto.InvitationResponse;
import com.taskboard.workspace.dto.WorkspaceInviteRequest;
import com.taskboard.workspace.dto.WorkspaceInviteResponse;
import com.taskboard.workspace.service.WorkspaceInvitationService;
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
public class WorkspaceInvitationController {

    private final WorkspaceInvitationService invitationService;

    /**
     * 워크스페이스에 사용자를 초대합니다.
     * Admin만 초대할 수 있습니다.
     */
    @PostMapping("/{workspaceId}/invite")
    public ResponseEntity<WorkspaceInviteResponse> inviteUser(
            @PathVariable Long workspaceId,
            @Valid @RequestBody WorkspaceInviteRequest request,
            @AuthenticationPrincipal User user) {
        return created(invitationService.inviteUser(user, workspaceId, request));
    }

    @GetMapping("/{workspaceId}/invitations")
    public ResponseEntity<List<InvitationResponse>> getPendingInvitations(
            @PathVariable Long workspaceId,
            @AuthenticationPrincipal User user) {
        return ok(invitationService.getPendingInvitations(user.getId(), workspaceId));
    }

    @DeleteMapping("/{workspaceId}/invitations/{invitationId}")
    public ResponseEntity<MessageResponse> cancelInvitation(
            @PathVariable Long workspaceId,
            @PathVariable Long invitationId,
            @AuthenticationPrincipal User user) {
        invitationService.cancelInvitation(user.getId(), workspaceId, invitationId);
        return ok(new MessageResponse("Invitation cancelled successfully"));
    }

    /**
     * 초대를 수락합니다.
     * 인증된 사용자의 이메일이 초대 이메일과 같아야 합니다.
     */
    @PostMapping("/accept-invite/{token}")
    public ResponseEntity<AcceptInvitationResponse> acceptInvitation(
            @PathVariable String token,
            @AuthenticationPrincipal User user) {
        return ok(invitationService.acceptInvitation(token, user));
    }

    /**
     * 초대 수락 페이지용 공개 조회 (인증 불필요)
     */
    @GetMapping("/invite-info/{token}")
    public ResponseEntity<InvitationInfoResponse> getInvitationInfo(@PathVariable String token) {
        return ok(invitationService.getInvitationInfo(token));
    }
}
