package com.taskboard.workspace.service;

import com.taskboard.common.notification.DispatchResult;
import com.taskboard.common.notification.NotificationDispatcher;
import com.taskboard.common.notification.NotificationKind;
import com.taskboard.common.notification.OutboundNotification;
import com.taskboard.common.service.PermissionService;
import com.taskboard.config.TaskboardProperties;
import com.taskboard.exception.AlreadyWorkspaceMemberException;
import com.taskboard.exception.InvalidInvitationException;
import com.taskboard.exception.InvalidRequestException;
import com.taskboard.exception.InvitationAlreadyAcceptedException;
import com.taskboard.exception.InvitationAlreadyPendingException;
import com.taskboard.exception.InvitationEmailMismatchException;
import com.taskboard.exception.InvitationExpiredException;
import com.taskboard.exception.InvitationNotFoundException;
import com.taskboard.exception.WorkspaceNotFoundException;
import com.taskboard.user.domain.User;
import com.taskboard.workspace.domain.Workspace;
import com.taskboard.workspace.domain.WorkspaceInvitation;
import com.taskboard.workspace.domain.WorkspaceMember;
import com.taskboard.workspace.domain.WorkspaceRole;
import com.taskboard.workspace.dto.AcceptInvitationResponse;
import com.taskboard.workspace.dto.InvitationInfoResponse;
import com.taskboard.workspace.dto.InvitationResponse;
import com.taskboard.workspace.dto.WorkspaceInviteRequest;
import com.taskboard.workspace.dto.WorkspaceInviteResponse;
import com.taskboard.workspace.event.MemberJoinedEvent;
import com.taskboard.workspace.mapper.WorkspaceInvitationMapper;
import com.taskboard.workspace.repository.WorkspaceInvitationRepository;
import com.taskboard.workspace.repository.WorkspaceMemberRepository;
import com.taskboard.workspace.repository.WorkspaceRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Invitation lifecycle: create, accept, list, cancel and the public token lookup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class WorkspaceInvitationService {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    static final String INVALID_INVITATION_MESSAGE = "Invalid or expired invitation";
    static final String DELIVERY_PENDING_MESSAGE =
            "Invitation created, but email delivery pending. Share the invite link directly if needed.";

    private final WorkspaceInvitationRepository invitationRepository;
    private final WorkspaceRepository workspaceRepository;
    private final WorkspaceMemberRepository workspaceMemberRepository;
    private final PermissionService permissionService;
    private final InvitationTokenGenerator tokenGenerator;
    private final NotificationDispatcher notificationDispatcher;
    private final WorkspaceInvitationMapper invitationMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final TaskboardProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Creates an invitation and hands the invitation email to the notification pipeline.
     * The row is committed before the handoff, so a failed handoff still returns the invitation.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public WorkspaceInviteResponse inviteUser(User inviter, Long workspaceId, WorkspaceInviteRequest request) {
        WorkspaceInvitation invitation = transactionTemplate.execute(status ->
                createInvitation(inviter, workspaceId, request));

        String inviteLink = properties.getFrontendUrl() + "/accept-invite?token=" + invitation.getToken();
        DispatchResult delivery = notificationDispatcher.dispatch(OutboundNotification.builder()
                .kind(NotificationKind.WORKSPACE_INVITATION)
                .recipientEmail(invitation.getEmail())
                .workspaceId(workspaceId)
                .attributes(Map.of(
                        "workspaceName", invitation.getWorkspace().getName(),
                        "inviterName", inviter.getName(),
                        "role", invitation.getRole().getValue(),
                        "inviteLink", inviteLink))
                .build());

        meterRegistry.counter("taskboard.invitations.created").increment();
        String message = null;
        if (delivery == DispatchResult.PENDING) {
            meterRegistry.counter("taskboard.invitations.delivery.pending").increment();
            message = DELIVERY_PENDING_MESSAGE;
        }

        log.info("Invitation created: id={}, workspace={}, email={}, delivery={}",
                invitation.getId(), workspaceId, invitation.getEmail(), delivery);
        return invitationMapper.toInviteResponse(invitation, delivery, message);
    }

    /**
     * Accepts an invitation for {@code user}. Repeating a successful accept is a no-op.
     */
    @Transactional
    public AcceptInvitationResponse acceptInvitation(String token, User user) {
        WorkspaceInvitation invitation = invitationRepository.findByTokenForUpdate(token)
                .orElseThrow(() -> new InvalidInvitationException(INVALID_INVITATION_MESSAGE));
        Workspace workspace = invitation.getWorkspace();
        Long workspaceId = workspace.getId();

        if (invitation.isAccepted()) {
            if (user.hasEmail(invitation.getEmail())
                    && workspaceMemberRepository.existsByWorkspaceIdAndUserId(workspaceId, user.getId())) {
                log.debug("Invitation already accepted by user={}, workspace={}", user.getId(), workspaceId);
                return acceptResponse("You are already a member of this workspace", workspace,
                        invitation.getRole(), false);
            }
            log.warn("Accepted invitation reused: invitation={}, user={}", invitation.getId(), user.getId());
            throw new InvalidInvitationException(INVALID_INVITATION_MESSAGE);
        }

        if (invitation.isExpired()) {
            meterRegistry.counter("taskboard.invitations.expired").increment();
            throw new InvitationExpiredException("This invitation has expired");
        }

        if (!user.hasEmail(invitation.getEmail())) {
            log.warn("Invitation email mismatch: invitation={}, user={}", invitation.getId(), user.getId());
            throw new InvitationEmailMismatchException("This invitation was sent to a different email address");
        }

        if (workspaceMemberRepository.existsByWorkspaceIdAndUserId(workspaceId, user.getId())) {
            return acceptResponse("You are already a member of this workspace", workspace,
                    invitation.getRole(), false);
        }

        workspaceMemberRepository.save(WorkspaceMember.builder()
                .workspace(workspace)
                .user(user)
                .role(invitation.getRole())
                .build());
        invitation.accept();
        eventPublisher.publishEvent(new MemberJoinedEvent(workspaceId, user.getId(), invitation.getRole()));

        meterRegistry.counter("taskboard.invitations.accepted").increment();
        log.info("Invitation accepted: id={}, workspace={}, user={}, role={}",
                invitation.getId(), workspaceId, user.getId(), invitation.getRole());
        return acceptResponse("Successfully joined workspace", workspace, invitation.getRole(), true);
    }

    public List<InvitationResponse> getPendingInvitations(Long userId, Long workspaceId) {
        permissionService.requireAdmin(userId, workspaceId);

        return invitationRepository.findPending(workspaceId, LocalDateTime.now()).stream()
                .map(invitationMapper::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public void cancelInvitation(Long userId, Long workspaceId, Long invitationId) {
        permissionService.requireAdmin(userId, workspaceId);

        WorkspaceInvitation invitation = findInWorkspace(invitationId, workspaceId);
        if (invitation.isAccepted()) {
            throw new InvitationAlreadyAcceptedException("Cannot cancel an invitation that has already been accepted");
        }

        invitationRepository.delete(invitation);
        log.info("Invitation cancelled: id={}, workspace={}, by user={}", invitationId, workspaceId, userId);
    }

    /**
     * Public lookup for the accept page. Needs no authentication, so it exposes no token or ids.
     */
    public InvitationInfoResponse getInvitationInfo(String token) {
        WorkspaceInvitation invitation = invitationRepository.findByToken(token)
                .orElseThrow(() -> new InvitationNotFoundException("Invitation not found"));
        return invitationMapper.toInfo(invitation);
    }

    /**
     * An invitation that belongs to another workspace is reported as no access, not as missing.
     */
    private WorkspaceInvitation findInWorkspace(Long invitationId, Long workspaceId) {
        return invitationRepository.findByIdAndWorkspaceId(invitationId, workspaceId)
                .orElseThrow(() -> {
                    if (invitationRepository.existsById(invitationId)) {
                        log.warn("Access denied: invitation={} is outside workspace={}", invitationId, workspaceId);
                        return new AccessDeniedException(PermissionService.NO_ACCESS_MESSAGE);
                    }
                    return new InvitationNotFoundException("Invitation not found with id: " + invitationId);
                });
    }

    private WorkspaceInvitation createInvitation(User inviter, Long workspaceId, WorkspaceInviteRequest request) {
        permissionService.requireAdmin(inviter.getId(), workspaceId);

        String email = normalizeEmail(request.getEmail());
        WorkspaceRole role = request.getRole() == null ? WorkspaceRole.MEMBER : request.getRole();

        // serializes concurrent invites for the same workspace
        Workspace workspace = workspaceRepository.findByIdForUpdate(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException("Workspace not found with id: " + workspaceId));

        if (workspaceMemberRepository.countByWorkspaceIdAndEmail(workspaceId, email) > 0) {
            throw new AlreadyWorkspaceMemberException("User is already a member of this workspace");
        }
        LocalDateTime now = LocalDateTime.now();
        if (invitationRepository.existsPending(workspaceId, email, now)) {
            throw new InvitationAlreadyPendingException("An invitation is already pending for this email");
        }

        return invitationRepository.save(WorkspaceInvitation.builder()
                .workspace(workspace)
                .inviter(inviter)
                .email(email)
                .role(role)
                .token(tokenGenerator.generate())
                .expiresAt(now.plusDays(properties.getInvitation().getExpiryDays()))
                .build());
    }

    private String normalizeEmail(String email) {
        String normalized = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
        if (!EMAIL_PATTERN.matcher(normalized).matches()) {
            throw new InvalidRequestException("Invalid email address");
        }
        return normalized;
    }

    private AcceptInvitationResponse acceptResponse(String message, Workspace workspace, WorkspaceRole role,
                                                    boolean needsOnboarding) {
        return AcceptInvitationResponse.builder()
                .message(message)
                .workspaceId(workspace.getId())
                .workspaceName(workspace.getName())
                .role(role)
                .needsOnboarding(needsOnboarding)
                .build();
    }
}
