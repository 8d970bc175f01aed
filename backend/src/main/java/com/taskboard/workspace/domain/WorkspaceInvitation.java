package com.taskboard.workspace.domain;

import com.taskboard.user.domain.User;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Pending invitations are the rows with {@code acceptedAt == null} and a future {@code expiresAt}.
 * Cancelling an invitation deletes the row.
 */
@Entity
@Table(name = "workspace_invitations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WorkspaceInvitation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "workspace_id", nullable = false)
    private Workspace workspace;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "invited_by", nullable = false)
    private User inviter;

    @Column(nullable = false)
    private String email;

    @Column(nullable = false, length = 20)
    private WorkspaceRole role;

    @Column(nullable = false, unique = true, length = 64)
    private String token;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime acceptedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    @Builder
    public WorkspaceInvitation(Workspace workspace, User inviter, String email, WorkspaceRole role,
                               String token, LocalDateTime expiresAt) {
        this.workspace = workspace;
        this.inviter = inviter;
        this.email = email;
        this.role = role;
        this.token = token;
        this.expiresAt = expiresAt;
    }

    public void accept() {
        if (isAccepted()) {
            throw new IllegalStateException("Invitation has already been accepted");
        }
        this.acceptedAt = LocalDateTime.now();
    }

    public boolean isAccepted() {
        return acceptedAt != null;
    }

    public boolean isExpired() {
        return LocalDateTime.now().isAfter(expiresAt);
    }

    public boolean isPending() {
        return !isAccepted() && !isExpired();
    }

    public InvitationStatus getStatus() {
        if (isAccepted()) {
            return InvitationStatus.ACCEPTED;
        }
        return isExpired() ? InvitationStatus.EXPIRED : InvitationStatus.PENDING;
    }
}
