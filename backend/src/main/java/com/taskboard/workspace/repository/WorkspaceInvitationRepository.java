package com.taskboard.workspace.repository;

import com.taskboard.workspace.domain.WorkspaceInvitation;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface WorkspaceInvitationRepository extends JpaRepository<WorkspaceInvitation, Long> {

    @Query("select i from WorkspaceInvitation i join fetch i.workspace join fetch i.inviter where i.token = :token")
    Optional<WorkspaceInvitation> findByToken(@Param("token") String token);

    /**
     * Row lock on the invitation, held until the accepting transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from WorkspaceInvitation i where i.token = :token")
    Optional<WorkspaceInvitation> findByTokenForUpdate(@Param("token") String token);

    Optional<WorkspaceInvitation> findByIdAndWorkspaceId(Long id, Long workspaceId);

    @Query("select count(i) > 0 from WorkspaceInvitation i where i.workspace.id = :workspaceId "
            + "and i.email = :email and i.acceptedAt is null and i.expiresAt > :now")
    boolean existsPending(@Param("workspaceId") Long workspaceId,
                          @Param("email") String email,
                          @Param("now") LocalDateTime now);

    @Query("select i from WorkspaceInvitation i join fetch i.inviter where i.workspace.id = :workspaceId "
            + "and i.acceptedAt is null and i.expiresAt > :now order by i.createdAt desc")
    List<WorkspaceInvitation> findPending(@Param("workspaceId") Long workspaceId,
                                          @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from WorkspaceInvitation i where i.workspace.id = :workspaceId")
    int deleteByWorkspaceId(@Param("workspaceId") Long workspaceId);
}
