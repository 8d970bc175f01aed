package com.taskboard.workspace.repository;

import com.taskboard.workspace.domain.WorkspaceMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface WorkspaceMemberRepository extends JpaRepository<WorkspaceMember, Long> {

    boolean existsByWorkspaceIdAndUserId(Long workspaceId, Long userId);

    Optional<WorkspaceMember> findByWorkspaceIdAndUserId(Long workspaceId, Long userId);

    Optional<WorkspaceMember> findByIdAndWorkspaceId(Long id, Long workspaceId);

    long countByWorkspaceId(Long workspaceId);

    /**
     * All memberships of a user, with the workspace fetched for listing.
     */
    @Query("select m from WorkspaceMember m join fetch m.workspace where m.user.id = :userId order by m.joinedAt")
    List<WorkspaceMember> findByUserIdWithWorkspace(@Param("userId") Long userId);

    @Query("select m from WorkspaceMember m join fetch m.user where m.workspace.id = :workspaceId order by m.joinedAt")
    List<WorkspaceMember> findByWorkspaceIdWithUser(@Param("workspaceId") Long workspaceId);

    @Query("select count(m) from WorkspaceMember m where m.workspace.id = :workspaceId and lower(m.user.email) = lower(:email)")
    long countByWorkspaceIdAndEmail(@Param("workspaceId") Long workspaceId, @Param("email") String email);

    /**
     * Number of members per workspace, for the given workspace ids.
     */
    @Query("select m.workspace.id as workspaceId, count(m) as memberCount from WorkspaceMember m "
            + "where m.workspace.id in :workspaceIds group by m.workspace.id")
    List<MemberCount> countByWorkspaceIds(@Param("workspaceIds") Collection<Long> workspaceIds);

    /**
     * Number of user ids in {@code userIds} that are members of the workspace.
     */
    @Query("select count(m) from WorkspaceMember m where m.workspace.id = :workspaceId and m.user.id in :userIds")
    long countMembersAmong(@Param("workspaceId") Long workspaceId, @Param("userIds") Collection<Long> userIds);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from WorkspaceMember m where m.workspace.id = :workspaceId")
    int deleteByWorkspaceId(@Param("workspaceId") Long workspaceId);

    interface MemberCount {
        Long getWorkspaceId();

        long getMemberCount();
    }
}
