package com.taskboard.category.repository;

import com.taskboard.category.domain.Category;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface CategoryRepository extends JpaRepository<Category, Long> {

    List<Category> findByWorkspaceIdOrderByPositionAsc(Long workspaceId);

    Optional<Category> findByIdAndWorkspaceId(Long id, Long workspaceId);

    long countByWorkspaceId(Long workspaceId);

    boolean existsByWorkspaceIdAndNameIgnoreCase(Long workspaceId, String name);

    boolean existsByWorkspaceIdAndNameIgnoreCaseAndIdNot(Long workspaceId, String name, Long id);

    /**
     * SELECT ... FOR UPDATE on the category row. Serializes task position changes inside it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from Category c where c.id = :id")
    Optional<Category> findByIdForUpdate(@Param("id") Long id);

    @Query("select coalesce(max(c.position), -1) from Category c where c.workspace.id = :workspaceId")
    int findMaxPosition(@Param("workspaceId") Long workspaceId);

    @Query("select count(c) from Category c where c.workspace.id = :workspaceId and c.id <> :excludedId")
    long countExcluding(@Param("workspaceId") Long workspaceId, @Param("excludedId") Long excludedId);

    @Query("select c.id from Category c where c.workspace.id = :workspaceId order by c.position")
    List<Long> findIdsByWorkspaceId(@Param("workspaceId") Long workspaceId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Category c set c.position = c.position + 1 "
            + "where c.workspace.id = :workspaceId and c.position >= :from and c.id <> :excludedId")
    int shiftUp(@Param("workspaceId") Long workspaceId, @Param("from") int from,
                @Param("excludedId") Long excludedId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Category c set c.position = c.position - 1 "
            + "where c.workspace.id = :workspaceId and c.position > :after and c.id <> :excludedId")
    int shiftDown(@Param("workspaceId") Long workspaceId, @Param("after") int after,
                  @Param("excludedId") Long excludedId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Category c set c.position = :position where c.id = :id")
    int updatePosition(@Param("id") Long id, @Param("position") int position);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Category c where c.workspace.id = :workspaceId")
    int deleteByWorkspaceId(@Param("workspaceId") Long workspaceId);
}
