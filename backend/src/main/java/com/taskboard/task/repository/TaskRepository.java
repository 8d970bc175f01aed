package com.taskboard.task.repository;

import com.taskboard.category.domain.Category;
import com.taskboard.task.domain.Task;
import com.taskboard.task.domain.TaskStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TaskRepository extends JpaRepository<Task, Long>, JpaSpecificationExecutor<Task> {

    Optional<Task> findByIdAndWorkspaceId(Long id, Long workspaceId);

    List<Task> findByParentTaskIdOrderByPositionAsc(Long parentTaskId);

    long countByWorkspaceId(Long workspaceId);

    /**
     * Tasks referencing the category. Used by the category deletion guard.
     */
    long countByCategoryId(Long categoryId);

    @Query("select t.category.id as categoryId, count(t) as taskCount from Task t "
            + "where t.category.id in :categoryIds group by t.category.id")
    List<CategoryTaskCount> countByCategoryIds(@Param("categoryIds") Collection<Long> categoryIds);

    @Query("select t.parentTask.id as parentTaskId, count(t) as subtaskCount, "
            + "sum(case when t.status = :completed then 1 else 0 end) as completedSubtaskCount "
            + "from Task t where t.parentTask.id in :parentIds group by t.parentTask.id")
    List<SubtaskCount> countSubtasks(@Param("parentIds") Collection<Long> parentIds,
                                     @Param("completed") TaskStatus completed);

    /**
     * SELECT ... FOR UPDATE on a parent task row. Serializes subtask position changes.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from Task t where t.id = :id")
    Optional<Task> findByIdForUpdate(@Param("id") Long id);

    // ========== category scope (top-level tasks) ==========

    @Query("select coalesce(max(t.position), -1) from Task t "
            + "where t.category.id = :categoryId and t.parentTask is null")
    int findMaxPositionInCategory(@Param("categoryId") Long categoryId);

    @Query("select count(t) from Task t "
            + "where t.category.id = :categoryId and t.parentTask is null and t.id <> :excludedId")
    long countInCategoryExcluding(@Param("categoryId") Long categoryId, @Param("excludedId") Long excludedId);

    @Query("select t.id from Task t where t.category.id = :categoryId and t.parentTask is null order by t.position")
    List<Long> findIdsInCategory(@Param("categoryId") Long categoryId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Task t set t.position = t.position + 1 where t.category.id = :categoryId "
            + "and t.parentTask is null and t.position >= :from and t.id <> :excludedId")
    int shiftUpInCategory(@Param("categoryId") Long categoryId, @Param("from") int from,
                          @Param("excludedId") Long excludedId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Task t set t.position = t.position - 1 where t.category.id = :categoryId "
            + "and t.parentTask is null and t.position > :after and t.id <> :excludedId")
    int shiftDownInCategory(@Param("categoryId") Long categoryId, @Param("after") int after,
                            @Param("excludedId") Long excludedId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Task t set t.category = :category, t.position = :position where t.id = :id")
    int placeInCategory(@Param("id") Long id, @Param("category") Category category,
                        @Param("position") int position);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Task t set t.category = null, t.position = 0 where t.id = :id")
    int detachFromCategory(@Param("id") Long id);

    // ========== parent scope (subtasks) ==========

    @Query("select coalesce(max(t.position), -1) from Task t where t.parentTask.id = :parentTaskId")
    int findMaxPositionInParent(@Param("parentTaskId") Long parentTaskId);

    @Query("select count(t) from Task t where t.parentTask.id = :parentTaskId and t.id <> :excludedId")
    long countInParentExcluding(@Param("parentTaskId") Long parentTaskId, @Param("excludedId") Long excludedId);

    @Query("select t.id from Task t where t.parentTask.id = :parentTaskId order by t.position")
    List<Long> findIdsInParent(@Param("parentTaskId") Long parentTaskId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Task t set t.position = t.position + 1 where t.parentTask.id = :parentTaskId "
            + "and t.position >= :from and t.id <> :excludedId")
    int shiftUpInParent(@Param("parentTaskId") Long parentTaskId, @Param("from") int from,
                        @Param("excludedId") Long excludedId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Task t set t.position = t.position - 1 where t.parentTask.id = :parentTaskId "
            + "and t.position > :after and t.id <> :excludedId")
    int shiftDownInParent(@Param("parentTaskId") Long parentTaskId, @Param("after") int after,
                          @Param("excludedId") Long excludedId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Task t set t.position = :position where t.id = :id")
    int updatePosition(@Param("id") Long id, @Param("position") int position);

    /**
     * Unassigns a departing member from every task of the workspace.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "delete from task_assignments where user_id = :userId "
            + "and task_id in (select id from tasks where workspace_id = :workspaceId)",
            nativeQuery = true)
    int deleteAssignmentsOfUser(@Param("workspaceId") Long workspaceId, @Param("userId") Long userId);

    // ========== workspace deletion ==========

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "delete from task_assignments where task_id in (select id from tasks where workspace_id = :workspaceId)",
            nativeQuery = true)
    int deleteAssignmentsByWorkspaceId(@Param("workspaceId") Long workspaceId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Task t where t.workspace.id = :workspaceId and t.parentTask is not null")
    int deleteSubtasksByWorkspaceId(@Param("workspaceId") Long workspaceId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Task t where t.workspace.id = :workspaceId and t.parentTask is null")
    int deleteTopLevelByWorkspaceId(@Param("workspaceId") Long workspaceId);

    interface CategoryTaskCount {
        Long getCategoryId();

        long getTaskCount();
    }

    interface SubtaskCount {
        Long getParentTaskId();

        long getSubtaskCount();

        long getCompletedSubtaskCount();
    }
}
