package com.taskboard.onboarding.service;

import com.taskboard.workspace.event.MemberJoinedEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Creates the onboarding row for a new member once the membership is committed.
 * Runs in its own transaction; a failure is logged and never undoes the membership.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OnboardingInitializer {

    private static final String INSERT_PROGRESS_SQL = """
            INSERT INTO workspace_onboarding_progress
                (workspace_id, user_id, current_step, steps_completed, created_at, updated_at)
            VALUES (?, ?, 1, '', NOW(), NOW())
            ON CONFLICT (workspace_id, user_id) DO NOTHING
            """;

    private final JdbcTemplate jdbcTemplate;
    private final MeterRegistry meterRegistry;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onMemberJoined(MemberJoinedEvent event) {
        try {
            int inserted = jdbcTemplate.update(INSERT_PROGRESS_SQL, event.workspaceId(), event.userId());
            log.debug("Onboarding initialized: workspace={}, user={}, inserted={}",
                    event.workspaceId(), event.userId(), inserted);
        } catch (Exception e) {
            log.warn("Onboarding initialization failed (non-fatal): workspace={}, user={}",
                    event.workspaceId(), event.userId(), e);
            meterRegistry.counter("taskboard.onboarding.init.failed").increment();
        }
    }
}
