package com.taskboard.user.repository;

import com.taskboard.user.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByAuthUserId(String authUserId);

    /**
     * Invitation emails are stored lowercase, user emails may not be.
     */
    Optional<User> findByEmailIgnoreCase(String email);
}
