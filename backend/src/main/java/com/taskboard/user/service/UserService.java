package com.taskboard.user.service;

import com.taskboard.exception.UserNotFoundException;
import com.taskboard.user.domain.User;
import com.taskboard.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Users are owned by the identity provider; this service only mirrors them locally.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserService {

    private final UserRepository userRepository;

    /**
     * Finds user by authUserId or registers it from the token claims on first sight.
     */
    @Transactional
    public User findOrCreateUser(String authUserId, String email, String name) {
        return userRepository.findByAuthUserId(authUserId)
                .orElseGet(() -> createUser(authUserId, email, name));
    }

    public User findByAuthUserId(String authUserId) {
        return userRepository.findByAuthUserId(authUserId)
                .orElseThrow(() -> new UserNotFoundException("User not found with authUserId: " + authUserId));
    }

    public User findById(Long id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new UserNotFoundException("User not found with id: " + id));
    }

    public Optional<User> findByEmail(String email) {
        return userRepository.findByEmailIgnoreCase(email);
    }

    @Transactional
    public User createUser(String authUserId, String email, String name) {
        User newUser = User.builder()
                .authUserId(authUserId)
                .email(email)
                .name(name)
                .build();
        User saved = userRepository.save(newUser);
        log.info("Registered user: id={}, authUserId={}", saved.getId(), authUserId);
        return saved;
    }

    /**
     * Dev profile users get a synthetic @dev.local address.
     */
    @Transactional
    public User findOrCreateDevUser(String authUserId) {
        return findOrCreateUser(authUserId, authUserId + "@dev.local", authUserId);
    }
}
