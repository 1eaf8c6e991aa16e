package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.User;
import com.backoffice.domain.vo.Email;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface JpaUserRepository extends JpaRepository<User, Long> {
    Optional<User> findByEmail(Email email);

    boolean existsByEmail(Email email);
}
