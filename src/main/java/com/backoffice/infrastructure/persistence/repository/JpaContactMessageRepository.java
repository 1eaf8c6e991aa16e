package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.ContactMessage;
import org.springframework.data.jpa.repository.JpaRepository;

public interface JpaContactMessageRepository extends JpaRepository<ContactMessage, Long> {

    long countByReadFalse();
}
