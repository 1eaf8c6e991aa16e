package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.ContactMessage;
import com.backoffice.domain.repository.ContactMessageRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ContactMessageRepositoryImpl implements ContactMessageRepository {

    private final JpaContactMessageRepository jpaContactMessageRepository;
    private final EntityManager entityManager;

    @Override
    public ContactMessage save(ContactMessage contactMessage) {
        return jpaContactMessageRepository.save(contactMessage);
    }

    @Override
    public Optional<ContactMessage> findById(Long id) {
        return jpaContactMessageRepository.findById(id);
    }

    @Override
    public List<ContactMessage> search(Boolean read, int limit, int offset) {
        String jpql = "SELECT c FROM ContactMessage c"
                + (read != null ? " WHERE c.read = :read" : "")
                + " ORDER BY c.createdAt DESC, c.id DESC";

        TypedQuery<ContactMessage> query = entityManager.createQuery(jpql, ContactMessage.class);
        if (read != null) {
            query.setParameter("read", read);
        }
        return query.setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    public long countUnread() {
        return jpaContactMessageRepository.countByReadFalse();
    }

    @Override
    public void delete(ContactMessage contactMessage) {
        jpaContactMessageRepository.delete(contactMessage);
    }
}
