package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.User;
import com.backoffice.domain.repository.UserRepository;
import com.backoffice.domain.vo.Email;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class UserRepositoryImpl implements UserRepository {

    private final JpaUserRepository jpaUserRepository;

    @Override
    public User save(User user) {
        return jpaUserRepository.save(user);
    }

    @Override
    public Optional<User> findById(Long id) {
        return jpaUserRepository.findById(id);
    }

    @Override
    public List<User> findAllById(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jpaUserRepository.findAllById(ids);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return jpaUserRepository.findByEmail(Email.of(email));
    }

    @Override
    public boolean existsByEmail(String email) {
        return jpaUserRepository.existsByEmail(Email.of(email));
    }
}
