package com.backoffice.domain.repository;

import com.backoffice.domain.entity.User;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface UserRepository {

    User save(User user);

    Optional<User> findById(Long id);

    default User getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> new BusinessException(ResponseCode.USER_NOT_FOUND));
    }

    /**
     * 활성 사용자만 조회합니다. 비활성 사용자는 존재하지 않는 사용자와 동일하게 취급합니다.
     */
    default User getActiveByIdOrThrow(Long id) {
        return findById(id)
                .filter(User::isActive)
                .orElseThrow(() -> new BusinessException(ResponseCode.USER_NOT_FOUND));
    }

    List<User> findAllById(Collection<Long> ids);

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);
}
