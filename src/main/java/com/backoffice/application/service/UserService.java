package com.backoffice.application.service;

import com.backoffice.application.dto.UserLoginRequest;
import com.backoffice.application.dto.UserRegisterRequest;
import com.backoffice.application.dto.UserResponse;
import com.backoffice.domain.entity.User;
import com.backoffice.domain.repository.UserRepository;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Transactional
    public UserResponse register(UserRegisterRequest request) {
        if (userRepository.existsByEmail(request.email())) {
            throw new BusinessException(ResponseCode.USER_EMAIL_DUPLICATED);
        }

        User user = new User(request.email(), passwordEncoder.encode(request.password()),
                request.firstName(), request.lastName(), request.role());
        userRepository.save(user);

        log.info("사용자 등록: userId={}, role={}", user.getId(), user.getRole());
        return UserResponse.from(user);
    }

    /**
     * 이메일과 비밀번호로 로그인합니다.
     *
     * 이메일이 없거나 비밀번호가 틀리면 같은 USER_INVALID_CREDENTIALS로 응답하고,
     * 자격 증명이 맞더라도 비활성 사용자는 USER_NOT_FOUND로 응답합니다.
     */
    @Transactional(readOnly = true)
    public UserResponse login(UserLoginRequest request) {
        User user = userRepository.findByEmail(request.email())
                .filter(found -> passwordEncoder.matches(request.password(), found.getPasswordHash()))
                .orElseThrow(() -> new BusinessException(ResponseCode.USER_INVALID_CREDENTIALS));

        if (!user.isActive()) {
            log.warn("비활성 사용자 로그인 시도: userId={}", user.getId());
            throw new BusinessException(ResponseCode.USER_NOT_FOUND);
        }

        log.info("로그인: userId={}", user.getId());
        return UserResponse.from(user);
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(Long userId) {
        return UserResponse.from(userRepository.getByIdOrThrow(userId));
    }

    /**
     * 사용자를 비활성화합니다. 비활성 사용자는 주문할 수 없습니다.
     */
    @Transactional
    public UserResponse deactivate(Long userId) {
        User user = userRepository.getByIdOrThrow(userId);
        user.deactivate();
        userRepository.save(user);

        log.info("사용자 비활성화: userId={}", userId);
        return UserResponse.from(user);
    }
}
