package com.backoffice.interfaces.controller;

import com.backoffice.api.UserApi;
import com.backoffice.application.dto.UserLoginRequest;
import com.backoffice.application.dto.UserRegisterRequest;
import com.backoffice.application.dto.UserResponse;
import com.backoffice.application.service.UserService;
import com.backoffice.dto.ApiResponse;
import com.backoffice.dto.ResponseCode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class UserController implements UserApi {

    private final UserService userService;

    @Override
    public ApiResponse<UserResponse> register(UserRegisterRequest request) {
        return ApiResponse.of(ResponseCode.USER_CREATED, userService.register(request));
    }

    @Override
    public ApiResponse<UserResponse> login(UserLoginRequest request) {
        return ApiResponse.of(ResponseCode.USER_LOGGED_IN, userService.login(request));
    }

    @Override
    public ApiResponse<UserResponse> getUser(Long userId) {
        return ApiResponse.of(ResponseCode.USER_SUCCESS, userService.getUser(userId));
    }

    @Override
    public ApiResponse<UserResponse> deactivate(Long userId) {
        return ApiResponse.of(ResponseCode.USER_DEACTIVATED, userService.deactivate(userId));
    }
}
