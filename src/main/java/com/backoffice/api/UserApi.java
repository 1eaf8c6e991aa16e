package com.backoffice.api;

import com.backoffice.application.dto.UserLoginRequest;
import com.backoffice.application.dto.UserRegisterRequest;
import com.backoffice.application.dto.UserResponse;
import com.backoffice.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@Tag(name = "User", description = "사용자 API")
@RequestMapping("/api/users")
public interface UserApi {

    @Operation(summary = "사용자 등록")
    @PostMapping
    ApiResponse<UserResponse> register(@Valid @RequestBody UserRegisterRequest request);

    @Operation(summary = "로그인", description = "이메일과 비밀번호를 확인하고 사용자 정보를 반환합니다.")
    @PostMapping("/login")
    ApiResponse<UserResponse> login(@Valid @RequestBody UserLoginRequest request);

    @Operation(summary = "사용자 조회")
    @GetMapping("/{userId}")
    ApiResponse<UserResponse> getUser(
            @Parameter(description = "사용자 ID", required = true, example = "1")
            @PathVariable Long userId
    );

    @Operation(summary = "사용자 비활성화")
    @DeleteMapping("/{userId}")
    ApiResponse<UserResponse> deactivate(
            @Parameter(description = "사용자 ID", required = true, example = "1")
            @PathVariable Long userId
    );
}
