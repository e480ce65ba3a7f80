package com.bookstay.auth.controller;

import com.bookstay.auth.dto.CreateUserRequest;
import com.bookstay.auth.service.UsersService;
import com.bookstay.common.dto.ApiResponse;
import com.bookstay.common.dto.UserDto;
import com.bookstay.common.security.CurrentUser;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class UsersController {

    private final UsersService usersService;

    // 회원가입 - 이메일 중복 시 409
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<UserDto> createUser(@Valid @RequestBody CreateUserRequest request) {
        return ApiResponse.ok(usersService.register(request.email(), request.password()));
    }

    // 현재 로그인한 사용자 - LocalJwtAuthGuard가 보호
    @GetMapping("/me")
    public ApiResponse<UserDto> getCurrentUser(@CurrentUser UserDto user) {
        return ApiResponse.ok(user);
    }

    // id로 사용자 조회 - 없으면 404
    @GetMapping("/{id}")
    public ApiResponse<UserDto> getUser(@PathVariable String id) {
        return ApiResponse.ok(usersService.getUser(id));
    }
}
