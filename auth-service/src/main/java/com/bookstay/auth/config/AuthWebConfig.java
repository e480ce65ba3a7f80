package com.bookstay.auth.config;

import com.bookstay.auth.security.LocalJwtAuthGuard;
import com.bookstay.common.security.CurrentUserArgumentResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
@RequiredArgsConstructor
public class AuthWebConfig implements WebMvcConfigurer {

    private final LocalJwtAuthGuard localJwtAuthGuard;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        // 회원가입(POST /users)과 로그인은 공개, 사용자 조회(/users/me, /users/{id})만 보호
        registry.addInterceptor(localJwtAuthGuard)
                .addPathPatterns("/users/*");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new CurrentUserArgumentResolver());
    }
}
