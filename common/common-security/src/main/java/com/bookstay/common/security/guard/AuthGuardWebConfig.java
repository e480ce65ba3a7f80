package com.bookstay.common.security.guard;

import com.bookstay.common.security.CurrentUserArgumentResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * 위임 인증 가드를 보호 대상 경로에 등록한다.
 *
 * <pre>
 * auth:
 *   guard:
 *     path-patterns: /reservations/**
 *     exclude-patterns: /rpc/**, /error
 * </pre>
 */
@Configuration
@RequiredArgsConstructor
public class AuthGuardWebConfig implements WebMvcConfigurer {

    private final JwtAuthGuard jwtAuthGuard;

    @Value("${auth.guard.path-patterns:/**}")
    private String[] pathPatterns;

    @Value("${auth.guard.exclude-patterns:/rpc/**,/error}")
    private String[] excludePatterns;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(jwtAuthGuard)
                .addPathPatterns(pathPatterns)
                .excludePathPatterns(excludePatterns);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new CurrentUserArgumentResolver());
    }
}
