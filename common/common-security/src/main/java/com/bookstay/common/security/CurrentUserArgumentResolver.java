package com.bookstay.common.security;

import com.bookstay.common.dto.UserDto;
import com.bookstay.common.exception.BusinessException;
import com.bookstay.common.exception.ErrorCode;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * {@link CurrentUser} 파라미터를 요청 속성 {@value #USER_ATTRIBUTE}에서 꺼내 주입한다.
 */
public class CurrentUserArgumentResolver implements HandlerMethodArgumentResolver {

    /** 가드가 인증된 사용자를 저장하는 요청 속성 키 */
    public static final String USER_ATTRIBUTE = "user";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentUser.class)
                && UserDto.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        Object user = webRequest.getAttribute(USER_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (user instanceof UserDto userDto) {
            return userDto;
        }
        // 가드가 적용되지 않은 경로에서 @CurrentUser를 쓴 경우
        throw new BusinessException(ErrorCode.UNAUTHORIZED);
    }
}
