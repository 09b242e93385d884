package com.sparta.farmshare.presentation.auth;

import com.sparta.farmshare.domain.auth.exception.UnauthorizedException;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * @LoginUser AuthUser 파라미터 해석
 * JwtAuthInterceptor가 저장한 요청 속성을 꺼낸다
 */
public class LoginUserArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(LoginUser.class)
                && AuthUser.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        Object authUser = webRequest.getAttribute(JwtAuthInterceptor.AUTH_USER_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (authUser == null) {
            throw new UnauthorizedException();
        }
        return authUser;
    }
}
