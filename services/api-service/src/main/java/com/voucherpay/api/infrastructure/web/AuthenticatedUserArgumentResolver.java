package com.voucherpay.api.infrastructure.web;

import com.voucherpay.observability.CorrelationContextHolder;
import com.voucherpay.pipeline.PipelineExchange;
import com.voucherpay.security.AuthenticatedUser;
import com.voucherpay.security.BearerTokenExtractor;
import com.voucherpay.security.ClaimSet;
import com.voucherpay.security.SessionTokenVerifier;
import com.voucherpay.security.TokenType;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link AuthenticatedUser} controller parameters from the bearer access token.
 *
 * <p>A missing, malformed, expired, tampered or non-access token raises
 * {@link com.voucherpay.security.UnauthenticatedException}, which the
 * {@link GlobalExceptionHandler} turns into a uniform 401. On success the user id is bound to
 * the logging context and to the pipeline exchange for analytics.
 */
@Component
public class AuthenticatedUserArgumentResolver implements HandlerMethodArgumentResolver {

    private final SessionTokenVerifier verifier;

    public AuthenticatedUserArgumentResolver(SessionTokenVerifier verifier) {
        this.verifier = verifier;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AuthenticatedUser.class.equals(parameter.getParameterType());
    }

    @Override
    public AuthenticatedUser resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        String token = BearerTokenExtractor.require(webRequest.getHeader(HttpHeaders.AUTHORIZATION));
        ClaimSet claims = verifier.verify(token, TokenType.ACCESS);
        AuthenticatedUser user = AuthenticatedUser.from(claims);

        CorrelationContextHolder.bindUser(user.userId());
        HttpServletRequest servletRequest = webRequest.getNativeRequest(HttpServletRequest.class);
        if (servletRequest != null
                && servletRequest.getAttribute(MiddlewarePipelineFilter.EXCHANGE_ATTRIBUTE) instanceof PipelineExchange exchange) {
            exchange.bindUser(user.userId());
        }
        return user;
    }
}
