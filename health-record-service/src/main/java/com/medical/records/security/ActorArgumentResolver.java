package com.medical.records.security;

import com.medical.records.exception.UnauthorizedException;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Locale;

/**
 * Builds the {@link Actor} of a request from the identity headers set by the authentication gateway.
 * The headers are trusted as-is.
 */
public class ActorArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String ACTOR_ID_HEADER = "X-Actor-Id";
    public static final String ACTOR_ROLE_HEADER = "X-Actor-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Actor.class.equals(parameter.getParameterType());
    }

    @Override
    public Actor resolveArgument(MethodParameter parameter,
                                 ModelAndViewContainer mavContainer,
                                 NativeWebRequest webRequest,
                                 WebDataBinderFactory binderFactory) {
        String id = webRequest.getHeader(ACTOR_ID_HEADER);
        String role = webRequest.getHeader(ACTOR_ROLE_HEADER);
        if (id == null || id.trim().isEmpty() || role == null) {
            throw new UnauthorizedException("UNAUTHENTICATED");
        }
        try {
            return new Actor(id.trim(), Actor.Role.valueOf(role.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("UNAUTHENTICATED");
        }
    }
}
