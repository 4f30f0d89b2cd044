package com.gatehouse.api.infrastructure.web;

import com.gatehouse.api.application.AuthMetrics;
import com.gatehouse.observability.CorrelationContextHolder;
import com.gatehouse.security.AccessDecision;
import com.gatehouse.security.AccessGuard;
import com.gatehouse.security.AccessGuardFactory;
import com.gatehouse.security.Principal;
import com.gatehouse.security.Scope;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link CurrentUser} parameters by running the route's {@link AccessGuard}.
 *
 * <p>One guard is built per distinct scope set and cached. A granted request binds the user ID to
 * the correlation context; a denied one is counted and thrown as {@link AccessDeniedException}.
 */
@Component
public class CurrentUserArgumentResolver implements HandlerMethodArgumentResolver {

    private final AccessGuardFactory guardFactory;
    private final AuthMetrics metrics;
    private final Map<GuardKey, AccessGuard> guards = new ConcurrentHashMap<>();

    public CurrentUserArgumentResolver(AccessGuardFactory guardFactory, AuthMetrics metrics) {
        this.guardFactory = guardFactory;
        this.metrics = metrics;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentUser.class)
                && Principal.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {

        CurrentUser annotation = parameter.getParameterAnnotation(CurrentUser.class);
        AccessGuard guard = guardFor(List.of(annotation.value()), annotation.requireActive());

        AccessDecision decision = guard.authorize(webRequest.getHeader(HttpHeaders.AUTHORIZATION));
        if (!decision.isGranted()) {
            metrics.recordDenial(decision.denial().reason());
            throw new AccessDeniedException(decision.denial());
        }
        CorrelationContextHolder.bindUser(decision.principal().id());
        return decision.principal();
    }

    AccessGuard guardFor(List<Scope> scopes, boolean requireActive) {
        return guards.computeIfAbsent(new GuardKey(scopes, requireActive), key -> key.requireActive()
                ? guardFactory.requiringActive(key.scopes())
                : guardFactory.requiring(key.scopes()));
    }

    private record GuardKey(List<Scope> scopes, boolean requireActive) {}
}
