package isms.ismsbackend.controller;

import isms.ismsbackend.common.AuthenticatedActor;
import org.springframework.security.core.Authentication;

/**
 * 인증 정보 → 감사용 사용자 식별자
 */
final class ActorResolver {

    private ActorResolver() {
    }

    static AuthenticatedActor from(Authentication authentication) {
        if (authentication.getPrincipal() instanceof AuthenticatedActor actor) {
            return actor;
        }
        return new AuthenticatedActor(authentication.getName(), null);
    }
}
