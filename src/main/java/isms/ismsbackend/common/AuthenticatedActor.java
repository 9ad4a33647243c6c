package isms.ismsbackend.common;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.AuthenticatedPrincipal;

/**
 * 요청을 수행한 사용자. 감사 필드(createdBy/updatedBy) 기록에만 사용한다.
 */
@Getter
@RequiredArgsConstructor
public class AuthenticatedActor implements AuthenticatedPrincipal {

    private final String userId;
    private final String email;

    @Override
    public String getName() {
        return userId;
    }

    @Override
    public String toString() {
        return userId;
    }
}
