package isms.ismsbackend.filter;

import isms.ismsbackend.common.AuthenticatedActor;
import isms.ismsbackend.provider.JwtProvider;
import isms.ismsbackend.repository.UserRepository;
import isms.ismsbackend.support.DocumentFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JwtAuthenticationFilterTest {

    @Mock
    private UserRepository userRepository;

    private JwtProvider jwtProvider;
    private JwtAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        jwtProvider = new JwtProvider("test-secret-key-test-secret-key-test-secret-key-0123",
                3_600_000L, DocumentFixtures.fixedClock());
        filter = new JwtAuthenticationFilter(jwtProvider, userRepository);
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void validToken_registersActorPrincipal() throws Exception {
        when(userRepository.findById("user-1")).thenReturn(Optional.of(DocumentFixtures.owner()));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/documents");
        request.addHeader("Authorization", "Bearer " + jwtProvider.create("user-1", "owner@example.com"));
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getPrincipal()).isInstanceOfSatisfying(AuthenticatedActor.class, actor -> {
            assertThat(actor.getUserId()).isEqualTo("user-1");
            assertThat(actor.getEmail()).isEqualTo("owner@example.com");
        });
        assertThat(authentication.getAuthorities()).extracting("authority").containsExactly("ROLE_EDITOR");
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    void unknownUser_leavesRequestAnonymous() throws Exception {
        when(userRepository.findById("ghost")).thenReturn(Optional.empty());
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/documents");
        request.addHeader("Authorization", "Bearer " + jwtProvider.create("ghost", null));

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    void missingHeader_skipsLookup() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(new MockHttpServletRequest("GET", "/api/documents"), new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(chain.getRequest()).isNotNull();
        verifyNoInteractions(userRepository);
    }
}
