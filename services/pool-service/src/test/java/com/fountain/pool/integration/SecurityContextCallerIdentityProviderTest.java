package com.fountain.pool.integration;

import com.fountain.pool.exception.UnauthorizedOperationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SecurityContextCallerIdentityProvider Tests")
class SecurityContextCallerIdentityProviderTest {

    private final SecurityContextCallerIdentityProvider provider = new SecurityContextCallerIdentityProvider();

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("Should use the authenticated principal's name as the account")
    void shouldReturnPrincipalName() {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken("alice", "n/a", List.of()));

        assertThat(provider.currentAccount()).isEqualTo("alice");
    }

    @Test
    @DisplayName("Should reject a missing authentication")
    void shouldRejectMissingAuthentication() {
        assertThatThrownBy(provider::currentAccount).isInstanceOf(UnauthorizedOperationException.class);
    }

    @Test
    @DisplayName("Should reject unauthenticated and anonymous callers")
    void shouldRejectUnauthenticatedCallers() {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken("alice", "n/a"));
        assertThatThrownBy(provider::currentAccount).isInstanceOf(UnauthorizedOperationException.class);

        SecurityContextHolder.getContext().setAuthentication(new AnonymousAuthenticationToken(
                "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS")));
        assertThatThrownBy(provider::currentAccount).isInstanceOf(UnauthorizedOperationException.class);
    }
}
