package com.fountain.pool.integration;

import com.fountain.pool.exception.UnauthorizedOperationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Reads the caller's account from Spring Security's context: the name of the
 * authenticated principal.
 */
@Slf4j
public class SecurityContextCallerIdentityProvider implements CallerIdentityProvider {

    @Override
    public String currentAccount() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null
                || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            log.warn("No authenticated caller for pool operation");
            throw new UnauthorizedOperationException("No authenticated caller");
        }
        String account = authentication.getName();
        if (account == null || account.isBlank()) {
            throw new UnauthorizedOperationException("Authenticated caller has no account name");
        }
        return account;
    }
}
