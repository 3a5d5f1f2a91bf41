package com.confidentialpayroll.application;

import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.infrastructure.security.CallerContext;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Provider for the current caller context from Spring Security.
 *
 * The authenticated user name is the caller identity; capabilities are decided later by
 * {@link com.confidentialpayroll.infrastructure.security.AccessControl}.
 */
@Component
@RequiredArgsConstructor
public class CallerContextProvider {

    static final String API_CHANNEL = "rest-api";

    private final Clock clock;

    public CallerContext getCurrentContext() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            throw new SecurityException("No authenticated user");
        }

        return CallerContext.of(Identity.of(authentication.getName()), clock.instant(), API_CHANNEL);
    }
}
