package com.pickem.bet.security;

import com.pickem.bet.interfaces.CurrentUserProvider;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;

/**
 * Trusts the user id forwarded by the authenticating proxy in {@code X-User-Id}.
 */
@Component
@RequiredArgsConstructor
public class RequestHeaderUserProvider implements CurrentUserProvider {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_NAME_HEADER = "X-User-Name";

    private final HttpServletRequest request;

    @Override
    public String currentUserId() {
        String userId = request.getHeader(USER_ID_HEADER);
        if (userId == null || userId.isBlank()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing " + USER_ID_HEADER + " header");
        }
        return userId.trim();
    }

    @Override
    public Optional<String> currentDisplayName() {
        return Optional.ofNullable(request.getHeader(USER_NAME_HEADER))
                .map(String::trim)
                .filter(name -> !name.isEmpty());
    }
}
