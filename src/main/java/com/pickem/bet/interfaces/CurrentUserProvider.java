package com.pickem.bet.interfaces;

import java.util.Optional;

/**
 * Identity of the caller of the current request, as established by whatever sits in
 * front of the API.
 */
public interface CurrentUserProvider {

    /**
     * @throws org.springframework.web.server.ResponseStatusException 401 when no user is attached
     */
    String currentUserId();

    Optional<String> currentDisplayName();
}
