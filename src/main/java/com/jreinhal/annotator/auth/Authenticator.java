package com.jreinhal.annotator.auth;

import com.jreinhal.annotator.model.UserIdentity;

/**
 * Credential check in front of the annotation core. The core only ever sees the resulting
 * {@link UserIdentity}.
 */
public interface Authenticator {

    /**
     * @throws AuthenticationFailedException when the credentials do not match a known user
     */
    UserIdentity authenticate(String username, String password);
}
