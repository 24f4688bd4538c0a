package dev.phonebook.contactsservice.repository;

import dev.phonebook.contactsservice.domain.UserEntity;
import java.util.Optional;

/**
 * User persistence as seen by the authentication flows. Each call is its own unit of work.
 */
public interface UserStore {

    Optional<UserEntity> findByEmail(String email);

    UserEntity create(UserEntity user);

    /** Replaces the user's single outstanding refresh token; {@code null} clears it. */
    void setRefreshToken(UserEntity user, String refreshToken);

    void setConfirmed(UserEntity user);

    UserEntity setAvatar(UserEntity user, String avatarUrl);
}
