package dev.phonebook.contactsservice.repository;

import dev.phonebook.contactsservice.domain.UserEntity;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaUserStore implements UserStore {

    private final UserRepository userRepository;

    public JpaUserStore(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserEntity> findByEmail(String email) {
        return userRepository.findByEmail(email);
    }

    @Override
    @Transactional
    public UserEntity create(UserEntity user) {
        return userRepository.save(user);
    }

    @Override
    @Transactional
    public void setRefreshToken(UserEntity user, String refreshToken) {
        user.setRefreshToken(refreshToken);
        userRepository.save(user);
    }

    @Override
    @Transactional
    public void setConfirmed(UserEntity user) {
        user.setConfirmed(true);
        userRepository.save(user);
    }

    @Override
    @Transactional
    public UserEntity setAvatar(UserEntity user, String avatarUrl) {
        user.setAvatar(avatarUrl);
        return userRepository.save(user);
    }
}
