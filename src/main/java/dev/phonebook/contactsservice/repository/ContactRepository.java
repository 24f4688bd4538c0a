package dev.phonebook.contactsservice.repository;

import dev.phonebook.contactsservice.domain.ContactEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ContactRepository extends JpaRepository<ContactEntity, Long> {

    Optional<ContactEntity> findByIdAndUserId(Long id, Long userId);

    Optional<ContactEntity> findFirstByUserIdAndFullnameOrderByIdAsc(Long userId, String fullname);

    Optional<ContactEntity> findByUserIdAndEmail(Long userId, String email);

    boolean existsByUserIdAndEmail(Long userId, String email);

    List<ContactEntity> findAllByUserIdOrderByIdAsc(Long userId);

    @Query(value = "SELECT * FROM contacts ORDER BY id LIMIT :limit OFFSET :offset", nativeQuery = true)
    List<ContactEntity> findPage(@Param("limit") int limit, @Param("offset") int offset);
}
