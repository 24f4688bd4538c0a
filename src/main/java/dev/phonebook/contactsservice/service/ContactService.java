package dev.phonebook.contactsservice.service;

import dev.phonebook.contactsservice.domain.ContactEntity;
import dev.phonebook.contactsservice.dto.ContactRequest;
import dev.phonebook.contactsservice.dto.ContactResponse;
import dev.phonebook.contactsservice.exception.ApiException;
import dev.phonebook.contactsservice.repository.ContactRepository;
import dev.phonebook.contactsservice.util.BirthdayWindow;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ContactService {

    private static final Logger log = LoggerFactory.getLogger(ContactService.class);

    public static final String CONTACT_EXISTS = "Contact already exists!";
    public static final String NOT_FOUND_BY_ID = "NOT FOUND";
    public static final String CONTACT_NOT_FOUND = "Contact not found";
    public static final String INVALID_DATE = "Invalid date format, expected YYYY-MM-DD";

    static final int BIRTHDAY_WINDOW_DAYS = 7;
    static final int MAX_LIMIT = 100;

    private final ContactRepository contactRepository;
    private final Clock clock;

    public ContactService(ContactRepository contactRepository, Clock clock) {
        this.contactRepository = contactRepository;
        this.clock = clock;
    }

    @Transactional
    public ContactResponse create(Long ownerId, ContactRequest request) {
        if (contactRepository.existsByUserIdAndEmail(ownerId, request.email())) {
            throw ApiException.conflict(CONTACT_EXISTS);
        }
        ContactEntity contact = new ContactEntity();
        contact.setUserId(ownerId);
        apply(contact, request);
        try {
            ContactEntity saved = contactRepository.saveAndFlush(contact);
            log.debug("Created contact id={} for user id={}", saved.getId(), ownerId);
            return ContactResponse.from(saved);
        } catch (DataIntegrityViolationException ex) {
            throw ApiException.conflict(CONTACT_EXISTS);
        }
    }

    /** Every contact in the system, ordered by id. */
    @Transactional(readOnly = true)
    public List<ContactResponse> listAll(int limit, int offset) {
        return contactRepository.findPage(clampLimit(limit), clampOffset(offset)).stream()
            .map(ContactResponse::from)
            .toList();
    }

    @Transactional(readOnly = true)
    public ContactResponse getById(Long ownerId, Long id) {
        return contactRepository.findByIdAndUserId(id, ownerId)
            .map(ContactResponse::from)
            .orElseThrow(() -> ApiException.notFound(NOT_FOUND_BY_ID));
    }

    @Transactional(readOnly = true)
    public ContactResponse getByFullname(Long ownerId, String fullname) {
        return contactRepository.findFirstByUserIdAndFullnameOrderByIdAsc(ownerId, fullname)
            .map(ContactResponse::from)
            .orElseThrow(() -> ApiException.notFound(CONTACT_NOT_FOUND));
    }

    @Transactional(readOnly = true)
    public ContactResponse getByEmail(Long ownerId, String email) {
        return contactRepository.findByUserIdAndEmail(ownerId, email)
            .map(ContactResponse::from)
            .orElseThrow(() -> ApiException.notFound(CONTACT_NOT_FOUND));
    }

    @Transactional(readOnly = true)
    public List<ContactResponse> upcomingBirthdays(Long ownerId) {
        return birthdaysFrom(ownerId, LocalDate.now(clock), 0, Integer.MAX_VALUE);
    }

    @Transactional(readOnly = true)
    public List<ContactResponse> upcomingBirthdaysFrom(Long ownerId, String date, int limit, int offset) {
        LocalDate from;
        try {
            from = LocalDate.parse(date);
        } catch (DateTimeParseException ex) {
            throw ApiException.badRequest(INVALID_DATE);
        }
        return birthdaysFrom(ownerId, from, clampOffset(offset), clampLimit(limit));
    }

    @Transactional
    public ContactResponse update(Long ownerId, Long id, ContactRequest request) {
        ContactEntity contact = contactRepository.findByIdAndUserId(id, ownerId)
            .orElseThrow(() -> ApiException.notFound(CONTACT_NOT_FOUND));
        if (!contact.getEmail().equalsIgnoreCase(request.email())) {
            contactRepository.findByUserIdAndEmail(ownerId, request.email())
                .filter(other -> !other.getId().equals(contact.getId()))
                .ifPresent(other -> {
                    throw ApiException.conflict(CONTACT_EXISTS);
                });
        }
        apply(contact, request);
        return ContactResponse.from(contactRepository.save(contact));
    }

    @Transactional
    public void delete(Long ownerId, Long id) {
        ContactEntity contact = contactRepository.findByIdAndUserId(id, ownerId)
            .orElseThrow(() -> ApiException.notFound(CONTACT_NOT_FOUND));
        contactRepository.delete(contact);
        log.debug("Deleted contact id={} for user id={}", id, ownerId);
    }

    private List<ContactResponse> birthdaysFrom(Long ownerId, LocalDate from, int offset, int limit) {
        return contactRepository.findAllByUserIdOrderByIdAsc(ownerId).stream()
            .filter(c -> BirthdayWindow.isWithin(c.getBirthday(), from, BIRTHDAY_WINDOW_DAYS))
            .sorted(Comparator.comparing((ContactEntity c) -> BirthdayWindow.nextOccurrence(c.getBirthday(), from))
                .thenComparing(ContactEntity::getId))
            .skip(offset)
            .limit(limit)
            .map(ContactResponse::from)
            .toList();
    }

    private static void apply(ContactEntity contact, ContactRequest request) {
        contact.setFullname(request.fullname());
        contact.setEmail(request.email());
        contact.setPhoneNumber(request.phoneNumber());
        contact.setBirthday(request.birthday());
    }

    static int clampLimit(int limit) {
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    static int clampOffset(int offset) {
        return Math.max(0, offset);
    }
}
