package dev.phonebook.contactsservice.controller;

import dev.phonebook.contactsservice.domain.UserRole;
import dev.phonebook.contactsservice.dto.ContactRequest;
import dev.phonebook.contactsservice.dto.ContactResponse;
import dev.phonebook.contactsservice.security.AuthenticatedUser;
import dev.phonebook.contactsservice.security.RoleGate;
import dev.phonebook.contactsservice.service.ContactService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/contacts/contacts")
public class ContactController {

    static final Set<UserRole> LIST_ALL_ROLES = EnumSet.of(UserRole.admin, UserRole.moderator);

    private final ContactService contactService;

    public ContactController(ContactService contactService) {
        this.contactService = contactService;
    }

    @PostMapping
    public ResponseEntity<ContactResponse> create(@AuthenticationPrincipal AuthenticatedUser user,
                                                  @Valid @RequestBody ContactRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(contactService.create(user.id(), request));
    }

    @GetMapping("/all")
    public List<ContactResponse> listAll(@AuthenticationPrincipal AuthenticatedUser user,
                                         @RequestParam(defaultValue = "10") int limit,
                                         @RequestParam(defaultValue = "0") int offset) {
        RoleGate.authorize(user.role(), LIST_ALL_ROLES);
        return contactService.listAll(limit, offset);
    }

    @GetMapping("/id/{id}")
    public ContactResponse getById(@AuthenticationPrincipal AuthenticatedUser user,
                                   @PathVariable("id") @Min(1) Long id) {
        return contactService.getById(user.id(), id);
    }

    @GetMapping("/by_name/{fullname}")
    public ContactResponse getByName(@AuthenticationPrincipal AuthenticatedUser user,
                                     @PathVariable("fullname") String fullname) {
        return contactService.getByFullname(user.id(), fullname);
    }

    @GetMapping("/by_email/{email}")
    public ContactResponse getByEmail(@AuthenticationPrincipal AuthenticatedUser user,
                                      @PathVariable("email") String email) {
        return contactService.getByEmail(user.id(), email);
    }

    @GetMapping("/by_birthday")
    public List<ContactResponse> upcomingBirthdays(@AuthenticationPrincipal AuthenticatedUser user) {
        return contactService.upcomingBirthdays(user.id());
    }

    @GetMapping("/get_new_day/{new_date}")
    public List<ContactResponse> upcomingBirthdaysFrom(@AuthenticationPrincipal AuthenticatedUser user,
                                                       @PathVariable("new_date") String newDate,
                                                       @RequestParam(defaultValue = "10") int limit,
                                                       @RequestParam(defaultValue = "0") int offset) {
        return contactService.upcomingBirthdaysFrom(user.id(), newDate, limit, offset);
    }

    @PutMapping("/update/{id}")
    public ContactResponse update(@AuthenticationPrincipal AuthenticatedUser user,
                                  @PathVariable("id") @Min(1) Long id,
                                  @Valid @RequestBody ContactRequest request) {
        return contactService.update(user.id(), id, request);
    }

    @DeleteMapping("/delete/{id}")
    public Map<String, String> delete(@AuthenticationPrincipal AuthenticatedUser user,
                                      @PathVariable("id") @Min(1) Long id) {
        contactService.delete(user.id(), id);
        return Map.of("detail", "Contact deleted successfully");
    }
}
