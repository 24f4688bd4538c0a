package dev.phonebook.contactsservice.controller;

import dev.phonebook.contactsservice.dto.UserResponse;
import dev.phonebook.contactsservice.security.AuthenticatedUser;
import dev.phonebook.contactsservice.service.AuthService;
import dev.phonebook.contactsservice.service.AvatarService;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/user")
public class UserController {

    private final AuthService authService;
    private final AvatarService avatarService;

    public UserController(AuthService authService, AvatarService avatarService) {
        this.authService = authService;
        this.avatarService = avatarService;
    }

    @GetMapping({"/me", "/me/"})
    public UserResponse me(@AuthenticationPrincipal AuthenticatedUser user) {
        return UserResponse.from(authService.currentUser(user.email()));
    }

    @PatchMapping(value = "/avatar", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public UserResponse updateAvatar(@AuthenticationPrincipal AuthenticatedUser user,
                                     @RequestPart("file") MultipartFile file) {
        return UserResponse.from(avatarService.updateAvatar(user.email(), file));
    }
}
