package dev.phonebook.contactsservice.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import dev.phonebook.contactsservice.domain.UserEntity;
import dev.phonebook.contactsservice.exception.ApiException;
import dev.phonebook.contactsservice.repository.UserStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockMultipartFile;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

@ExtendWith(MockitoExtension.class)
class AvatarServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    @Mock private UserStore userStore;
    @Mock private S3Client s3Client;

    private AvatarService service(String region, String bucket, String publicBaseUrl) {
        return new AvatarService(userStore, CLOCK, region, bucket, publicBaseUrl, () -> s3Client);
    }

    private static MockMultipartFile png(int size) {
        return new MockMultipartFile("file", "me.png", "image/png", new byte[size]);
    }

    private static UserEntity alice() {
        UserEntity user = new UserEntity();
        user.setId(1L);
        user.setEmail("Alice+test@example.com");
        return user;
    }

    @Test
    void upload_putsObjectAndStoresVersionedUrl() {
        UserEntity user = alice();
        when(userStore.findByEmail("Alice+test@example.com")).thenReturn(Optional.of(user));
        when(userStore.setAvatar(eq(user), anyString())).thenAnswer(inv -> {
            user.setAvatar(inv.getArgument(1));
            return user;
        });

        UserEntity updated = service("eu-central-1", "avatars-bucket", "").updateAvatar("Alice+test@example.com", png(10));

        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(request.capture(), any(RequestBody.class));
        assertEquals("avatars-bucket", request.getValue().bucket());
        assertEquals("avatars/alice_test_example.com", request.getValue().key());
        assertEquals("image/png", request.getValue().contentType());
        assertEquals(
            "https://avatars-bucket.s3.eu-central-1.amazonaws.com/avatars/alice_test_example.com?v=1700000000000",
            updated.getAvatar());
    }

    @Test
    void upload_usesPublicBaseUrlWhenConfigured() {
        UserEntity user = alice();
        when(userStore.findByEmail(anyString())).thenReturn(Optional.of(user));
        when(userStore.setAvatar(eq(user), anyString())).thenAnswer(inv -> {
            user.setAvatar(inv.getArgument(1));
            return user;
        });

        UserEntity updated = service("eu-central-1", "b", "https://cdn.example.com/").updateAvatar("Alice+test@example.com", png(10));

        assertTrue(updated.getAvatar().startsWith("https://cdn.example.com/avatars/alice_test_example.com?v="));
    }

    @Test
    void missingStorageConfig_isServerError() {
        ApiException ex = assertThrows(ApiException.class, () -> service("", "", "").updateAvatar("a@example.com", png(10)));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, ex.getStatus());
        assertEquals(AvatarService.STORAGE_NOT_CONFIGURED, ex.getMessage());
    }

    @Test
    void emptyFile_isBadRequest() {
        ApiException ex = assertThrows(ApiException.class, () -> service("r", "b", "").updateAvatar("a@example.com", png(0)));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatus());
    }

    @Test
    void oversizedFile_isBadRequest() {
        MockMultipartFile big = png((int) AvatarService.MAX_SIZE_BYTES + 1);
        ApiException ex = assertThrows(ApiException.class, () -> service("r", "b", "").updateAvatar("a@example.com", big));
        assertEquals(AvatarService.FILE_TOO_LARGE, ex.getMessage());
    }

    @Test
    void nonImage_isBadRequest() {
        MockMultipartFile pdf = new MockMultipartFile("file", "cv.pdf", "application/pdf", new byte[10]);
        ApiException ex = assertThrows(ApiException.class, () -> service("r", "b", "").updateAvatar("a@example.com", pdf));
        assertEquals(AvatarService.UNSUPPORTED_TYPE, ex.getMessage());
        verifyNoInteractions(s3Client, userStore);
    }

    @Test
    void s3Failure_isServerErrorAndAvatarUnchanged() {
        when(userStore.findByEmail("a@example.com")).thenReturn(Optional.of(alice()));
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
            .thenThrow(SdkClientException.create("unreachable"));

        ApiException ex = assertThrows(ApiException.class, () -> service("r", "b", "").updateAvatar("a@example.com", png(10)));
        assertEquals(AvatarService.UPLOAD_FAILED, ex.getMessage());
        verify(userStore, never()).setAvatar(any(), anyString());
    }
}
