package dev.phonebook.contactsservice.service;

import dev.phonebook.contactsservice.domain.UserEntity;
import dev.phonebook.contactsservice.exception.ApiException;
import dev.phonebook.contactsservice.repository.UserStore;
import java.io.IOException;
import java.time.Clock;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Stores user avatars in S3. Each user has one object, keyed by their sanitized email, that
 * is overwritten on every upload.
 */
@Service
public class AvatarService {

    private static final Logger log = LoggerFactory.getLogger(AvatarService.class);

    static final Set<String> ALLOWED_TYPES = Set.of("image/jpeg", "image/png", "image/webp", "image/gif");
    static final long MAX_SIZE_BYTES = 5L * 1024 * 1024;

    public static final String STORAGE_NOT_CONFIGURED = "Avatar storage is not configured";
    public static final String FILE_REQUIRED = "Image file is required";
    public static final String FILE_TOO_LARGE = "Image size must be under 5MB";
    public static final String UNSUPPORTED_TYPE = "Only image files (JPEG, PNG, WebP, GIF) are allowed";
    public static final String UPLOAD_FAILED = "Avatar upload failed";

    private final UserStore userStore;
    private final String awsRegion;
    private final String bucket;
    private final String publicBaseUrl;
    private final Supplier<S3Client> s3ClientFactory;
    private final Clock clock;

    @Autowired
    public AvatarService(
        UserStore userStore,
        Clock clock,
        @Value("${aws.region:}") String awsRegion,
        @Value("${aws.s3.bucket:}") String bucket,
        @Value("${app.avatar.public-base-url:}") String publicBaseUrl
    ) {
        this(userStore, clock, awsRegion, bucket, publicBaseUrl,
            () -> S3Client.builder().region(Region.of(awsRegion)).build());
    }

    AvatarService(UserStore userStore, Clock clock, String awsRegion, String bucket, String publicBaseUrl,
                  Supplier<S3Client> s3ClientFactory) {
        this.userStore = userStore;
        this.clock = clock;
        this.awsRegion = awsRegion;
        this.bucket = bucket;
        this.publicBaseUrl = publicBaseUrl;
        this.s3ClientFactory = s3ClientFactory;
    }

    public UserEntity updateAvatar(String email, MultipartFile file) {
        if (isBlank(bucket) || isBlank(awsRegion)) {
            throw new ApiException(HttpStatus.INTERNAL_SERVER_ERROR, STORAGE_NOT_CONFIGURED);
        }
        if (file == null || file.isEmpty()) {
            throw ApiException.badRequest(FILE_REQUIRED);
        }
        if (file.getSize() > MAX_SIZE_BYTES) {
            throw ApiException.badRequest(FILE_TOO_LARGE);
        }
        String contentType = file.getContentType();
        if (contentType == null || !ALLOWED_TYPES.contains(contentType.toLowerCase(Locale.ROOT))) {
            throw ApiException.badRequest(UNSUPPORTED_TYPE);
        }

        UserEntity user = userStore.findByEmail(email)
            .orElseThrow(() -> ApiException.notFound("User not found"));

        String key = objectKey(email);
        try (S3Client s3Client = s3ClientFactory.get()) {
            PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .build();
            s3Client.putObject(request, RequestBody.fromBytes(file.getBytes()));
        } catch (SdkException | IOException ex) {
            log.error("Avatar upload failed for user id={} key={}", user.getId(), key, ex);
            throw new ApiException(HttpStatus.INTERNAL_SERVER_ERROR, UPLOAD_FAILED);
        }

        // Key is reused across uploads; the version parameter changes the URL.
        String url = baseUrl() + "/" + key + "?v=" + clock.millis();
        log.info("Updated avatar for user id={}", user.getId());
        return userStore.setAvatar(user, url);
    }

    static String objectKey(String email) {
        String sanitized = email.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", "_");
        return "avatars/" + sanitized;
    }

    private String baseUrl() {
        if (!isBlank(publicBaseUrl)) {
            return publicBaseUrl.endsWith("/") ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1) : publicBaseUrl;
        }
        return "https://" + bucket + ".s3." + awsRegion + ".amazonaws.com";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
