package com.example.clipflow.service.impl;

import com.example.clipflow.exceptions.BlobStoreException;
import com.example.clipflow.service.BlobStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

@Service
public class FilesystemBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(FilesystemBlobStore.class);
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final Path rootLocation;
    private final String publicBaseUrl;
    private final byte[] signingKey;
    private final Clock clock;

    public FilesystemBlobStore(@Value("${clipflow.blob.root}") String root,
                               @Value("${clipflow.blob.public-base-url}") String publicBaseUrl,
                               @Value("${clipflow.blob.signing-key}") String signingKey,
                               Clock clock) {
        this.rootLocation = Paths.get(root).toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl;
        this.signingKey = signingKey.getBytes(StandardCharsets.UTF_8);
        this.clock = clock;
        if (this.signingKey.length < 32) {
            throw new IllegalArgumentException("clipflow.blob.signing-key must be at least 32 bytes");
        }
    }

    @PostConstruct
    private void initialize() {
        try {
            Files.createDirectories(rootLocation);
            log.info("Blob storage directory initialized at: {}", this.rootLocation);
        } catch (IOException e) {
            throw new BlobStoreException("Could not initialize blob storage directory: " + this.rootLocation, e);
        }
    }

    @Override
    public String put(String key, Path source) throws BlobStoreException {
        Path destination = resolveAndValidatePath(key);
        try {
            Files.createDirectories(destination.getParent());
            Files.copy(source, destination, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored blob {} ({} bytes)", key, Files.size(destination));
            return key;
        } catch (IOException e) {
            throw new BlobStoreException("Failed to store blob " + key, e);
        }
    }

    @Override
    public String put(String key, InputStream content) throws BlobStoreException {
        Path destination = resolveAndValidatePath(key);
        try (content) {
            Files.createDirectories(destination.getParent());
            Files.copy(content, destination, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored blob {} from stream", key);
            return key;
        } catch (IOException e) {
            throw new BlobStoreException("Failed to store blob " + key, e);
        }
    }

    @Override
    public InputStream open(String ref) throws BlobStoreException {
        Path file = existingFile(ref);
        try {
            return Files.newInputStream(file);
        } catch (IOException e) {
            throw new BlobStoreException("Could not open blob: " + ref, e);
        }
    }

    @Override
    public void copyTo(String ref, Path target) throws BlobStoreException {
        Path file = existingFile(ref);
        try {
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new BlobStoreException("Could not copy blob " + ref + " to " + target, e);
        }
    }

    @Override
    public long size(String ref) throws BlobStoreException {
        Path file = existingFile(ref);
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new BlobStoreException("Could not read size of blob: " + ref, e);
        }
    }

    @Override
    public URI signedUrl(String ref, Duration ttl) throws BlobStoreException {
        resolveAndValidatePath(ref);
        long expiresAt = clock.instant().plus(ttl).getEpochSecond();
        return UriComponentsBuilder.fromHttpUrl(publicBaseUrl)
                .path("/blobs/")
                .path(ref)
                .queryParam("expires", expiresAt)
                .queryParam("signature", sign(ref, expiresAt))
                .build()
                .encode()
                .toUri();
    }

    @Override
    public boolean verifySignature(String ref, long expiresAtEpochSecond, String signature) {
        if (signature == null || clock.instant().getEpochSecond() > expiresAtEpochSecond) {
            return false;
        }
        byte[] expected = sign(ref, expiresAtEpochSecond).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void delete(String ref) throws BlobStoreException {
        Path file = resolveAndValidatePath(ref);
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                log.info("Deleted blob: {}", ref);
            } else {
                log.warn("Attempted to delete non-existent blob: {}", ref);
            }
        } catch (IOException e) {
            throw new BlobStoreException("Failed to delete blob due to IO error: " + ref, e);
        }
    }

    private String sign(String ref, long expiresAt) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingKey, HMAC_ALGORITHM));
            byte[] digest = mac.doFinal((ref + "\n" + expiresAt).getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }

    private Path existingFile(String ref) {
        Path file = resolveAndValidatePath(ref);
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new BlobStoreException("Blob does not exist or is not readable: " + ref);
        }
        return file;
    }

    private Path resolveAndValidatePath(String ref) throws BlobStoreException {
        if (ref == null || ref.isBlank()) {
            throw new BlobStoreException("Blob reference cannot be null or blank.");
        }
        if (ref.contains("..") || ref.contains("\\") || ref.startsWith("/")) {
            throw new BlobStoreException("Invalid characters found in blob reference: " + ref);
        }
        try {
            Path resolvedPath = this.rootLocation.resolve(ref).normalize().toAbsolutePath();
            if (!resolvedPath.startsWith(this.rootLocation)) {
                throw new BlobStoreException("Security check failed: Cannot access blob outside storage root: " + ref);
            }
            return resolvedPath;
        } catch (InvalidPathException e) {
            throw new BlobStoreException("Invalid blob reference provided: " + ref, e);
        }
    }
}
