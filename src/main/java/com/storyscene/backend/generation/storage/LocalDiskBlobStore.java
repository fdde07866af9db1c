package com.storyscene.backend.generation.storage;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;

@Getter
@Service
public class LocalDiskBlobStore implements BlobStore {

    private final Path baseDir;
    private final String publicBaseUrl;

    public LocalDiskBlobStore(
            @Value("${app.storage.local.base-dir:./data}") String baseDir,
            @Value("${app.storage.public-base-url:http://localhost:8080/files}") String publicBaseUrl
    ) {
        this.baseDir = Paths.get(baseDir).toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl.endsWith("/") ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1) : publicBaseUrl;
    }

    @Override
    public UploadResult upload(String objectKey, byte[] bytes, String contentType) throws IOException {
        Path path = resolve(objectKey);
        Files.createDirectories(path.getParent());
        Files.write(path, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return new UploadResult(objectKey, sha256(bytes), bytes.length, contentType);
    }

    @Override
    public String publicUrl(String objectKey) {
        resolve(objectKey);
        return publicBaseUrl + "/" + objectKey;
    }

    @Override
    public void remove(Collection<String> objectKeys) throws IOException {
        if (objectKeys == null) return;
        for (String key : objectKeys) {
            Files.deleteIfExists(resolve(key));
        }
    }

    private Path resolve(String objectKey) {
        Path p = baseDir.resolve(objectKey).normalize();
        if (!p.startsWith(baseDir)) throw new SecurityException("Invalid objectKey");
        return p;
    }

    private static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
