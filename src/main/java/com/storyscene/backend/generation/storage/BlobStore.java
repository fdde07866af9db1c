package com.storyscene.backend.generation.storage;

import java.io.IOException;
import java.util.Collection;

public interface BlobStore {

    UploadResult upload(String objectKey, byte[] bytes, String contentType) throws IOException;

    String publicUrl(String objectKey);

    /** Missing keys are ignored. */
    void remove(Collection<String> objectKeys) throws IOException;

    record UploadResult(String objectKey, String sha256, long sizeBytes, String contentType) {}
}
