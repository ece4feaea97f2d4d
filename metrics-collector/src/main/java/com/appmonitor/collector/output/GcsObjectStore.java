package com.appmonitor.collector.output;

import com.appmonitor.collector.scheduler.ExecutionDeadline;
import com.appmonitor.collector.service.PlayAccessTokenProvider;
import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Cloud Storage access authenticated with the cached bearer token. The storage client is
 * rebuilt whenever the token changes.
 */
@Slf4j
public class GcsObjectStore implements BulkObjectStore {

    private final PlayAccessTokenProvider tokenProvider;
    private final String projectId;

    private AccessToken clientToken;
    private Storage storage;

    public GcsObjectStore(PlayAccessTokenProvider tokenProvider, String projectId) {
        this.tokenProvider = tokenProvider;
        this.projectId = projectId;
    }

    @Override
    public List<StoredObject> list(String bucket, String prefix) {
        List<StoredObject> objects = new ArrayList<>();
        for (Blob blob : storage().list(bucket, Storage.BlobListOption.prefix(prefix)).iterateAll()) {
            OffsetDateTime updated = blob.getUpdateTimeOffsetDateTime();
            objects.add(new StoredObject(blob.getName(),
                    updated != null ? updated.toInstant() : Instant.EPOCH,
                    blob.getSize() != null ? blob.getSize() : 0L));
        }
        log.debug("Listed {} objects under gs://{}/{}", objects.size(), bucket, prefix);
        return objects;
    }

    @Override
    public byte[] download(String bucket, String objectName) {
        byte[] content = storage().readAllBytes(BlobId.of(bucket, objectName));
        log.info("Downloaded gs://{}/{} ({} bytes)", bucket, objectName, content.length);
        return content;
    }

    private synchronized Storage storage() {
        AccessToken token = tokenProvider.currentToken(ExecutionDeadline.none());
        if (storage == null || token != clientToken) {
            StorageOptions.Builder options = StorageOptions.newBuilder()
                    .setCredentials(GoogleCredentials.create(token));
            if (projectId != null && !projectId.isBlank()) {
                options.setProjectId(projectId);
            }
            storage = options.build().getService();
            clientToken = token;
        }
        return storage;
    }
}
