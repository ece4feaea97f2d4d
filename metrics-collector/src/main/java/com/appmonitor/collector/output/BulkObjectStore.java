package com.appmonitor.collector.output;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the bucket holding the bulk statistics exports.
 */
public interface BulkObjectStore {

    record StoredObject(String name, Instant updated, long size) {}

    List<StoredObject> list(String bucket, String prefix);

    byte[] download(String bucket, String objectName);
}
