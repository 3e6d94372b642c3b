package io.b2mash.images.storage;

import java.time.Instant;

/** Represents a time-limited presigned URL for storage operations. */
public record PresignedUrl(String url, Instant expiresAt) {}
