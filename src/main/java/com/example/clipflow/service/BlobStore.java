package com.example.clipflow.service;

import com.example.clipflow.exceptions.BlobStoreException;

import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Opaque object storage for stage inputs and outputs. References are store-relative keys.
 */
public interface BlobStore {

    String put(String key, Path source) throws BlobStoreException;

    String put(String key, InputStream content) throws BlobStoreException;

    InputStream open(String ref) throws BlobStoreException;

    void copyTo(String ref, Path target) throws BlobStoreException;

    long size(String ref) throws BlobStoreException;

    URI signedUrl(String ref, Duration ttl) throws BlobStoreException;

    boolean verifySignature(String ref, long expiresAtEpochSecond, String signature);

    void delete(String ref) throws BlobStoreException;
}
