package com.example.clipflow.service.impl;

import com.example.clipflow.exceptions.BlobStoreException;
import com.example.clipflow.exceptions.PermanentInputException;
import com.example.clipflow.exceptions.TransientExternalException;
import com.example.clipflow.service.BlobStore;
import com.example.clipflow.service.RecognitionClient;
import com.example.clipflow.service.RecognitionRequest;
import com.example.clipflow.service.RecognitionSubmission;
import com.example.clipflow.service.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link RecognitionClient} speaking the recognition service's task API and the TUS 1.0.0 resumable
 * upload protocol. Every HTTP call runs under the caller's {@link RetryPolicy}; a chunk that fails is
 * resumed from the offset the TUS server reports.
 */
@Service
public class TusRecognitionClient implements RecognitionClient {

    private static final Logger log = LoggerFactory.getLogger(TusRecognitionClient.class);

    static final String TUS_VERSION = "1.0.0";
    static final String HEADER_TUS_RESUMABLE = "Tus-Resumable";
    static final String HEADER_UPLOAD_LENGTH = "Upload-Length";
    static final String HEADER_UPLOAD_OFFSET = "Upload-Offset";
    static final String HEADER_UPLOAD_METADATA = "Upload-Metadata";
    static final MediaType OFFSET_OCTET_STREAM = MediaType.parseMediaType("application/offset+octet-stream");

    private final RestClient restClient;
    private final BlobStore blobStore;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String tusUrl;
    private final String callbackUrl;

    public TusRecognitionClient(RestClient.Builder restClientBuilder,
                                BlobStore blobStore,
                                ObjectMapper objectMapper,
                                @Value("${clipflow.recognition.api-url:http://localhost:8081}") String apiUrl,
                                @Value("${clipflow.recognition.tus-url:http://localhost:1080}") String tusUrl,
                                @Value("${clipflow.recognition.callback-url:}") String callbackUrl) {
        this.restClient = restClientBuilder.build();
        this.blobStore = blobStore;
        this.objectMapper = objectMapper;
        this.apiUrl = stripTrailingSlash(apiUrl);
        this.tusUrl = stripTrailingSlash(tusUrl);
        this.callbackUrl = callbackUrl;
    }

    @Override
    public RecognitionSubmission submit(RecognitionRequest request, RetryPolicy retryPolicy,
                                        UploadProgressListener listener) {
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("clipflow-tus-");
            Path audio = workDir.resolve(request.filename());
            blobStore.copyTo(request.audioRef(), audio);
            long size = Files.size(audio);
            if (size == 0) {
                throw new PermanentInputException("Audio for recognition is empty: " + request.audioRef());
            }

            JsonNode task = retryPolicy.execute("create recognition task",
                    () -> createTask(request, size));
            if (task == null) {
                throw new PermanentInputException("Empty create-task response");
            }
            String taskId = task.path("task_id").asText(null);
            String uploadUrl = task.path("upload_url").asText(null);
            if (taskId == null || uploadUrl == null) {
                throw new PermanentInputException("Invalid create-task response: " + task);
            }
            log.info("[Recognition] Created task {} for correlation {}", taskId, request.correlationId());

            URI location = retryPolicy.execute("open TUS upload",
                    () -> openUpload(request, taskId, size));
            long uploaded = uploadChunks(location, audio, size, request.chunkSize(), retryPolicy, listener);
            log.info("[Recognition] Uploaded {} bytes for task {} to {}", uploaded, taskId, location);
            return new RecognitionSubmission(taskId, location.toString(), uploaded);
        } catch (IOException e) {
            throw new TransientExternalException("Could not stage audio for upload: " + e.getMessage(), e);
        } catch (BlobStoreException e) {
            throw new PermanentInputException("Audio blob unavailable: " + e.getMessage(), e);
        } finally {
            cleanup(workDir);
        }
    }

    @Override
    public String fetchResult(String resultRef, RetryPolicy retryPolicy) {
        URI uri = URI.create(apiUrl + "/").resolve(resultRef);
        String body = retryPolicy.execute("fetch recognition result",
                () -> restClient.get().uri(uri).retrieve().body(String.class));
        if (body == null) {
            throw new PermanentInputException("Recognition result is empty: " + resultRef);
        }
        return unwrapEnvelope(body);
    }

    // Helper methods

    private JsonNode createTask(RecognitionRequest request, long size) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("language", request.language());
        metadata.put("model", request.model());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("filename", request.filename());
        payload.put("filesize", size);
        payload.put("metadata", metadata);
        payload.put("correlation_id", request.correlationId());
        if (callbackUrl != null && !callbackUrl.isBlank()) {
            payload.put("callback_url", callbackUrl);
        }
        return restClient.post()
                .uri(apiUrl + "/api/v1/asr-tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);
    }

    private URI openUpload(RecognitionRequest request, String taskId, long size) {
        ResponseEntity<Void> response = restClient.post()
                .uri(tusUrl + "/files")
                .header(HEADER_TUS_RESUMABLE, TUS_VERSION)
                .header(HEADER_UPLOAD_LENGTH, Long.toString(size))
                .header(HEADER_UPLOAD_METADATA, encodeMetadata(Map.of(
                        "filename", request.filename(),
                        "task_id", taskId,
                        "correlation_id", request.correlationId())))
                .retrieve()
                .toBodilessEntity();
        URI location = response.getHeaders().getLocation();
        if (location == null) {
            throw new PermanentInputException("TUS server returned no Location header");
        }
        return URI.create(tusUrl + "/").resolve(location);
    }

    private long uploadChunks(URI location, Path audio, long size, int chunkSize, RetryPolicy retryPolicy,
                              UploadProgressListener listener) throws IOException {
        long offset = 0;
        try (FileChannel channel = FileChannel.open(audio, StandardOpenOption.READ)) {
            while (offset < size) {
                final long expected = offset;
                AtomicBoolean resync = new AtomicBoolean(false);
                offset = retryPolicy.execute("TUS chunk at offset " + expected, () -> {
                    long from = resync.getAndSet(true) ? serverOffset(location) : expected;
                    return patchChunk(location, channel, from, chunkSize, size);
                });
                if (listener != null) {
                    listener.onProgress(offset, size);
                }
            }
        }
        return offset;
    }

    /**
     * Sends one chunk starting at {@code from} and returns the server's new offset.
     */
    private long patchChunk(URI location, FileChannel channel, long from, int chunkSize, long size) throws IOException {
        if (from >= size) {
            return from;
        }
        int length = (int) Math.min(chunkSize, size - from);
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer, from + buffer.position()) < 0) {
                break;
            }
        }
        byte[] chunk = buffer.array();
        ResponseEntity<Void> response = restClient.patch()
                .uri(location)
                .header(HEADER_TUS_RESUMABLE, TUS_VERSION)
                .header(HEADER_UPLOAD_OFFSET, Long.toString(from))
                .contentType(OFFSET_OCTET_STREAM)
                .body(chunk)
                .retrieve()
                .toBodilessEntity();
        long newOffset = parseOffset(response.getHeaders().getFirst(HEADER_UPLOAD_OFFSET));
        if (newOffset != from + length) {
            throw new TransientExternalException("Upload offset mismatch: expected " + (from + length)
                    + ", server reported " + newOffset);
        }
        log.debug("[Recognition] Chunk accepted: offset {} -> {}", from, newOffset);
        return newOffset;
    }

    private long serverOffset(URI location) {
        ResponseEntity<Void> response = restClient.head()
                .uri(location)
                .header(HEADER_TUS_RESUMABLE, TUS_VERSION)
                .retrieve()
                .toBodilessEntity();
        long offset = parseOffset(response.getHeaders().getFirst(HEADER_UPLOAD_OFFSET));
        log.info("[Recognition] Resuming upload {} from server offset {}", location, offset);
        return offset;
    }

    private static long parseOffset(String header) {
        if (header == null) {
            throw new TransientExternalException("TUS response is missing " + HEADER_UPLOAD_OFFSET);
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            throw new TransientExternalException("Malformed " + HEADER_UPLOAD_OFFSET + ": " + header, e);
        }
    }

    static String encodeMetadata(Map<String, String> values) {
        StringBuilder metadata = new StringBuilder();
        values.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> {
                    if (metadata.length() > 0) {
                        metadata.append(',');
                    }
                    metadata.append(entry.getKey()).append(' ')
                            .append(Base64.getEncoder().encodeToString(entry.getValue().getBytes(StandardCharsets.UTF_8)));
                });
        return metadata.toString();
    }

    /**
     * The result endpoint answers either {@code {"code":0,"data":"..."}} or the raw transcript.
     */
    private String unwrapEnvelope(String body) {
        String trimmed = body.trim();
        if (!trimmed.startsWith("{")) {
            return body;
        }
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            if (node.path("code").asInt(-1) == 0 && node.hasNonNull("data")) {
                return node.get("data").asText();
            }
            throw new PermanentInputException("Recognition service returned an error result: " + trimmed);
        } catch (JsonProcessingException e) {
            log.debug("[Recognition] Result is not JSON, using it as plain text: {}", e.getOriginalMessage());
            return body;
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private void cleanup(Path workDir) {
        if (workDir == null) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(workDir);
        } catch (IOException e) {
            log.warn("[Recognition] Failed to clean up temporary directory {}: {}", workDir, e.getMessage());
        }
    }
}
