package com.example.clipflow.web.controller;

import com.example.clipflow.exceptions.BlobStoreException;
import com.example.clipflow.service.BlobStore;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Serves blobs through the signed URLs handed to external collaborators.
 */
@RestController
public class BlobDownloadController {

    private static final Logger log = LoggerFactory.getLogger(BlobDownloadController.class);
    private static final String PREFIX = "/blobs/";

    private final BlobStore blobStore;

    public BlobDownloadController(BlobStore blobStore) {
        this.blobStore = blobStore;
    }

    @GetMapping("/blobs/**")
    public ResponseEntity<Resource> download(HttpServletRequest request,
                                             @RequestParam("expires") long expires,
                                             @RequestParam("signature") String signature) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        String ref = path.startsWith(PREFIX) ? path.substring(PREFIX.length()) : "";
        if (ref.isEmpty() || !blobStore.verifySignature(ref, expires, signature)) {
            log.warn("Rejected blob download with invalid or expired signature: {}", ref);
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Invalid or expired download link.");
        }
        try {
            long size = blobStore.size(ref);
            MediaType mediaType = MediaTypeFactory.getMediaType(ref).orElse(MediaType.APPLICATION_OCTET_STREAM);
            String filename = ref.substring(ref.lastIndexOf('/') + 1);
            return ResponseEntity.ok()
                    .contentType(mediaType)
                    .contentLength(size)
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                    .body(new InputStreamResource(blobStore.open(ref)));
        } catch (BlobStoreException e) {
            log.warn("Blob {} could not be served: {}", ref, e.getMessage());
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Blob not found.", e);
        }
    }
}
