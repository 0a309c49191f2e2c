package com.example.clipflow.web.controller;

import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.service.EnqueueResult;
import com.example.clipflow.service.WorkUnitService;
import com.example.clipflow.web.dto.CancelRequest;
import com.example.clipflow.web.dto.EnqueueRequest;
import com.example.clipflow.web.dto.EnqueueResponse;
import com.example.clipflow.web.dto.LogEntryResponse;
import com.example.clipflow.web.dto.WorkUnitResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/work-units")
public class WorkUnitController {

    private static final Logger log = LoggerFactory.getLogger(WorkUnitController.class);

    private final WorkUnitService workUnitService;

    public WorkUnitController(WorkUnitService workUnitService) {
        this.workUnitService = workUnitService;
    }

    /**
     * Enqueues work for a target. Answers 201 for a new unit and 200 when a live unit already existed.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EnqueueResponse> enqueue(@RequestBody @Valid EnqueueRequest request,
                                                   Authentication authentication) {
        String username = authentication.getName();
        log.info("Enqueue request from user {}: kind={}, target={}", username, request.kind(), request.targetId());
        EnqueueResult result = workUnitService.enqueue(request.kind(), request.targetId(), username, request.params());
        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(EnqueueResponse.from(result));
    }

    @GetMapping
    public ResponseEntity<Page<WorkUnitResponse>> listWorkUnits(
            @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable,
            Authentication authentication) {
        String username = authentication.getName();
        Page<WorkUnitResponse> page = workUnitService.listOwnerWorkUnits(username, pageable)
                .map(WorkUnitResponse::fromEntity);
        log.debug("Returning {} of {} work units for user {}", page.getNumberOfElements(),
                page.getTotalElements(), username);
        return ResponseEntity.ok(page);
    }

    @GetMapping("/{id}")
    public ResponseEntity<WorkUnitResponse> getWorkUnit(@PathVariable Long id, Authentication authentication) {
        WorkUnit unit = workUnitService.getWorkUnit(id, authentication.getName());
        return ResponseEntity.ok(WorkUnitResponse.fromEntity(unit));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<WorkUnitResponse> cancel(@PathVariable Long id,
                                                   @RequestBody(required = false) @Valid CancelRequest request,
                                                   Authentication authentication) {
        String reason = request != null ? request.reason() : null;
        WorkUnit unit = workUnitService.cancel(id, authentication.getName(), reason);
        return ResponseEntity.ok(WorkUnitResponse.fromEntity(unit));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<WorkUnitResponse> retry(@PathVariable Long id, Authentication authentication) {
        WorkUnit unit = workUnitService.retry(id, authentication.getName());
        return ResponseEntity.accepted().body(WorkUnitResponse.fromEntity(unit));
    }

    @GetMapping("/{id}/log")
    public ResponseEntity<List<LogEntryResponse>> getLog(@PathVariable Long id, Authentication authentication) {
        List<LogEntryResponse> entries = workUnitService.getLog(id, authentication.getName()).stream()
                .map(LogEntryResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(entries);
    }
}
