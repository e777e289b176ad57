package com.podcast.bus.admin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.podcast.bus.core.ack.AcknowledgementTracker;
import com.podcast.bus.core.error.PublishException;
import com.podcast.bus.core.error.StoreUnavailableException;
import com.podcast.bus.core.group.ConsumerGroupRegistrar;
import com.podcast.bus.core.model.Delivery;
import com.podcast.bus.core.model.EntryId;
import com.podcast.bus.core.model.GroupInfo;
import com.podcast.bus.core.model.PendingEntry;
import com.podcast.bus.core.model.StartPosition;
import com.podcast.bus.core.publisher.EventPublisher;
import com.podcast.bus.core.store.LogStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Maintenance endpoints for the event bus: inspect streams and pending ledgers, register groups,
 * publish, and claim or acknowledge stuck entries by hand.
 *
 * Production posture: - Disabled by default. - Should sit behind authentication and/or network
 * controls; a manual ack discards work. - Stable DTO responses.
 *
 * Enable explicitly: eventbus.admin.enabled=true
 */
@RestController
@RequestMapping(path = "/admin/bus", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "eventbus.admin", name = "enabled", havingValue = "true", matchIfMissing = false)
public class BusAdminController {

    private static final Logger log = LoggerFactory.getLogger(BusAdminController.class);

    private static final int MAX_PENDING_LIMIT = 1_000;
    private static final int DEFAULT_PENDING_LIMIT = 100;

    private final LogStore store;
    private final EventPublisher publisher;
    private final ConsumerGroupRegistrar registrar;
    private final AcknowledgementTracker tracker;

    public BusAdminController(LogStore store, EventPublisher publisher, ConsumerGroupRegistrar registrar,
                              AcknowledgementTracker tracker) {
        this.store = store;
        this.publisher = publisher;
        this.registrar = registrar;
        this.tracker = tracker;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("ok", Instant.now().toString());
    }

    /**
     * Appends a UTF-8 payload. Returns 201 with the assigned entry id.
     */
    @PostMapping(path = "/publish", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<PublishResponse>> publish(@Valid @RequestBody PublishRequest req) {
        byte[] payload = req.payload() == null ? new byte[0] : req.payload().getBytes(StandardCharsets.UTF_8);
        return publisher.publish(req.stream(), payload)
                .doOnNext(id -> log.info("Admin publish stream={} id={} bytes={}", req.stream(), id, payload.length))
                .map(id -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(new PublishResponse(req.stream(), id.toString(), payload.length)));
    }

    @GetMapping("/streams/{stream}")
    public Mono<StreamInfoResponse> streamInfo(@PathVariable("stream") String stream) {
        String name = requireNonBlank(stream, "stream");
        return Mono.zip(store.length(name), store.groups(name).map(GroupResponse::of).collectList())
                .map(t -> new StreamInfoResponse(name, t.getT1(), t.getT2()));
    }

    @PostMapping(path = "/groups/ensure", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<EnsureGroupResponse> ensureGroup(@Valid @RequestBody EnsureGroupRequest req) {
        StartPosition start = StartPosition.parse(req.startPosition());
        return registrar.ensureGroup(req.stream(), req.group(), start)
                .map(created -> new EnsureGroupResponse(req.stream(), req.group(), start.name(), created));
    }

    @GetMapping("/streams/{stream}/groups/{group}/pending")
    public Mono<List<PendingResponse>> pending(@PathVariable("stream") String stream,
                                               @PathVariable("group") String group,
                                               @RequestParam(name = "limit", required = false) Integer limit) {
        int n = clampLimit(limit);
        return tracker.pending(requireNonBlank(stream, "stream"), requireNonBlank(group, "group"), n)
                .map(PendingResponse::of)
                .collectList();
    }

    /**
     * Claims one entry for {@code consumer}. The entry must have been idle for at least {@code minIdle}
     * (default and lower bound: the configured visibility timeout). Nothing is handled here; the new owner processes it on
     * its next resumption.
     */
    @PostMapping(path = "/streams/{stream}/groups/{group}/claim", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ClaimResponse> claim(@PathVariable("stream") String stream,
                                     @PathVariable("group") String group,
                                     @Valid @RequestBody ClaimRequest req) {
        EntryId id = EntryId.parse(req.id());
        Duration minIdle = req.minIdle() == null ? tracker.getVisibilityTimeout() : req.minIdle();
        return tracker.claim(requireNonBlank(stream, "stream"), requireNonBlank(group, "group"), id, req.consumer(), minIdle)
                .map(ClaimResponse::of)
                .defaultIfEmpty(ClaimResponse.none(id, req.consumer()))
                .doOnNext(r -> log.info("Admin claim stream={} group={} id={} consumer={} minIdle={} claimed={}",
                        stream, group, id, req.consumer(), minIdle, r.claimed()));
    }

    /**
     * Unconditional acknowledgement: removes the entry from the group's pending ledger whoever owns it.
     */
    @PostMapping(path = "/streams/{stream}/groups/{group}/ack", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AckResponse> ack(@PathVariable("stream") String stream,
                                 @PathVariable("group") String group,
                                 @Valid @RequestBody AckRequest req) {
        EntryId id = EntryId.parse(req.id());
        return tracker.acknowledge(requireNonBlank(stream, "stream"), requireNonBlank(group, "group"), id)
                .map(removed -> new AckResponse(stream, group, id.toString(), removed));
    }

    // ---------------------------------------------------------------------
    // DTOs (stable API contracts)
    // ---------------------------------------------------------------------

    public record HealthResponse(String status, String timestamp) {
    }

    public record PublishRequest(@NotBlank String stream, String payload) {
    }

    public record PublishResponse(String stream, String id, int bytes) {
    }

    public record GroupResponse(String name, long consumers, long pending, String lastDeliveredId) {
        static GroupResponse of(GroupInfo g) {
            return new GroupResponse(g.name(), g.consumers(), g.pending(),
                    g.lastDeliveredId() == null ? null : g.lastDeliveredId().toString());
        }
    }

    public record StreamInfoResponse(String stream, long length, List<GroupResponse> groups) {
    }

    public record EnsureGroupRequest(@NotBlank String stream, @NotBlank String group, String startPosition) {
    }

    public record EnsureGroupResponse(String stream, String group, String startPosition, boolean created) {
    }

    public record PendingResponse(String id, String consumer, long deliveryCount, long idleMillis) {
        static PendingResponse of(PendingEntry p) {
            return new PendingResponse(p.id().toString(), p.consumer(), p.deliveryCount(), p.idle().toMillis());
        }
    }

    public record ClaimRequest(@NotBlank String id,
                               @NotBlank String consumer,
                               @JsonDeserialize(using = FlexibleDurationDeserializer.class) Duration minIdle) {
    }

    public record ClaimResponse(boolean claimed, String id, String consumer, Long deliveryCount) {
        static ClaimResponse of(Delivery d) {
            return new ClaimResponse(true, d.id().toString(), d.consumer(), d.deliveryCount());
        }

        static ClaimResponse none(EntryId id, String consumer) {
            return new ClaimResponse(false, id.toString(), consumer, null);
        }
    }

    public record AckRequest(@NotBlank String id) {
    }

    public record AckResponse(String stream, String group, String id, boolean acknowledged) {
    }

    // ---------------------------------------------------------------------
    // Small helpers
    // ---------------------------------------------------------------------

    private static int clampLimit(Integer requested) {
        if (requested == null) {
            return DEFAULT_PENDING_LIMIT;
        }
        if (requested < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        return Math.min(requested, MAX_PENDING_LIMIT);
    }

    private static String requireNonBlank(String v, String field) {
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return v.trim();
    }
}

/**
 * Exception mapping for the admin API. Consistent {@code {code, message}} body, no stack traces.
 */
@RestControllerAdvice(assignableTypes = BusAdminController.class)
class BusAdminExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(BusAdminExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiError> badInput(ServerWebInputException e) {
        return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getReason()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> illegalState(IllegalStateException e) {
        if (e.getMessage() != null && e.getMessage().startsWith("NOGROUP")) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError("not_found", e.getMessage()));
        }
        return internal(e);
    }

    @ExceptionHandler({StoreUnavailableException.class, PublishException.class})
    public ResponseEntity<ApiError> storeFailure(RuntimeException e) {
        if (e instanceof StoreUnavailableException || e.getCause() instanceof StoreUnavailableException) {
            log.warn("Admin endpoint: log store unavailable. err={}", e.toString());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ApiError("store_unavailable", "Log store unavailable"));
        }
        return internal(e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> internal(Exception e) {
        log.error("Admin endpoint failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ApiError("internal_error", "Request failed"));
    }

    record ApiError(String code, String message) {
    }
}
