package automata.email.app.controller;

import automata.email.app.dto.BatchActionRequest;
import automata.email.app.dto.ErrorResponse;
import automata.email.app.engine.BatchApplyResult;
import automata.email.app.engine.MailboxCallException;
import automata.email.app.engine.MalformedActionException;
import automata.email.app.service.BatchActionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry point for action batches decided by an upstream rule stage.
 * The caller passes the Gmail OAuth access token as a bearer token.
 */
@Slf4j
@RestController
@RequestMapping("/api/batches")
public class BatchActionController {
    private static final String BEARER_PREFIX = "Bearer ";

    private final BatchActionService batchActionService;

    public BatchActionController(BatchActionService batchActionService) {
        this.batchActionService = batchActionService;
    }

    @PostMapping("/threads")
    public ResponseEntity<?> applyThreadActions(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody BatchActionRequest request) {
        return run("thread", authorization, request, batchActionService::applyThreadActions);
    }

    @PostMapping("/messages")
    public ResponseEntity<?> applyMessageActions(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody BatchActionRequest request) {
        return run("message", authorization, request, batchActionService::applyMessageActions);
    }

    @FunctionalInterface
    interface BatchCall {
        BatchApplyResult apply(String accessToken, BatchActionRequest request) throws Exception;
    }

    private ResponseEntity<?> run(String kind, String authorization, BatchActionRequest request, BatchCall call) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)
                || authorization.substring(BEARER_PREFIX.length()).isBlank()) {
            return ResponseEntity.badRequest().body(ErrorResponse.of("Missing bearer access token"));
        }
        String accessToken = authorization.substring(BEARER_PREFIX.length()).trim();

        try {
            return ResponseEntity.ok(call.apply(accessToken, request));
        } catch (MalformedActionException e) {
            log.warn("Rejected {} batch: {}", kind, e.getMessage());
            return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
        } catch (MailboxCallException e) {
            log.error("{} batch stopped at step {}: {}", kind, e.getStep(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse(e.getMessage(), e.getStep()));
        } catch (Exception e) {
            log.error("Error applying {} batch: {}", kind, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponse.of("Error loading " + kind + "s: " + e.getMessage()));
        }
    }
}
