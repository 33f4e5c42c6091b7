package org.rostilos.reviewpilot.pipelineagent.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.reviewpilot.pipelineagent.dto.response.ErrorMessageResponse;
import org.rostilos.reviewpilot.pipelineagent.service.ReviewTriggerService;
import org.rostilos.reviewpilot.pipelineagent.service.TriggerResult;
import org.rostilos.reviewpilot.pipelineagent.webhook.GitLabWebhookParser;
import org.rostilos.reviewpilot.pipelineagent.webhook.WebhookEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Receives GitLab webhooks. Every well-formed delivery is acknowledged with 200,
 * including events that do not start a review.
 */
@RestController
@RequestMapping("/api/webhooks")
public class GitLabWebhookController {

    private static final Logger log = LoggerFactory.getLogger(GitLabWebhookController.class);

    private final GitLabWebhookParser parser;
    private final ReviewTriggerService triggerService;
    private final ObjectMapper objectMapper;

    public GitLabWebhookController(
            GitLabWebhookParser parser,
            ReviewTriggerService triggerService,
            ObjectMapper objectMapper
    ) {
        this.parser = parser;
        this.triggerService = triggerService;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/gitlab")
    public ResponseEntity<?> handleGitLabWebhook(
            @RequestHeader(value = "X-Gitlab-Event", required = false) String eventType,
            @RequestBody String body
    ) {
        if (eventType == null || eventType.isBlank()) {
            return ResponseEntity.badRequest()
                    .body(new ErrorMessageResponse("Missing X-Gitlab-Event header", HttpStatus.BAD_REQUEST));
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Rejected {} webhook with malformed JSON: {}", eventType, e.getOriginalMessage());
            return ResponseEntity.badRequest()
                    .body(new ErrorMessageResponse("Malformed webhook payload", HttpStatus.BAD_REQUEST));
        }

        Optional<WebhookEvent> event = parser.parse(eventType, payload);
        if (event.isEmpty()) {
            log.debug("Ignoring GitLab event '{}'", eventType);
            return ResponseEntity.ok(TriggerResult.ignored("Event '" + eventType + "' is not reviewed"));
        }

        TriggerResult result = triggerService.handle(event.get());
        if (result.started()) {
            log.info("GitLab {} event for project {} started review run {}",
                    event.get().kind(), event.get().projectId(), result.runId());
        }
        return ResponseEntity.ok(result);
    }
}
