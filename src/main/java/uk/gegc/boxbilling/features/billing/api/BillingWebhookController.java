package uk.gegc.boxbilling.features.billing.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.boxbilling.features.billing.application.BillingEventProcessor;
import uk.gegc.boxbilling.features.billing.application.ProcessingResult;
import uk.gegc.boxbilling.features.billing.application.WebhookSignatureVerifier;
import uk.gegc.boxbilling.features.billing.application.event.BillingEventPayloads;
import uk.gegc.boxbilling.features.billing.application.event.NormalizedBillingEvent;
import uk.gegc.boxbilling.shared.config.FeatureFlags;
import uk.gegc.boxbilling.shared.exception.ValidationException;

@Slf4j
@RestController
@RequestMapping("/api/v1/billing")
@RequiredArgsConstructor
@Tag(name = "Billing Webhooks", description = "Internal endpoint for payment provider events (not for public use)")
public class BillingWebhookController {

    public static final String SIGNATURE_HEADER = "Webhook-Signature";

    private final BillingEventProcessor billingEventProcessor;
    private final WebhookSignatureVerifier signatureVerifier;
    private final FeatureFlags featureFlags;
    private final ObjectMapper objectMapper;

    @Operation(
            summary = "Handle billing webhook",
            description = "Accepts a normalized provider event {type, id, data, metadata}. Verifies the signature when a signing secret is configured."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event processed, duplicate or ignored",
                    content = @Content(schema = @Schema(implementation = ProcessingResult.class))),
            @ApiResponse(responseCode = "400", description = "Invalid signature or malformed event",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Billing feature disabled"),
            @ApiResponse(responseCode = "500", description = "Processing failed; the provider should redeliver",
                    content = @Content(schema = @Schema(implementation = ProcessingResult.class)))
    })
    @Hidden
    @PostMapping("/webhooks")
    public ResponseEntity<ProcessingResult> handleWebhook(
            @Parameter(hidden = true) @RequestBody String payload,
            @Parameter(description = "Signature header, t=<timestamp>,v1=<hmac>")
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signatureHeader
    ) {
        if (!featureFlags.isBilling()) {
            log.warn("Billing feature is disabled, rejecting webhook");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }

        signatureVerifier.verify(payload, signatureHeader);
        ProcessingResult result = billingEventProcessor.processEvent(parse(payload));

        return switch (result.status()) {
            case PROCESSED, DUPLICATE, IGNORED -> ResponseEntity.ok(result);
            case FAILED -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        };
    }

    private NormalizedBillingEvent parse(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Webhook payload is not valid JSON");
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("Webhook payload must be a JSON object");
        }
        JsonNode metadata = root.path("metadata");
        NormalizedBillingEvent.EventMetadata eventMetadata = metadata.isObject()
                ? new NormalizedBillingEvent.EventMetadata(
                        BillingEventPayloads.text(metadata, "boxId", "box_id"),
                        BillingEventPayloads.text(metadata, "source"))
                : null;
        return new NormalizedBillingEvent(
                BillingEventPayloads.text(root, "type"),
                BillingEventPayloads.text(root, "id"),
                root.get("data"),
                eventMetadata);
    }
}
