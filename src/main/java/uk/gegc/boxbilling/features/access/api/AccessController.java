package uk.gegc.boxbilling.features.access.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.boxbilling.features.access.application.AccessControlService;
import uk.gegc.boxbilling.features.access.application.AccessDecision;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/boxes/{boxId}/access")
@RequiredArgsConstructor
@Tag(name = "Access", description = "Entitlement checks for a box")
public class AccessController {

    private final AccessControlService accessControlService;

    @Operation(summary = "Check whether the box may use the product",
            description = "Always 200; a denial carries the reason.")
    @ApiResponse(responseCode = "200", description = "Access decision",
            content = @Content(schema = @Schema(implementation = AccessDecision.class)))
    @GetMapping
    public ResponseEntity<AccessDecision> checkAccess(@PathVariable UUID boxId) {
        return ResponseEntity.ok(accessControlService.checkAccess(boxId));
    }

    @Operation(summary = "Check access to a gated feature")
    @ApiResponse(responseCode = "200", description = "Access decision",
            content = @Content(schema = @Schema(implementation = AccessDecision.class)))
    @GetMapping("/{feature}")
    public ResponseEntity<AccessDecision> checkFeatureAccess(
            @PathVariable UUID boxId,
            @Parameter(description = "add_athlete, add_coach, advanced_analytics or api_access") @PathVariable String feature) {
        return ResponseEntity.ok(accessControlService.checkFeatureAccess(boxId, feature));
    }
}
