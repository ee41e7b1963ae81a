package uk.gegc.members.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.members.features.billing.api.dto.PlanDto;
import uk.gegc.members.features.billing.application.StripePlanSyncService;
import uk.gegc.members.features.billing.application.StripePlansService;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/billing")
@RequiredArgsConstructor
@Tag(name = "Billing Admin", description = "Administrative billing operations")
@SecurityRequirement(name = "Bearer Authentication")
public class BillingAdminController {

    private final StripePlanSyncService stripePlanSyncService;
    private final StripePlansService stripePlansService;

    @Operation(
            summary = "Force sync membership plans from Stripe",
            description = "Triggers a sync of membership plans from active recurring Stripe Prices and returns the active plans after sync. Requires MEMBERS_ADMIN authority."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Sync completed",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = PlanDto.class)))
            ),
            @ApiResponse(responseCode = "403", description = "Missing MEMBERS_ADMIN authority"),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    @PostMapping("/plans/sync")
    public ResponseEntity<List<PlanDto>> syncStripePlans() {
        stripePlanSyncService.syncActivePlans();

        List<PlanDto> plans = stripePlansService.getPlans().stream()
                .map(plan -> new PlanDto(
                        plan.getId(),
                        plan.getStripePriceId(),
                        plan.getNickname(),
                        plan.getInterval(),
                        plan.getAmount(),
                        plan.getCurrency(),
                        plan.isComplimentary()
                ))
                .toList();

        return ResponseEntity.ok(plans);
    }
}
