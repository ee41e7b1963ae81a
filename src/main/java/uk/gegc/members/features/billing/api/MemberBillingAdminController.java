package uk.gegc.members.features.billing.api;

import com.stripe.exception.StripeException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.members.features.billing.api.dto.ComplimentaryGrantDto;
import uk.gegc.members.features.billing.api.dto.LinkCustomerRequest;
import uk.gegc.members.features.billing.api.dto.OutcomeDto;
import uk.gegc.members.features.billing.api.dto.StripeCustomerDto;
import uk.gegc.members.features.billing.api.dto.SubscriptionDto;
import uk.gegc.members.features.billing.api.dto.UpdateSubscriptionCancellationRequest;
import uk.gegc.members.features.billing.application.MemberSubscriptionService;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/members/{memberId}/stripe")
@RequiredArgsConstructor
@Tag(name = "Member Billing Admin", description = "Reconcile members with their Stripe customers and subscriptions")
@SecurityRequirement(name = "Bearer Authentication")
public class MemberBillingAdminController {

    private final MemberSubscriptionService memberSubscriptionService;

    @Operation(
            summary = "Link a Stripe customer",
            description = "Links an existing Stripe customer and all of its subscriptions to the member. Returns 204 when Stripe has no such customer."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Customer linked",
                    content = @Content(schema = @Schema(implementation = StripeCustomerDto.class))),
            @ApiResponse(responseCode = "204", description = "Customer does not exist in Stripe; nothing linked"),
            @ApiResponse(responseCode = "404", description = "Member not found"),
            @ApiResponse(responseCode = "409", description = "Customer already linked"),
            @ApiResponse(responseCode = "503", description = "Stripe is not configured")
    })
    @PostMapping("/customers")
    public ResponseEntity<StripeCustomerDto> linkCustomer(@PathVariable UUID memberId,
                                                          @Valid @RequestBody LinkCustomerRequest request) throws StripeException {
        return memberSubscriptionService.linkCustomer(memberId, request.customerId())
                .map(customer -> ResponseEntity.status(HttpStatus.CREATED).body(StripeCustomerDto.from(customer)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @Operation(summary = "List mirrored subscriptions")
    @ApiResponse(responseCode = "200", description = "Subscriptions returned",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = SubscriptionDto.class))))
    @GetMapping("/subscriptions")
    public ResponseEntity<List<SubscriptionDto>> getSubscriptions(@PathVariable UUID memberId) {
        List<SubscriptionDto> subscriptions = memberSubscriptionService.getSubscriptions(memberId).stream()
                .map(SubscriptionDto::from)
                .toList();
        return ResponseEntity.ok(subscriptions);
    }

    @Operation(
            summary = "Set or clear cancel at period end",
            description = "Updates the subscription in Stripe, then the local mirror."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription updated",
                    content = @Content(schema = @Schema(implementation = SubscriptionDto.class))),
            @ApiResponse(responseCode = "400", description = "cancelAtPeriodEnd missing"),
            @ApiResponse(responseCode = "404", description = "Subscription not found for this member"),
            @ApiResponse(responseCode = "503", description = "Stripe is not configured")
    })
    @PatchMapping("/subscriptions/{subscriptionId}")
    public ResponseEntity<SubscriptionDto> updateSubscriptionCancellation(
            @PathVariable UUID memberId,
            @PathVariable String subscriptionId,
            @RequestBody UpdateSubscriptionCancellationRequest request) throws StripeException {
        return ResponseEntity.ok(SubscriptionDto.from(
                memberSubscriptionService.updateSubscriptionCancellation(memberId, subscriptionId, request.cancelAtPeriodEnd())));
    }

    @Operation(
            summary = "Grant complimentary access",
            description = "Moves the member's active subscriptions to the complimentary plan in their currency, or creates a complimentary subscription."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Complimentary plan granted",
                    content = @Content(schema = @Schema(implementation = ComplimentaryGrantDto.class))),
            @ApiResponse(responseCode = "422", description = "No complimentary plan for the member's currency"),
            @ApiResponse(responseCode = "502", description = "Stripe error"),
            @ApiResponse(responseCode = "503", description = "Stripe is not configured")
    })
    @PostMapping("/complimentary")
    public ResponseEntity<ComplimentaryGrantDto> grantComplimentary(@PathVariable UUID memberId) throws StripeException {
        return ResponseEntity.ok(ComplimentaryGrantDto.from(memberSubscriptionService.grantComplimentary(memberId)));
    }

    @Operation(
            summary = "Cancel complimentary access",
            description = "Cancels every subscription of the member that is not already canceled. Failures are reported per subscription."
    )
    @ApiResponse(responseCode = "200", description = "Per-subscription outcomes",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = OutcomeDto.class))))
    @DeleteMapping("/complimentary")
    public ResponseEntity<List<OutcomeDto>> cancelComplimentary(@PathVariable UUID memberId) {
        List<OutcomeDto> outcomes = memberSubscriptionService.cancelComplimentary(memberId).stream()
                .map(OutcomeDto::from)
                .toList();
        return ResponseEntity.ok(outcomes);
    }
}
