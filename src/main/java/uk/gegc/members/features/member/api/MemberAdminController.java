package uk.gegc.members.features.member.api;

import com.stripe.exception.StripeException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.members.features.member.api.dto.CreateMemberRequest;
import uk.gegc.members.features.member.api.dto.MemberDto;
import uk.gegc.members.features.member.api.dto.UpdateMemberRequest;
import uk.gegc.members.features.member.application.MemberService;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/members")
@RequiredArgsConstructor
@Tag(name = "Members Admin", description = "Member management")
@SecurityRequirement(name = "Bearer Authentication")
public class MemberAdminController {

    private final MemberService memberService;

    @Operation(summary = "Get a member")
    @ApiResponse(responseCode = "200", description = "Member returned",
            content = @Content(schema = @Schema(implementation = MemberDto.class)))
    @ApiResponse(responseCode = "404", description = "Member not found")
    @GetMapping("/{memberId}")
    public ResponseEntity<MemberDto> get(@PathVariable UUID memberId) {
        return ResponseEntity.ok(MemberDto.from(memberService.get(memberId)));
    }

    @Operation(summary = "Find the member linked to a Stripe customer")
    @ApiResponse(responseCode = "200", description = "Member returned",
            content = @Content(schema = @Schema(implementation = MemberDto.class)))
    @ApiResponse(responseCode = "404", description = "No member is linked to the customer")
    @GetMapping(params = "stripeCustomerId")
    public ResponseEntity<MemberDto> getByCustomerId(@RequestParam String stripeCustomerId) {
        return ResponseEntity.ok(MemberDto.from(memberService.getByCustomerId(stripeCustomerId)));
    }

    @Operation(summary = "Create a member")
    @ApiResponse(responseCode = "201", description = "Member created",
            content = @Content(schema = @Schema(implementation = MemberDto.class)))
    @ApiResponse(responseCode = "409", description = "Email already in use")
    @PostMapping
    public ResponseEntity<MemberDto> create(@Valid @RequestBody CreateMemberRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(MemberDto.from(memberService.create(request)));
    }

    @Operation(
            summary = "Update a member",
            description = "Partial update. An email change is pushed to the member's linked Stripe customers."
    )
    @ApiResponse(responseCode = "200", description = "Member updated",
            content = @Content(schema = @Schema(implementation = MemberDto.class)))
    @PatchMapping("/{memberId}")
    public ResponseEntity<MemberDto> update(@PathVariable UUID memberId,
                                            @Valid @RequestBody UpdateMemberRequest request) throws StripeException {
        return ResponseEntity.ok(MemberDto.from(memberService.update(memberId, request)));
    }

    @Operation(summary = "Delete a member")
    @ApiResponse(responseCode = "204", description = "Member deleted, or did not exist")
    @DeleteMapping("/{memberId}")
    public ResponseEntity<Void> destroy(
            @PathVariable UUID memberId,
            @Parameter(description = "Cancel the member's Stripe subscriptions first")
            @RequestParam(defaultValue = "false") boolean cancelStripeSubscriptions) throws StripeException {
        memberService.destroy(memberId, cancelStripeSubscriptions);
        return ResponseEntity.noContent().build();
    }
}
