package com.cardtoken.api.controller;

import com.cardtoken.api.dto.CardTokenRequest;
import com.cardtoken.api.dto.CardTokenValidationResponse;
import com.cardtoken.cards.CardToken;
import com.cardtoken.cards.CardTokenService;
import com.cardtoken.validation.ValidationErrors;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for card token validation.
 */
@RestController
@RequestMapping("/api/v1/card-tokens")
@RequiredArgsConstructor
@Tag(name = "Card Tokens", description = "Card token validation API")
public class CardTokenController {

    private final CardTokenService cardTokenService;

    @PostMapping("/validate")
    @Operation(summary = "Validate a card token and report all findings")
    public ResponseEntity<CardTokenValidationResponse> validate(@Valid @RequestBody CardTokenRequest request) {
        return ResponseEntity.ok(cardTokenService.describe(request.toCardToken()));
    }

    @PostMapping("/verify")
    @Operation(summary = "Accept a card token, rejecting it if validation reports findings")
    public ResponseEntity<CardTokenValidationResponse> verify(@Valid @RequestBody CardTokenRequest request) {
        CardToken cardToken = cardTokenService.requireValid(request.toCardToken());
        return ResponseEntity.ok(
            CardTokenValidationResponse.from(cardToken, cardTokenService.mask(cardToken), new ValidationErrors()));
    }
}
