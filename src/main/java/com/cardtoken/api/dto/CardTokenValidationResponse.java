package com.cardtoken.api.dto;

import com.cardtoken.cards.CardToken;
import com.cardtoken.validation.ValidationErrors;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Validation report for a card token.
 */
@Data
@Builder
public class CardTokenValidationResponse {

    private String maskedToken;
    private boolean valid;
    private Map<String, List<String>> errors;
    private List<String> messages;
    private String type;
    private boolean expDateSet;
    private String expDate;
    private String brand;
    private boolean check;

    public static CardTokenValidationResponse from(CardToken cardToken, String maskedToken,
                                                   ValidationErrors errors) {
        return CardTokenValidationResponse.builder()
            .maskedToken(maskedToken)
            .valid(errors.isEmpty())
            .errors(errors.asMap())
            .messages(errors.fullMessages())
            .type(cardToken.getType().orElse(null))
            .expDateSet(cardToken.hasExpDate())
            .expDate(cardToken.getExpDate())
            .brand(cardToken.getBrand())
            .check(cardToken.isCheck())
            .build();
    }
}
