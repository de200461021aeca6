package com.cardtoken.api.dto;

import com.cardtoken.cards.CardToken;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * DTO for submitting a card token for validation.
 *
 * Month and year are accepted as text and converted the same way as any
 * other integer-like input, so "09" and "9" are both September.
 */
@Data
public class CardTokenRequest {

    @NotBlank(message = "Token is required")
    private String token;

    private String month;

    private String year;

    private String verificationValue;

    private String brand;

    public CardToken toCardToken() {
        return CardToken.builder()
            .token(token)
            .month(CardToken.coerce(month))
            .year(CardToken.coerce(year))
            .verificationValue(verificationValue)
            .brand(brand)
            .build();
    }
}
