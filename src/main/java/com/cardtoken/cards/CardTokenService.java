package com.cardtoken.cards;

import com.cardtoken.api.dto.CardTokenValidationResponse;
import com.cardtoken.common.TokenMasker;
import com.cardtoken.common.exception.InvalidCardTokenException;
import com.cardtoken.validation.ValidationErrors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for checking card tokens before they are used in gateway requests.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CardTokenService {

    private final TokenMasker tokenMasker;

    /**
     * Validate a card token and return every finding.
     *
     * Month and year on the token are normalized as part of validation.
     */
    public ValidationErrors validate(CardToken cardToken) {
        ValidationErrors errors = cardToken.validate();

        if (errors.isEmpty()) {
            log.info("Card token {} accepted: type={}, expDate={}",
                tokenMasker.mask(cardToken.getToken()),
                cardToken.getType().orElse("none"),
                cardToken.getExpDate());
        } else {
            log.info("Card token {} rejected with {} finding(s): {}",
                tokenMasker.mask(cardToken.getToken()), errors.size(), errors);
        }
        return errors;
    }

    /**
     * Validate a card token, failing if it has any findings.
     *
     * @return the normalized card token
     * @throws InvalidCardTokenException if validation reported findings
     */
    public CardToken requireValid(CardToken cardToken) {
        ValidationErrors errors = validate(cardToken);
        if (!errors.isEmpty()) {
            throw new InvalidCardTokenException(tokenMasker.mask(cardToken.getToken()), errors);
        }
        return cardToken;
    }

    /**
     * Validate a card token and build a report of its findings and derived fields.
     */
    public CardTokenValidationResponse describe(CardToken cardToken) {
        ValidationErrors errors = validate(cardToken);
        return CardTokenValidationResponse.from(cardToken, mask(cardToken), errors);
    }

    public String mask(CardToken cardToken) {
        return tokenMasker.mask(cardToken.getToken());
    }
}
