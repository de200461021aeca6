package com.cardtoken.rules;

import com.cardtoken.cards.CardToken;
import com.cardtoken.validation.ValidationErrors;

/**
 * Interface for card token validation rules.
 *
 * Each rule checks one aspect of a card token and records any findings
 * in the collector. Rules never throw for invalid data.
 */
public interface CardTokenRule {

    /**
     * Evaluate the rule against a normalized card token.
     *
     * @param cardToken the card token to check
     * @param errors collector that receives findings
     */
    void evaluate(CardToken cardToken, ValidationErrors errors);

    /**
     * Get the name of this rule.
     */
    String getRuleName();
}
