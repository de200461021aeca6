package com.cardtoken.rules;

import com.cardtoken.cards.CardToken;
import com.cardtoken.validation.ValidationErrors;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Evaluates the card token rules in a fixed order.
 *
 * Unlike an approve/decline chain, every rule always runs so the caller
 * receives all findings at once.
 */
@Slf4j
public final class CardTokenRules {

    private static final List<CardTokenRule> DEFAULT_RULES = List.of(
        new TokenFormatRule(),
        new ExpirationDateRule(),
        new BrandRule()
    );

    private final List<CardTokenRule> rules;

    public CardTokenRules(List<CardTokenRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static CardTokenRules defaults() {
        return new CardTokenRules(DEFAULT_RULES);
    }

    public void evaluateRules(CardToken cardToken, ValidationErrors errors) {
        for (CardTokenRule rule : rules) {
            int before = errors.size();
            rule.evaluate(cardToken, errors);
            log.debug("Rule {} added {} finding(s)", rule.getRuleName(), errors.size() - before);
        }
    }

    public List<CardTokenRule> getRules() {
        return rules;
    }
}
