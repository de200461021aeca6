package com.cardtoken.cards;

/**
 * A payment instrument the gateway client can charge.
 */
public interface PaymentSource {

    /**
     * Whether this source is a bank check (eCheck) rather than a card.
     */
    boolean isCheck();
}
