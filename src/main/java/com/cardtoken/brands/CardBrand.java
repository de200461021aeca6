package com.cardtoken.brands;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Registry of credit card brands recognized by the gateway client.
 *
 * Only some brands have a gateway card type code. A brand without one is still
 * accepted as brand metadata on a card token, it just cannot be sent as a card type.
 */
public enum CardBrand {

    VISA("visa", "VI"),
    MASTER("master", "MC"),
    DISCOVER("discover", "DI"),
    AMERICAN_EXPRESS("american_express", "AX"),
    DINERS_CLUB("diners_club", "DI"),
    JCB("jcb", "DI"),
    SWITCH("switch", null),
    SOLO("solo", null),
    DANKORT("dankort", null),
    MAESTRO("maestro", null),
    FORBRUGSFORENINGEN("forbrugsforeningen", null),
    LASER("laser", null);

    private static final Map<String, CardBrand> BY_KEY = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(CardBrand::getKey, Function.identity()));

    private final String key;
    private final String typeCode;

    CardBrand(String key, String typeCode) {
        this.key = key;
        this.typeCode = typeCode;
    }

    /**
     * Lowercase identifier used in requests, e.g. {@code american_express}.
     */
    public String getKey() {
        return key;
    }

    /**
     * Two-letter gateway card type code, empty for brands the gateway has no code for.
     */
    public Optional<String> getTypeCode() {
        return Optional.ofNullable(typeCode);
    }

    public static Optional<CardBrand> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_KEY.get(key));
    }

    public static boolean isRecognized(String key) {
        return fromKey(key).isPresent();
    }

    /**
     * All recognized brand keys.
     */
    public static Set<String> keys() {
        return Collections.unmodifiableSet(BY_KEY.keySet());
    }
}
