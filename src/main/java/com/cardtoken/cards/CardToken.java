package com.cardtoken.cards;

import com.cardtoken.brands.CardBrand;
import com.cardtoken.rules.CardTokenRules;
import com.cardtoken.validation.Validateable;
import com.cardtoken.validation.ValidationErrors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A tokenized credit card: the gateway-issued token that stands in for the
 * card number, plus optional expiration and brand metadata.
 *
 * Fields are not checked on construction. Call {@link #validate(ValidationErrors)}
 * to find out whether the token is acceptable.
 *
 * <pre>
 * CardToken token = CardToken.builder()
 *     .token("1234567890123456")
 *     .month(9)
 *     .year(2010)
 *     .brand("visa")
 *     .verificationValue("123")
 *     .build();
 *
 * token.isValid();    // true
 * token.getExpDate(); // "0910"
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CardToken implements PaymentSource, Validateable {

    private static final CardTokenRules RULES = CardTokenRules.defaults();

    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?)(\\d+)");

    /**
     * Gateway-issued numeric token. (required)
     */
    @ToString.Exclude
    private String token;

    /**
     * Expiry month of the card behind the token. (optional)
     */
    private Integer month;

    /**
     * Four digit expiry year of the card behind the token. (optional)
     */
    private Integer year;

    /**
     * Card verification value. (optional)
     */
    @ToString.Exclude
    private String verificationValue;

    /**
     * Brand key, see {@link CardBrand}. (optional)
     */
    private String brand;

    /**
     * Gateway card type code for the brand, e.g. {@code VI} for visa.
     * Empty when no brand is set or the brand has no type code.
     */
    public Optional<String> getType() {
        if (brand == null || brand.isBlank()) {
            return Optional.empty();
        }
        return CardBrand.fromKey(brand).flatMap(CardBrand::getTypeCode);
    }

    /**
     * Whether both expiration month and year are set.
     */
    public boolean hasExpDate() {
        return coerce(month) != 0 && coerce(year) != 0;
    }

    /**
     * Expiration date in MMYY format, or an empty string when not set.
     */
    public String getExpDate() {
        if (!hasExpDate()) {
            return "";
        }
        String yearDigits = String.valueOf(coerce(year));
        String shortYear = yearDigits.substring(Math.min(2, yearDigits.length()), Math.min(4, yearDigits.length()));
        return String.format(Locale.ROOT, "%02d", coerce(month)) + shortYear;
    }

    @Override
    public boolean isCheck() {
        return false;
    }

    /**
     * Normalizes month and year, then runs the token, expiration and brand checks.
     */
    @Override
    public void validate(ValidationErrors errors) {
        normalize();
        RULES.evaluateRules(this, errors);
    }

    /**
     * Replace month and year with their integer values, unset becoming 0.
     */
    void normalize() {
        this.month = coerce(month);
        this.year = coerce(year);
    }

    /**
     * Convert integer-like input to an int.
     *
     * Leading digits (with an optional sign) are parsed, so {@code "9"} and
     * {@code "09"} give 9 and {@code "9abc"} also gives 9. Null, blank and
     * non-numeric input give 0. Values too large for an int saturate, whether
     * given as text or as a wider number type.
     */
    public static int coerce(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Double || value instanceof Float) {
            // truncates toward zero, saturates, NaN gives 0
            return (int) ((Number) value).doubleValue();
        }

        String text = value instanceof BigDecimal ? ((BigDecimal) value).toPlainString() : value.toString();
        Matcher matcher = LEADING_INTEGER.matcher(text);
        if (!matcher.find()) {
            return 0;
        }

        boolean negative = "-".equals(matcher.group(1));
        String digits = matcher.group(2).replaceFirst("^0+(?=\\d)", "");
        if (digits.length() > 10) {
            return negative ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        }
        long parsed = Long.parseLong(digits);
        long signed = negative ? -parsed : parsed;
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, signed));
    }
}
