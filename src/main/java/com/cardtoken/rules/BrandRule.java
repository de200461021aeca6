package com.cardtoken.rules;

import com.cardtoken.brands.CardBrand;
import com.cardtoken.cards.CardToken;
import com.cardtoken.validation.FieldErrorCode;
import com.cardtoken.validation.ValidationErrors;

/**
 * Rule that accepts a blank brand or any brand in the {@link CardBrand} registry.
 */
public class BrandRule implements CardTokenRule {

    @Override
    public void evaluate(CardToken cardToken, ValidationErrors errors) {
        String brand = cardToken.getBrand();

        if (brand != null && !brand.isBlank() && !CardBrand.isRecognized(brand)) {
            errors.add(FieldErrorCode.INVALID_BRAND);
        }
    }

    @Override
    public String getRuleName() {
        return "Brand";
    }
}
