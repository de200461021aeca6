package com.cardtoken.brands;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CardBrandTest {

    @Test
    void testRecognizedKeys() {
        assertEquals(Set.of("visa", "master", "discover", "american_express", "diners_club", "jcb",
                "switch", "solo", "dankort", "maestro", "forbrugsforeningen", "laser"),
            CardBrand.keys());
    }

    @Test
    void testLookupIsExactMatch() {
        assertEquals(Optional.of(CardBrand.AMERICAN_EXPRESS), CardBrand.fromKey("american_express"));
        assertTrue(CardBrand.isRecognized("laser"));
        assertFalse(CardBrand.isRecognized("Visa"));
        assertFalse(CardBrand.isRecognized("mastercard"));
        assertFalse(CardBrand.isRecognized(null));
    }

    @Test
    void testOnlySixBrandsHaveTypeCodes() {
        long withCodes = Arrays.stream(CardBrand.values())
            .filter(brand -> brand.getTypeCode().isPresent())
            .count();

        assertEquals(6, withCodes);
        assertEquals(Optional.of("MC"), CardBrand.MASTER.getTypeCode());
        assertEquals(Optional.empty(), CardBrand.DANKORT.getTypeCode());
    }
}
