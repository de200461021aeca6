package com.cardtoken.cards;

import com.cardtoken.api.dto.CardTokenValidationResponse;
import com.cardtoken.common.exception.InvalidCardTokenException;
import com.cardtoken.validation.FieldErrorCode;
import com.cardtoken.validation.ValidationErrors;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for CardTokenService.
 */
@SpringBootTest
@ActiveProfiles("test")
class CardTokenServiceTest {

    @Autowired
    private CardTokenService cardTokenService;

    @Test
    void testValidate_ReturnsAllFindings() {
        CardToken cardToken = CardToken.builder()
            .token("abc")
            .month(13)
            .year(2010)
            .brand("unknown_brand")
            .build();

        ValidationErrors errors = cardTokenService.validate(cardToken);

        assertEquals(3, errors.size());
        assertTrue(errors.contains(FieldErrorCode.INVALID_TOKEN));
        assertTrue(errors.contains(FieldErrorCode.INVALID_EXPIRATION_MONTH));
        assertTrue(errors.contains(FieldErrorCode.INVALID_BRAND));
    }

    @Test
    void testRequireValid_Accepted() {
        CardToken cardToken = CardToken.builder()
            .token("4111111111111111")
            .month(9)
            .year(2030)
            .brand("visa")
            .build();

        CardToken accepted = cardTokenService.requireValid(cardToken);

        assertSame(cardToken, accepted);
        assertEquals("0930", accepted.getExpDate());
    }

    @Test
    void testRequireValid_Rejected() {
        CardToken cardToken = CardToken.builder()
            .token("4111111111111111")
            .month(0)
            .year(1980)
            .build();

        InvalidCardTokenException e = assertThrows(InvalidCardTokenException.class,
            () -> cardTokenService.requireValid(cardToken));

        assertTrue(e.getErrors().contains(FieldErrorCode.INVALID_EXPIRATION_YEAR));
        assertTrue(e.getMessage().contains("************1111"));
        assertFalse(e.getMessage().contains("4111111111111111"));
    }

    @Test
    void testDescribe_ValidToken() {
        CardToken cardToken = CardToken.builder()
            .token("123456789012")
            .month(9)
            .year(2010)
            .brand("visa")
            .build();

        CardTokenValidationResponse response = cardTokenService.describe(cardToken);

        assertTrue(response.isValid());
        assertEquals("********9012", response.getMaskedToken());
        assertEquals("VI", response.getType());
        assertEquals("0910", response.getExpDate());
        assertTrue(response.isExpDateSet());
        assertFalse(response.isCheck());
        assertTrue(response.getErrors().isEmpty());
    }

    @Test
    void testDescribe_InvalidToken() {
        CardToken cardToken = CardToken.builder()
            .token("123456789012")
            .year(1980)
            .brand("unknown_brand")
            .build();

        CardTokenValidationResponse response = cardTokenService.describe(cardToken);

        assertFalse(response.isValid());
        assertEquals(List.of("is not a valid year"), response.getErrors().get("year"));
        assertEquals(List.of("is invalid"), response.getErrors().get("brand"));
        assertNull(response.getType());
        assertEquals("", response.getExpDate());
        assertTrue(response.getMessages().contains("Brand is invalid"));
    }
}
