package com.toolstock.notifier.delivery;

import com.toolstock.notifier.error.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class RecipientNormalizerTest {

    private final RecipientNormalizer normalizer = new RecipientNormalizer();

    @ParameterizedTest
    @CsvSource({
            "'+34 612 34 56 78', 34612345678",
            "0034612345678,      34612345678",
            "612-345-678,        34612345678",
            "'(91) 123.45.67',   34911234567",
            "34712345678,        34712345678",
            "' 612345678 ',      34612345678"
    })
    void normalize_acceptsCommonSpanishForms(final String raw, final String expected) {
        assertThat(normalizer.normalize(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"123", "12345", "512345678", "+44 7700 900123", "3461234567", "34612345678901", "61234567a"})
    void normalize_rejectsNonSpanishNumbers(final String raw) {
        assertThatThrownBy(() -> normalizer.normalize(raw))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Invalid Spanish number format");
    }

    @Test
    void normalize_rejectsBlankInput() {
        assertThatThrownBy(() -> normalizer.normalize("   "))
                .isInstanceOf(ValidationException.class)
                .hasMessage("recipient is empty");
        assertThatThrownBy(() -> normalizer.normalize(null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void normalize_doesNotLeakTheFullNumberInErrors() {
        assertThatThrownBy(() -> normalizer.normalize("6123456789999"))
                .isInstanceOf(ValidationException.class)
                .hasMessageNotContaining("6123456789999");
    }
}
