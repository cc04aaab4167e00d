package com.calibration.dcm.parser;

import com.calibration.dcm.parser.DcmToken.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DcmTokenizer.
 */
class DcmTokenizerTest {

    @Test
    void testSplitsOnWhitespace() {
        List<DcmToken> tokens = DcmTokenizer.tokenize("WERT   0.75\t-0.25  0.5");

        assertThat(tokens).extracting(DcmToken::getValue).containsExactly("WERT", "0.75", "-0.25", "0.5");
        assertThat(tokens).allMatch(t -> t.getType() == TokenType.WORD);
    }

    @Test
    void testQuotedRunIsOneToken() {
        List<DcmToken> tokens = DcmTokenizer.tokenize("TEXT \"first value\" \"second\"");

        assertThat(tokens).extracting(DcmToken::getValue).containsExactly("TEXT", "first value", "second");
        assertThat(tokens.get(1).isQuoted()).isTrue();
        assertThat(tokens.get(0).isQuoted()).isFalse();
    }

    @Test
    void testUnterminatedQuoteRunsToEndOfLine() {
        List<DcmToken> tokens = new DcmTokenizer("LANGNAME \"open text").tokenize();

        assertThat(tokens).extracting(DcmToken::getValue).containsExactly("LANGNAME", "open text");
    }

    @Test
    void testEmptyLine() {
        assertThat(DcmTokenizer.tokenize("   ")).isEmpty();
    }
}
