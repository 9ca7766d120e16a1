package com.example.reqbot.nlp;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerTest {

    @Test
    void tokenize_shouldLowerCaseAndDropPunctuation() {
        assertThat(Tokenizer.tokenize("The System SHALL log, every (failed) login!"))
                .containsExactly("the", "system", "shall", "log", "every", "failed", "login");
    }

    @Test
    void tokenize_shouldKeepInnerApostrophesAndHyphens() {
        assertThat(Tokenizer.tokenize("l'utilisateur doesn't need real-time - data"))
                .containsExactly("l'utilisateur", "doesn't", "need", "real-time", "data");
    }

    @Test
    void tokenize_shouldHandleAccentedLetters() {
        assertThat(Tokenizer.tokenize("Le système doit GÉRER l'accès"))
                .containsExactly("le", "système", "doit", "gérer", "l'accès");
    }

    @Test
    void containsPhrase_shouldNeverMatchSubstrings() {
        List<String> tokens = Tokenizer.tokenize("Marshall was the commander of the operation");

        assertThat(Tokenizer.containsPhrase(tokens, "shall")).isFalse();
        assertThat(Tokenizer.containsPhrase(tokens, "commander")).isTrue();
    }

    @Test
    void indexOf_shouldMatchMultiWordPhrasesAsConsecutiveTokens() {
        List<String> tokens = Tokenizer.tokenize("The operator has to confirm, and the system has logged it");

        assertThat(Tokenizer.indexOf(tokens, "has to")).isEqualTo(2);
        assertThat(Tokenizer.indexOf(tokens, "to has")).isEqualTo(-1);
        assertThat(Tokenizer.indexOf(tokens, "")).isEqualTo(-1);
        assertThat(Tokenizer.containsAny(tokens, Set.of("must", "has to"))).isTrue();
    }

    @Test
    void isNumeric_shouldRecognizeNumbersAndRanges() {
        assertThat(Tokenizer.isNumeric("2024")).isTrue();
        assertThat(Tokenizer.isNumeric("10-20")).isTrue();
        assertThat(Tokenizer.isNumeric("v2")).isFalse();
        assertThat(Tokenizer.isNumeric("")).isFalse();
    }
}
