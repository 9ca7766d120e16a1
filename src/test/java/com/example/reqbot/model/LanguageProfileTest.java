package com.example.reqbot.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageProfileTest {

    private static LanguageProfile profile(String modelId, Set<String> keywords) {
        return new LanguageProfile("en", "English", modelId, keywords,
                Set.of("Shall"), Set.of("should"), Set.of("may"), Set.of("security"),
                Map.of(PatternGroup.MODAL, List.of("\\bshall\\s+provide\\b")), Map.of());
    }

    @Test
    void isValid_shouldRequireKeywordsAndModelId() {
        assertThat(profile("en-sent", Set.of("shall")).isValid()).isTrue();
        assertThat(profile("en-sent", Set.of()).isValid()).isFalse();
        assertThat(profile(" ", Set.of("shall")).isValid()).isFalse();
    }

    @Test
    void constructor_shouldLowerCaseKeywords() {
        LanguageProfile profile = profile("en-sent", Set.of("SHALL", " Must "));

        assertThat(profile.keywords()).containsExactlyInAnyOrder("shall", "must");
        assertThat(profile.priorityKeywords(Priority.HIGH)).containsExactly("shall");
        assertThat(profile.priorityKeywords(Priority.SECURITY)).containsExactly("security");
    }

    @Test
    void mergedWith_shouldAddDomainKeywordsAndTiers() {
        LanguageProfile base = profile("en-sent", Set.of("shall"));
        KeywordProfile domain = new KeywordProfile("Aerospace",
                Set.of("Is Obliged To"), Set.of("is obliged to"), Set.of(), Set.of("optionally"));

        LanguageProfile merged = base.mergedWith(domain);

        assertThat(merged.keywords()).containsExactlyInAnyOrder("shall", "is obliged to");
        assertThat(merged.priorityHigh()).containsExactlyInAnyOrder("shall", "is obliged to");
        assertThat(merged.priorityLow()).containsExactlyInAnyOrder("may", "optionally");
        assertThat(merged.securityKeywords()).isEqualTo(base.securityKeywords());
        assertThat(merged.patterns(PatternGroup.MODAL)).isEqualTo(base.patterns(PatternGroup.MODAL));
        assertThat(base.mergedWith(KeywordProfile.empty())).isSameAs(base);
    }

    @Test
    void extractionRequest_shouldApplyDefaults() {
        ExtractionRequest request = new ExtractionRequest(" ", Arrays.asList("page", null), null, null, null);

        assertThat(request.documentId()).isEqualTo("document");
        assertThat(request.pages()).containsExactly("page", "");
        assertThat(request.keywordProfile().isEmpty()).isTrue();
    }
}
