package com.example.reqbot;

import com.example.reqbot.language.LanguageProfileStore;
import com.example.reqbot.service.CandidateFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ReqBotApplicationTest {

    private static final Path CONFIG_PATH = tempConfigPath();

    @DynamicPropertySource
    static void profileLocation(DynamicPropertyRegistry registry) {
        registry.add("reqbot.profiles.config-path", CONFIG_PATH::toString);
    }

    private static Path tempConfigPath() {
        try {
            return Files.createTempDirectory("reqbot").resolve("language_profiles.json");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Autowired
    private MockMvc mvc;

    @Autowired
    private LanguageProfileStore profileStore;

    @Autowired
    private CandidateFilter candidateFilter;

    @Test
    void contextLoads_withDefaultProfiles() {
        assertThat(profileStore.supportedLanguages()).contains("en", "fr", "de", "it", "es");
        assertThat(profileStore.configPath()).isEqualTo(CONFIG_PATH);
        assertThat(Files.exists(CONFIG_PATH)).isTrue();
    }

    @Test
    void candidateFilter_shouldBeBuiltFromConfiguredWordBounds() {
        assertThat(candidateFilter.minWords()).isEqualTo(5);
        assertThat(candidateFilter.maxWords()).isEqualTo(100);
    }

    @Test
    void extractionEndpoint_shouldRunWholePipeline() throws Exception {
        mvc.perform(post("/api/requirements")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"documentId": "SRS",
                                 "pages": ["The system shall provide user authentication.\\nPage 1 of 2",
                                           "The operator must enable security logging on every console."]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records.length()").value(2))
                .andExpect(jsonPath("$.records[0].label").value("SRS-Req#1-1"))
                .andExpect(jsonPath("$.records[0].priority").value("high"))
                .andExpect(jsonPath("$.records[1].label").value("SRS-Req#2-2"))
                .andExpect(jsonPath("$.records[1].priority").value("security"))
                .andExpect(jsonPath("$.records[1].category").value("Security"));
    }

    @Test
    void healthEndpoint_shouldBeUp() throws Exception {
        mvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }
}
