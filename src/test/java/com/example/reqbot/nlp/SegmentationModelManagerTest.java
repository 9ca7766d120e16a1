package com.example.reqbot.nlp;

import com.example.reqbot.TestFixtures;
import com.example.reqbot.language.LanguageProfileStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SegmentationModelManagerTest {

    @TempDir
    Path tempDir;

    private LanguageProfileStore profileStore;
    private CountingLoader loader;
    private SegmentationModelManager manager;

    /** BreakIterator loader that counts loads, is slow, and can refuse languages. */
    static final class CountingLoader implements SegmentationModelLoader {
        final AtomicInteger loads = new AtomicInteger();
        final AtomicInteger attempts = new AtomicInteger();
        final Set<String> unavailable = ConcurrentHashMap.newKeySet();

        @Override
        public SegmentationModel load(String languageCode, String modelId) {
            attempts.incrementAndGet();
            if (unavailable.contains(languageCode)) {
                throw new ModelUnavailableException("no model for " + languageCode);
            }
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            loads.incrementAndGet();
            return new BreakIteratorSegmentationModel(modelId, Locale.forLanguageTag(languageCode));
        }
    }

    @BeforeEach
    void setUp() {
        profileStore = TestFixtures.profileStore(tempDir);
        loader = new CountingLoader();
        manager = new SegmentationModelManager(profileStore, loader);
    }

    @Test
    void concurrentFirstRequests_shouldLoadOnceAndShareInstance() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<SegmentationModel>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return manager.getModel("de");
                }));
            }
            start.countDown();

            SegmentationModel first = futures.get(0).get(5, TimeUnit.SECONDS).orElseThrow();
            for (Future<Optional<SegmentationModel>> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).containsSame(first);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(loader.loads.get()).isEqualTo(1);
    }

    @Test
    void getModel_shouldUseModelIdFromProfile() {
        SegmentationModel model = manager.getModel("fr").orElseThrow();

        assertThat(model.id()).isEqualTo(profileStore.getModelId("fr").orElseThrow());
        assertThat(manager.loadedModels()).containsExactly("fr");
    }

    @Test
    void unavailableModel_shouldFallBackToDefaultLanguage() {
        loader.unavailable.add("it");

        SegmentationModel model = manager.getModel("it").orElseThrow();

        assertThat(model.id()).isEqualTo(profileStore.getModelId("en").orElseThrow());
        assertThat(manager.getModel("en")).containsSame(model);
        assertThat(loader.loads.get()).isEqualTo(1);
    }

    @Test
    void unknownLanguage_shouldFallBackToDefaultLanguage() {
        assertThat(manager.getModel("xx")).isPresent();
        assertThat(manager.isLoaded("xx")).isTrue();
    }

    @Test
    void noLoadableModel_shouldReturnEmptyWithoutRetrying() {
        loader.unavailable.add("it");
        loader.unavailable.add("en");

        assertThat(manager.getModel("it")).isEmpty();
        int attempts = loader.attempts.get();
        assertThat(manager.getModel("it")).isEmpty();

        assertThat(loader.attempts.get()).isEqualTo(attempts);
        assertThat(manager.extractSentences("The system shall log every access attempt.", "it", 5, 100)).isEmpty();
    }

    @Test
    void unloadAll_shouldForgetModelsAndFailures() {
        loader.unavailable.add("es");
        manager.getModel("es");
        manager.getModel("fr");
        loader.unavailable.clear();

        manager.unloadAll();

        assertThat(manager.loadedModels()).isEmpty();
        SegmentationModel es = manager.getModel("es").orElseThrow();
        assertThat(es.id()).isEqualTo(profileStore.getModelId("es").orElseThrow());
    }

    @Test
    void unload_shouldForceReload() {
        SegmentationModel before = manager.getModel("en").orElseThrow();
        manager.unload("en");

        SegmentationModel after = manager.getModel("en").orElseThrow();

        assertThat(after).isNotSameAs(before);
        assertThat(loader.loads.get()).isEqualTo(2);
    }

    @Test
    void unloadDefault_shouldReleaseFallbackUsersToo() {
        loader.unavailable.add("it");
        SegmentationModel fallback = manager.getModel("it").orElseThrow();
        manager.getModel("fr");

        manager.unload("en");

        assertThat(manager.loadedModels()).containsExactly("fr");
        assertThat(manager.getModel("it").orElseThrow()).isNotSameAs(fallback);
        assertThat(manager.isLoaded("en")).isTrue();
    }

    @Test
    void extractSentences_shouldFilterByWordCount() {
        String text = "Short one. The system shall record every failed login attempt in the audit log.";

        List<Sentence> sentences = manager.extractSentences(text, "en", 5, 100);

        assertThat(sentences).extracting(Sentence::text)
                .containsExactly("The system shall record every failed login attempt in the audit log.");
        assertThat(sentences.get(0).wordCount()).isEqualTo(12);
    }

    @Test
    void extractSentences_shouldRejectRunOnSentence() {
        StringBuilder runOn = new StringBuilder("The system shall");
        for (int i = 0; i < 147; i++) {
            runOn.append(" word");
        }
        runOn.append('.');

        assertThat(manager.extractSentences(runOn.toString(), "en", 5, 100)).isEmpty();
    }

    @Test
    void extractSentences_shouldTreatBlankLinesAsBoundariesAndLineBreaksAsSpaces() {
        String text = "Interface requirements for the ground station\n\n"
                + "The operator console shall display the\ncurrent telemetry values at all times.";

        List<Sentence> sentences = manager.extractSentences(text, "en", 5, 100);

        assertThat(sentences).extracting(Sentence::text).containsExactly(
                "Interface requirements for the ground station",
                "The operator console shall display the current telemetry values at all times.");
        Sentence second = sentences.get(1);
        assertThat(second.start()).isEqualTo(text.indexOf("The operator"));
        assertThat(second.end()).isEqualTo(text.length());
    }

    @Test
    void extractSentences_shouldBeRestartable() {
        String text = "The system shall record every failed login attempt. The operator must confirm the launch order.";

        List<Sentence> sentences = manager.extractSentences(text, "en", 5, 100);

        assertThat(sentences).hasSize(2);
        assertThat(manager.extractSentences(text, "en", 5, 100)).isEqualTo(sentences);
    }
}
