package com.fontlint.engine;

import com.fontlint.config.RuleParser;
import com.fontlint.exception.UnknownTagException;
import com.fontlint.font.FontAttributes;
import com.fontlint.selection.ResolvedTests;
import com.fontlint.selection.RuleList;
import com.fontlint.tag.TagCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultFontLintEngine.
 */
class DefaultFontLintEngineTest {

    private final FontAttributes font = FontAttributes.builder()
            .filename("NotoSansThai-Regular.ttf").script("Thai").build();

    @Test
    @DisplayName("Unconfigured engine should run every test")
    void unconfiguredShouldRunAll() {
        FontLintEngine engine = DefaultFontLintEngine.unconfigured();

        ResolvedTests tests = engine.resolve(font);

        assertEquals(engine.getCatalog().tags(), tests.getEnabledTags());
        assertTrue(engine.getRules().isEmpty());
    }

    @Test
    @DisplayName("Reload should replace the rules")
    void reloadShouldReplaceRules() {
        FontLintEngine engine = new DefaultFontLintEngine(
                RuleParser.withDefaultCatalog().parse("disable reachable"));
        assertFalse(engine.resolve(font).check("reachable"));

        engine.reload("script Thai; disable paths");

        ResolvedTests tests = engine.resolve(font);
        assertTrue(tests.check("reachable"));
        assertFalse(tests.check("paths/extrema"));
        assertEquals(1, engine.getRules().size());
    }

    @Test
    @DisplayName("Failed reload should keep the current rules")
    void failedReloadShouldKeepRules() {
        RuleList original = RuleParser.withDefaultCatalog().parse("disable reachable");
        FontLintEngine engine = new DefaultFontLintEngine(original);

        assertThrows(UnknownTagException.class, () -> engine.reload("disable unreachable_tag"));

        assertSame(original, engine.getRules());
        assertFalse(engine.resolve(font).check("reachable"));
    }

    @Test
    @DisplayName("Resolution should stay consistent while rules are swapped")
    void concurrentResolveAndReload() throws Exception {
        DefaultFontLintEngine engine = DefaultFontLintEngine.unconfigured();
        RuleList disabling = RuleParser.withDefaultCatalog().parse("disable reachable");
        RuleList enabling = new RuleList(TagCatalog.defaultCatalog());
        int total = engine.getCatalog().size();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 3; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int n = 0; n < 200; n++) {
                        int size = engine.resolve(font).getEnabledTags().size();
                        if (size != total && size != total - 1) {
                            return false;
                        }
                    }
                    return true;
                }));
            }
            futures.add(pool.submit(() -> {
                start.await();
                for (int n = 0; n < 200; n++) {
                    engine.updateRules(n % 2 == 0 ? disabling : enabling);
                }
                return true;
            }));

            start.countDown();
            for (Future<Boolean> future : futures) {
                assertTrue(future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
