package com.raditha.divergence.normalization;

import com.raditha.divergence.config.NormalizationOptions;
import net.jqwik.api.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Property-based checks: normalization is deterministic, idempotent and
 * blind to consistent renaming of values and labels.
 */
class IRNormalizerPropertiesTest {

    private final IRNormalizer normalizer = new IRNormalizer();

    @Property
    void normalizationIsIdempotent(@ForAll("irText") String text, @ForAll("options") NormalizationOptions options) {
        String once = normalizer.normalize(text, options);
        String twice = normalizer.normalize(once, options);
        assertEquals(once, twice);
    }

    @Property
    void normalizationIsDeterministic(@ForAll("irText") String text) {
        NormalizationOptions options = NormalizationOptions.defaults();
        assertEquals(normalizer.normalize(text, options), normalizer.normalize(text, options));
    }

    @Property
    void consistentRenamingDoesNotChangeResult(@ForAll("irText") String text) {
        Map<String, String> renames = Map.of(
                "%x", "%value.1",
                "%y", "%other",
                "entry", "start",
                "%entry", "%start",
                "loop", "header",
                "%loop", "%header");
        String renamed = rename(text, renames);

        NormalizationOptions options = NormalizationOptions.defaults();
        assertEquals(normalizer.normalize(text, options), normalizer.normalize(renamed, options));
    }

    @Provide
    Arbitrary<String> irText() {
        return Arbitraries.of(
                        "entry:",
                        "loop:",
                        "  %x = add i32 %y, 1",
                        "  br label %entry",
                        "  br i1 %x, label %loop, label %entry",
                        "  %y = load i32, ptr %x",
                        "  ret i32 %x ; result",
                        "  call void @f(), !dbg !3",
                        "!0 = !{i32 1}",
                        "",
                        "   ",
                        "  @s = constant [3 x i8] c\"a;b\"")
                .list().ofMaxSize(20)
                .map(lines -> String.join("\n", lines));
    }

    @Provide
    Arbitrary<NormalizationOptions> options() {
        return Arbitraries.of(true, false).list().ofSize(7).map(flags -> new NormalizationOptions(
                flags.get(0), flags.get(1), flags.get(2), flags.get(3), flags.get(4), flags.get(5), flags.get(6)));
    }

    /**
     * Whole-line rewrite through the fixed vocabulary, so every occurrence changes together.
     */
    private static String rename(String text, Map<String, String> renames) {
        return text.lines()
                .map(line -> renameLine(line, renames))
                .collect(Collectors.joining("\n"));
    }

    private static String renameLine(String line, Map<String, String> renames) {
        if (line.equals("entry:")) {
            return "start:";
        }
        if (line.equals("loop:")) {
            return "header:";
        }
        List<String> parts = List.of(line.split("(?=[ ,])|(?<=[ ,])"));
        return parts.stream().map(p -> renames.getOrDefault(p, p)).collect(Collectors.joining());
    }
}
