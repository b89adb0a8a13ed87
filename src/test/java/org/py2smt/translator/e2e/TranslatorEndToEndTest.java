package org.py2smt.translator.e2e;

import org.py2smt.junit.extensions.logging.AllowLog;
import org.py2smt.junit.extensions.logging.ExpectLog;
import org.py2smt.junit.extensions.logging.LogLevel;
import org.py2smt.junit.extensions.logging.LogWatchExtension;
import org.py2smt.translator.Translator;
import org.py2smt.translator.api.TranslatedFunction;
import org.py2smt.translator.api.TranslationException;
import org.py2smt.translator.api.TranslationOptions;
import org.py2smt.translator.api.TranslationResult;
import org.py2smt.translator.api.TranslatorErrorCode;
import org.py2smt.translator.api.TypeConfig;
import org.py2smt.translator.api.UnsupportedConstructException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the whole pipeline from Python source text to SMT-LIB2.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
public class TranslatorEndToEndTest {

    private static final String AREA_OR_CAP = String.join("\n",
            "",
            "def example_function(radius):",
            "    pi = 3.14",
            "    # Calculate the area of the circle",
            "    area = pi * radius * radius",
            "    if area > 50:",
            "        return 50",
            "    else:",
            "        return area",
            "");

    private static final String MISSING_ELSE = String.join("\n",
            "",
            "def example_function_2(x, y):",
            "    result = x + y",
            "    # This is a single-line comment",
            "",
            "    if result != 0:",
            "        \"\"\"This is a multiline comment.",
            "        It spans multiple lines.",
            "        \"\"\"",
            "",
            "        return -10",
            "    elif result >= 15 * x :",
            "        return -result",
            "    return x%y",
            "    ");

    @Test
    void translatesAreaOrCapScenario() throws Exception {
        String smt = new Translator().translate(AREA_OR_CAP, "area.py");

        assertThat(smt).isEqualTo("(define-fun example_function ((radius Int)) Int (let pi 3.14)\n"
                + "(let area (* (* pi radius) radius))\n"
                + "(ite (> area 50) 50 area))");
    }

    @Test
    void translatesMissingElseScenario() throws Exception {
        String smt = new Translator().translate(MISSING_ELSE, "missing_else.py");

        assertThat(smt).isEqualTo("(define-fun example_function_2 ((x Int) (y Int)) Int (let result (+ x y))\n"
                + "(ite (not (= result 0)) (- 10) (ite (>= result (* 15 x)) (- result) ))\n"
                + "(mod x y))");
    }

    @Test
    void strictLayoutProducesSingleTermBodies() throws Exception {
        Translator strict = new Translator(TypeConfig.DEFAULT, TranslationOptions.DEFAULT.withStrict(true));

        assertThat(strict.translate(AREA_OR_CAP, "area.py")).isEqualTo(
                "(define-fun example_function ((radius Int)) Int "
                        + "(let ((pi 3.14)) (let ((area (* (* pi radius) radius))) (ite (> area 50) 50 area))))");
        assertThat(strict.translate(MISSING_ELSE, "missing_else.py")).isEqualTo(
                "(define-fun example_function_2 ((x Int) (y Int)) Int "
                        + "(let ((result (+ x y))) (ite (not (= result 0)) (- 10) "
                        + "(ite (>= result (* 15 x)) (- result) (mod x y)))))");
    }

    @Test
    void sortLabelsComeFromTheTypeConfiguration() throws Exception {
        Translator translator = new Translator(new TypeConfig("Real", "Bool"), TranslationOptions.DEFAULT);

        String smt = translator.translate("def positive(v):\n    return v > 0.0\n", "p.py");

        assertThat(smt).isEqualTo("(define-fun positive ((v Real)) Bool (> v 0.0))");
    }

    @Test
    void loopIsRejectedAndNoOutputIsProduced() {
        String source = String.join("\n",
                "def total(n):",
                "    s = 0",
                "    for i in range(n):",
                "        s = s + i",
                "    return s",
                "");

        assertThatThrownBy(() -> new Translator().translate(source, "loop.py"))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessage("Unsupported construct: for loop at loop.py:3");
    }

    @Test
    void syntaxErrorCarriesTheDiagnosticsSummary() {
        assertThatThrownBy(() -> new Translator().translate("def f(x)\n    return x\n", "broken.py"))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("broken.py:1")
                .extracting(e -> ((TranslationException) e).getErrorCode())
                .isEqualTo(TranslatorErrorCode.SYNTAX_ERROR);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Function 'bad' not translated: .*")
    void translateEachKeepsFunctionsIndependent() throws Exception {
        String source = String.join("\n",
                "def good(a, b):",
                "    return a / b",
                "",
                "def bad(a):",
                "    return abs(a)",
                "",
                "def also_good(a):",
                "    return not a",
                "");

        TranslationResult result = new Translator().translateEach(source, "mixed.py");

        assertThat(result.isComplete()).isFalse();
        assertThat(result.functions()).extracting(TranslatedFunction::name).containsExactly("good", "bad", "also_good");
        assertThat(result.failures()).singleElement()
                .satisfies(f -> {
                    assertThat(f.errorCode()).isEqualTo(TranslatorErrorCode.UNSUPPORTED_CONSTRUCT);
                    assertThat(f.line()).isEqualTo(4);
                });
        assertThat(result.smtText()).isEqualTo(
                "(define-fun good ((a Int) (b Int)) Int (/ a b))\n(define-fun also_good ((a Int)) Int (not a))");
    }

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*PreProcessor")
    void unterminatedDocstringIsAWarningFollowedBySyntaxError() {
        String source = "def f(x):\n    \"\"\"open\n    return x\n";

        assertThatThrownBy(() -> new Translator().translateEach(source, "doc.py"))
                .isInstanceOf(TranslationException.class)
                .extracting(e -> ((TranslationException) e).getErrorCode())
                .isEqualTo(TranslatorErrorCode.SYNTAX_ERROR);
    }

    @Test
    void translatesSourceFilesFromDisk(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("area.py");
        Files.writeString(file, AREA_OR_CAP);

        assertThat(new Translator().translate(file)).startsWith("(define-fun example_function ");
    }
}
