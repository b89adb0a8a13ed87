package org.py2smt.translator;

import com.typesafe.config.Config;
import org.py2smt.translator.api.TranslationOptions;
import org.py2smt.translator.api.TypeConfig;
import org.py2smt.translator.diagnostics.TranslatorLogger;

/**
 * Builds a {@link Translator} from the {@code py2smt} configuration block:
 * <pre>
 * py2smt {
 *   types { parameter = "Int", return = "Int" }
 *   translation { strict = false, division-symbol = "/" }
 *   verbosity = 2
 * }
 * </pre>
 */
public final class TranslatorFactory {

    private TranslatorFactory() {}

    /**
     * @param config The root configuration, containing a {@code py2smt} block.
     * @return A translator with the configured sorts and layout.
     * @throws com.typesafe.config.ConfigException if a required key is missing or has the wrong type.
     */
    public static Translator fromConfig(Config config) {
        Config py2smt = config.getConfig("py2smt");
        TypeConfig types = new TypeConfig(
                py2smt.getString("types.parameter"),
                py2smt.getString("types.return"));
        TranslationOptions options = new TranslationOptions(
                py2smt.getBoolean("translation.strict"),
                py2smt.getString("translation.division-symbol"));
        if (py2smt.hasPath("verbosity")) {
            TranslatorLogger.setLevel(py2smt.getInt("verbosity"));
        }
        return new Translator(types, options);
    }
}
