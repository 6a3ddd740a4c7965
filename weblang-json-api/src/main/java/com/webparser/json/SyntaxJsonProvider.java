package com.webparser.json;

import com.webparser.Parser;
import com.webparser.Token;
import com.webparser.ast.WebCode;
import com.webparser.prettify.ModuleIdResolver;
import com.webparser.prettify.PrettifiedCode;
import com.webparser.prettify.PrettifierConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * JSON front end to the WEB parser and prettifier.
 *
 * <p>A provider reads the token stream of one code section as produced by an
 * external lexer, and optionally a layout configuration, and writes back either
 * the syntax tree or the laid-out result. Implementations (weblang-jackson) are
 * found through {@link ServiceLoader}.</p>
 *
 * <pre>{@code
 * SyntaxJsonProvider json = SyntaxJsonProvider.getProvider();
 * String layout = json.prettify(tokensJson, configJson, ModuleIdResolver.NONE);
 * }</pre>
 */
public interface SyntaxJsonProvider {

    SyntaxJsonSerializer getSerializer();

    SyntaxJsonDeserializer getDeserializer();

    /**
     * Short name used by {@link #getProvider(String)}, e.g. "Jackson".
     */
    String getName();

    // ========================================================================
    // Pipeline
    // ========================================================================

    /**
     * Parse a JSON token array into a syntax tree.
     *
     * @throws SyntaxJsonException       if the JSON is not a valid token array
     * @throws com.webparser.ParseException if the tokens do not parse
     */
    default WebCode parseTokens(String tokensJson) {
        List<Token> tokens = getDeserializer().deserializeTokens(tokensJson);
        return new Parser().parse(tokens);
    }

    /**
     * Parse a JSON token array and lay it out.
     *
     * @param configJson layout configuration, or null for the defaults
     */
    default PrettifiedCode render(String tokensJson, String configJson, ModuleIdResolver resolver) {
        PrettifierConfig config = configJson != null
            ? getDeserializer().deserializeConfig(configJson)
            : PrettifierConfig.defaults();
        return parseTokens(tokensJson).render(config, resolver);
    }

    /**
     * Tokens in, laid-out text with its scope operations and inserts out, all JSON.
     */
    default String prettify(String tokensJson, String configJson, ModuleIdResolver resolver) {
        return getSerializer().serialize(render(tokensJson, configJson, resolver));
    }

    // ========================================================================
    // Discovery
    // ========================================================================

    /**
     * Every provider on the classpath, in ServiceLoader order.
     */
    static List<SyntaxJsonProvider> providers() {
        List<SyntaxJsonProvider> found = new ArrayList<>();
        ServiceLoader.load(SyntaxJsonProvider.class).forEach(found::add);
        return found;
    }

    /**
     * @throws IllegalStateException if no provider is on the classpath
     */
    static SyntaxJsonProvider getProvider() {
        List<SyntaxJsonProvider> found = providers();
        if (found.isEmpty()) {
            throw new IllegalStateException("No WEB syntax JSON provider on the classpath; add weblang-jackson");
        }
        return found.get(0);
    }

    /**
     * @param name provider name, compared ignoring case
     * @throws IllegalStateException if no provider has that name
     */
    static SyntaxJsonProvider getProvider(String name) {
        List<SyntaxJsonProvider> found = providers();
        for (SyntaxJsonProvider provider : found) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        List<String> names = new ArrayList<>();
        found.forEach(p -> names.add(p.getName()));
        throw new IllegalStateException("No WEB syntax JSON provider named '" + name + "', found " + names);
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(SyntaxJsonProvider.class).findFirst().isPresent();
    }
}
