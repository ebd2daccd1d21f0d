package com.phillippitts.presetgraph.service.template;

import java.util.Map;

/**
 * Substitutes {@code {key}} placeholders in a block's prompt template.
 *
 * <p>Order matters:
 * <ol>
 *   <li>every {@code {key}} of {@code vars} is replaced with its value;</li>
 *   <li>a remaining {@code {language1}} is replaced with the selected language, unless
 *       {@code vars} defines {@code language1} itself;</li>
 *   <li>any remaining {@code {language}} is replaced with the selected language.</li>
 * </ol>
 * No other placeholder syntax is recognised.
 */
public final class TemplateResolver {

    static final String LANGUAGE1 = "language1";
    private static final String LANGUAGE1_TOKEN = "{" + LANGUAGE1 + "}";
    private static final String LANGUAGE_TOKEN = "{language}";

    private TemplateResolver() {}

    public static String resolve(String template, Map<String, String> vars, String selectedLanguage) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        String language = selectedLanguage == null ? "" : selectedLanguage;
        String result = template;
        if (vars != null) {
            for (Map.Entry<String, String> entry : vars.entrySet()) {
                String value = entry.getValue() == null ? "" : entry.getValue();
                result = result.replace("{" + entry.getKey() + "}", value);
            }
        }
        boolean varsDefineLanguage1 = vars != null && vars.containsKey(LANGUAGE1);
        if (!varsDefineLanguage1 && result.contains(LANGUAGE1_TOKEN)) {
            result = result.replace(LANGUAGE1_TOKEN, language);
        }
        return result.replace(LANGUAGE_TOKEN, language);
    }
}
