package ai.docsite.latex.generate;

import java.util.Map;

/**
 * Substitutes {@code {name}} placeholders in one pass. Only the names supplied are replaced; every other brace is
 * literal LaTeX, so {@code \label{{label}}} renders as {@code \label{value}}.
 */
final class TemplateRenderer {

    private TemplateRenderer() {
    }

    static String render(String template, Map<String, String> values) {
        StringBuilder builder = new StringBuilder(template.length() + 32);
        int index = 0;
        while (index < template.length()) {
            char ch = template.charAt(index);
            if (ch == '{') {
                int close = template.indexOf('}', index + 1);
                if (close > index + 1) {
                    String value = values.get(template.substring(index + 1, close));
                    if (value != null) {
                        builder.append(value);
                        index = close + 1;
                        continue;
                    }
                }
            }
            builder.append(ch);
            index++;
        }
        return builder.toString();
    }

    static String render(String template, String name, String value) {
        return render(template, Map.of(name, value));
    }
}
