package dev.automate.engine;

/**
 * A command template whose placeholders or choice groups cannot be parsed.
 */
public class TemplateSyntaxException extends IllegalArgumentException {

    private final String template;

    public TemplateSyntaxException(String message, String template) {
        super("%s in template '%s'".formatted(message, template));
        this.template = template;
    }

    public String template() {
        return template;
    }
}
