package dev.automate.model;

/**
 * Concrete command text of one step, in the shapes its kind needs.
 */
public record ResolvedCommand(
    String writeForm, // nullable, value-bearing form
    String queryForm  // nullable, header-only form ending in '?'
) {
    public static ResolvedCommand write(String text) {
        return new ResolvedCommand(text, null);
    }

    public static ResolvedCommand query(String text) {
        return new ResolvedCommand(null, text);
    }
}
