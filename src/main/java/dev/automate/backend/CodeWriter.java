package dev.automate.backend;

/**
 * Indentation-aware builder for generated Python source.
 */
public final class CodeWriter {

    private final String indentUnit;
    private final StringBuilder out = new StringBuilder();
    private int depth;

    public CodeWriter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    /** Appends one line at the current depth; an empty string appends a blank line. */
    public CodeWriter line(String text) {
        if (text.isBlank()) {
            out.append('\n');
        } else {
            out.append(indentUnit.repeat(depth)).append(text).append('\n');
        }
        return this;
    }

    /**
     * Appends a block of lines at the current depth after removing the indentation the block
     * shares, so pasted code keeps its own relative nesting.
     */
    public CodeWriter lines(String block) {
        String[] rows = block.replace("\r\n", "\n").replace('\t', ' ').split("\n", -1);
        int common = Integer.MAX_VALUE;
        for (String row : rows) {
            if (!row.isBlank()) {
                common = Math.min(common, row.length() - row.stripLeading().length());
            }
        }
        int end = rows.length;
        while (end > 0 && rows[end - 1].isBlank()) {
            end--;
        }
        for (int i = 0; i < end; i++) {
            String row = rows[i];
            line(row.isBlank() ? "" : row.substring(common).stripTrailing());
        }
        return this;
    }

    /** Appends text another writer already indented. */
    public CodeWriter append(String text) {
        out.append(text);
        return this;
    }

    public CodeWriter blank() {
        out.append('\n');
        return this;
    }

    public CodeWriter indent() {
        depth++;
        return this;
    }

    public CodeWriter dedent() {
        if (depth == 0) {
            throw new IllegalStateException("Cannot dedent below column zero");
        }
        depth--;
        return this;
    }

    public int depth() {
        return depth;
    }

    public String indentUnit() {
        return indentUnit;
    }

    public boolean isEmpty() {
        return out.length() == 0;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
