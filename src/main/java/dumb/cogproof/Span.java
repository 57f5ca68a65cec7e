package dumb.cogproof;

/** Location of a fragment of input text: character offsets plus 1-based line and column of the start. */
public record Span(int start, int end, int line, int col) {

    public static final Span NONE = new Span(-1, -1, -1, -1);

    public static Span at(String text, int start, int end) {
        var line = 1;
        var col = 1;
        for (var i = 0; i < Math.min(start, text.length()); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                col = 1;
            } else col++;
        }
        return new Span(start, end, line, col);
    }

    public boolean known() {
        return start >= 0;
    }

    @Override
    public String toString() {
        return known() ? "line " + line + ", col " + col : "unknown position";
    }
}
