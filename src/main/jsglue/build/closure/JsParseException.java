package jsglue.build.closure;

/**
 * the input could not be parsed, the message points at the offending line
 */
public class JsParseException extends RuntimeException {
    private final int line;
    private final int column;

    public JsParseException(String description, String source, int line, int column) {
        super(description + "\n" + pointAt(source, line, column));
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    static String pointAt(String source, int line, int column) {
        String[] lines = source.split("\r\n|\r|\n", -1);
        if (line < 1 || line > lines.length) {
            return "";
        }
        StringBuilder sb = new StringBuilder(lines[line - 1]).append('\n');
        for (int i = 0; i < column; i++) {
            sb.append(' ');
        }
        return sb.append("^\n").toString();
    }
}
