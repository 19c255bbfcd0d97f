package no.cantara.siren.cli;

import no.cantara.siren.parser.ParseError;

/**
 * Compiler-style rendering of a syntax error with the offending line underlined:
 * <pre>
 * error: Expected '{' but found '}'
 *  --> siren/main.siren:3:9
 *   |
 * 3 | task a }
 *   |        ^
 * </pre>
 */
public final class ParseErrorFormatter {

    private ParseErrorFormatter() {
    }

    public static String format(ParseError error, String source) {
        String document = error.document() != null ? error.document() : "unknown";
        String[] lines = source.split("\r?\n", -1);
        String lineText = error.line() - 1 < lines.length && error.line() >= 1 ? lines[error.line() - 1] : "";

        int caretColumn = clamp(error.column(), 1, lineText.length() + 1);
        int remaining = Math.max(1, lineText.length() - (caretColumn - 1));
        int wanted = error.found() != null && !error.found().isEmpty() ? error.found().length() : 1;
        int underline = clamp(wanted, 1, remaining);

        String lineNo = String.valueOf(error.line());
        String gutter = " ".repeat(lineNo.length());
        return String.join("\n",
                "error: " + error.message(),
                " --> " + document + ":" + error.line() + ":" + error.column(),
                gutter + " |",
                lineNo + " | " + lineText,
                gutter + " | " + " ".repeat(caretColumn - 1) + "^".repeat(underline));
    }

    private static int clamp(int n, int min, int max) {
        return Math.min(Math.max(n, min), max);
    }
}
