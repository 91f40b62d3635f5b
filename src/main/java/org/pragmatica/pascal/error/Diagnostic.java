package org.pragmatica.pascal.error;

import org.pragmatica.pascal.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Human-readable report for a {@link PascalError}, Rust style.
 *
 * <p>Example output:
 * <pre>
 * error: Unexpected ':=' at 3:7 (offset 18), expected expression
 *   --> program.pas:3:7
 *    |
 *  3 |   a := := 1
 *    |        ^ syntax error
 *    |
 *    = help: an expression starts with a number, a variable, a sign or '('
 * </pre>
 *
 * @param message  Primary message
 * @param location Where the problem was found, if anywhere
 * @param label    Text printed next to the caret
 * @param notes    Extra notes printed under the source
 */
public record Diagnostic(
    String message,
    Optional<SourceLocation> location,
    String label,
    List<String> notes
) {
    private static final String SEVERITY = "error";

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    /**
     * Build the diagnostic for an error raised by the lexer, parser, evaluator or a translator.
     */
    public static Diagnostic of(PascalError error) {
        return new Diagnostic(error.getMessage(), error.location(), labelFor(error), List.of());
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, location, label, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format with the offending source line and a caret under the error column.
     *
     * @param source   The source text
     * @param filename Name to show, or null
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        sb.append(SEVERITY)
          .append(": ")
          .append(message)
          .append("\n");

        if (location.isEmpty()) {
            notes.forEach(note -> sb.append("  = ").append(note).append("\n"));
            return sb.toString();
        }

        var loc = location.get();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        var lines = source.split("\n", -1);
        var gutterWidth = String.valueOf(loc.line()).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append(gutter).append("|\n");
        if (loc.line() >= 1 && loc.line() <= lines.length) {
            var lineContent = lines[loc.line() - 1];
            sb.append(String.format("%" + gutterWidth + "d", loc.line()))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(gutter)
              .append("| ")
              .append(" ".repeat(Math.max(0, loc.column() - 1)))
              .append('^');
            if (!label.isEmpty()) {
                sb.append(" ").append(label);
            }
            sb.append("\n");
        }
        sb.append(gutter).append("|\n");

        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form, e.g. {@code input:3:7: error: ...}.
     */
    public String formatSimple() {
        return location.map(loc -> String.format("input:%d:%d: %s: %s",
                                                 loc.line(), loc.column(), SEVERITY, message))
                       .orElseGet(() -> String.format("input: %s: %s", SEVERITY, message));
    }

    private static String labelFor(PascalError error) {
        if (error instanceof PascalError.LexicalError) {
            return "unrecognised character";
        }
        if (error instanceof PascalError.SyntaxError) {
            return "syntax error";
        }
        return "";
    }
}
