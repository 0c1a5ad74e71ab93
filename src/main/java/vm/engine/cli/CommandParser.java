package vm.engine.cli;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import vm.engine.catalog.ArraySpec;
import vm.engine.catalog.ElementKind;

/**
 * Parser for the shell commands:
 *   Create <path> <type> <size>     type: int | char(N) | varchar(N)  (short forms I, C(N), V(N))
 *   Open <path>
 *   Input <index> <value>           text values run to end of line, optionally "double quoted"
 *   Print <index>
 *   Flush | Stats | Exit
 * Keywords are case-insensitive.
 */
public class CommandParser {
    static final int MAX_TEXT_LENGTH = 1 << 20;
    private static final Pattern INT_TYPE = Pattern.compile("^(?:int|i)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TEXT_TYPE = Pattern.compile(
        // 1: char/c or varchar/v, 2: length
        "^(char|c|varchar|v)\\s*\\(\\s*(\\d+)\\s*\\)$",
        Pattern.CASE_INSENSITIVE
    );

    /** Returns null for a blank line. */
    public Command parse(String line) {
        if (line == null) throw new IllegalArgumentException("line must not be null");
        String trimmed = line.trim();
        if (trimmed.isEmpty()) return null;

        String[] head = trimmed.split("\\s+", 2);
        String keyword = head[0].toUpperCase(Locale.ROOT);
        String rest = head.length > 1 ? head[1].trim() : "";

        return switch (keyword) {
            case "CREATE" -> new Command(Command.Type.CREATE, requireArgs(rest, 3, "Create <path> <type> <size>"));
            case "OPEN" -> new Command(Command.Type.OPEN, requireArgs(rest, 1, "Open <path>"));
            case "INPUT" -> parseInput(rest);
            case "PRINT" -> new Command(Command.Type.PRINT, requireArgs(rest, 1, "Print <index>"));
            case "FLUSH" -> new Command(Command.Type.FLUSH, List.of());
            case "STATS" -> new Command(Command.Type.STATS, List.of());
            case "EXIT" -> new Command(Command.Type.EXIT, List.of());
            default -> throw new IllegalArgumentException("Unknown command: " + head[0]);
        };
    }

    /**
     * Build creation parameters from the raw Create arguments.
     * Rejects unknown type tags and non-positive sizes.
     */
    public ArraySpec parseCreation(String path, String typeTag, String rawSize) {
        long size = parseLong(rawSize, "array size");
        if (size <= 0) throw new IllegalArgumentException("Array size must be positive, got " + size);

        String tag = typeTag.trim();
        if (INT_TYPE.matcher(tag).matches()) {
            return ArraySpec.ints(path, size);
        }
        Matcher m = TEXT_TYPE.matcher(tag);
        if (!m.matches()) {
            throw new IllegalArgumentException("Unsupported element type: " + typeTag + " (expected int, char(N) or varchar(N))");
        }
        long length = parseLong(m.group(2), "text length");
        if (length < 1 || length > MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException("Text length must be in [1, " + MAX_TEXT_LENGTH + "], got " + length);
        }
        String family = m.group(1).toLowerCase(Locale.ROOT);
        ElementKind kind = family.startsWith("v") ? ElementKind.VAR_TEXT : ElementKind.FIXED_TEXT;
        return new ArraySpec(path, kind, size, (int) length);
    }

    public long parseIndex(String raw) {
        return parseLong(raw, "index");
    }

    public int parseIntValue(String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid int value: " + raw);
        }
    }

    /** Strip one pair of surrounding double quotes, if present. */
    public String parseTextValue(String raw) {
        if (raw.length() >= 2 && raw.startsWith("\"") && raw.endsWith("\"")) {
            return raw.substring(1, raw.length() - 1);
        }
        return raw;
    }

    private Command parseInput(String rest) {
        String[] parts = rest.split("\\s+", 2);
        if (parts.length < 2 || parts[0].isEmpty()) {
            throw new IllegalArgumentException("Not enough parameters, expected: Input <index> <value>");
        }
        return new Command(Command.Type.INPUT, List.of(parts[0], parts[1]));
    }

    private List<String> requireArgs(String rest, int count, String usage) {
        String[] parts = rest.isEmpty() ? new String[0] : rest.split("\\s+");
        if (parts.length < count) {
            throw new IllegalArgumentException("Not enough parameters, expected: " + usage);
        }
        return List.of(parts).subList(0, count);
    }

    private long parseLong(String raw, String what) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + what + ": " + raw);
        }
    }
}
