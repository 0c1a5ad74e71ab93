package vm.engine.cli;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import vm.engine.array.FixedTextVirtualArray;
import vm.engine.array.IntVirtualArray;
import vm.engine.array.VirtualArray;
import vm.engine.array.VirtualArrays;
import vm.engine.catalog.ArrayCatalog;
import vm.engine.catalog.ArraySpec;

/**
 * Executes parsed commands against the currently open virtual array.
 * At most one array is open; opening another closes (and flushes) the previous one.
 * Every command returns the line to show the user; failures are thrown to the caller.
 */
public class CommandProcessor implements Closeable {
    private final CommandParser parser;
    private final ArrayCatalog catalog;
    private VirtualArray<?> current;
    private boolean terminated;

    public CommandProcessor(CommandParser parser, ArrayCatalog catalog) {
        this.parser = parser;
        this.catalog = catalog;
    }

    public boolean isTerminated() { return terminated; }

    public VirtualArray<?> current() { return current; }

    /** Parse and execute one line; returns null for a blank line. */
    public String execute(String line) throws IOException {
        Command cmd = parser.parse(line);
        return cmd == null ? null : execute(cmd);
    }

    public String execute(Command cmd) throws IOException {
        if (terminated) throw new IllegalStateException("Session terminated");
        return switch (cmd.type()) {
            case CREATE -> openArray(parser.parseCreation(cmd.arg(0), cmd.arg(1), cmd.arg(2)));
            case OPEN -> openKnown(cmd.arg(0));
            case INPUT -> input(parser.parseIndex(cmd.arg(0)), cmd.arg(1));
            case PRINT -> print(parser.parseIndex(cmd.arg(0)));
            case FLUSH -> {
                requireArray().flush();
                yield "Flushed " + current.path();
            }
            case STATS -> requireArray().stats().toString();
            case EXIT -> {
                close();
                terminated = true;
                yield "Bye";
            }
        };
    }

    /** Close the current array, then create or open the one described by spec and remember it. */
    public String openArray(ArraySpec spec) throws IOException {
        close();
        boolean existed = Files.exists(Path.of(spec.filePath()));
        current = VirtualArrays.open(spec);
        catalog.register(spec);
        return (existed ? "Opened " : "Created ") + spec.typeTag() + " array of " + spec.size()
            + " elements at " + spec.filePath();
    }

    /** Flush and release the open array, if any. */
    @Override
    public void close() throws IOException {
        if (current == null) return;
        VirtualArray<?> closing = current;
        current = null;
        closing.close();
    }

    private String openKnown(String path) throws IOException {
        ArraySpec spec = catalog.lookup(path);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown array: " + path + " (use Create first)");
        }
        return openArray(spec);
    }

    private String input(long index, String rawValue) throws IOException {
        VirtualArray<?> array = requireArray();
        if (array instanceof IntVirtualArray ints) {
            int value = parser.parseIntValue(rawValue);
            ints.writeInt(index, value);
            return "Written: [" + index + "] = " + value;
        }
        if (array instanceof FixedTextVirtualArray texts) {
            String value = parser.parseTextValue(rawValue);
            texts.write(index, value);
            return "Written: [" + index + "] = \"" + texts.stored(value) + "\"";
        }
        throw new IllegalStateException("Unsupported array type: " + array.kind());
    }

    private String print(long index) throws IOException {
        VirtualArray<?> array = requireArray();
        Object value = array.read(index);
        return "[" + index + "] = " + (array.kind().isText() ? "\"" + value + "\"" : value);
    }

    private VirtualArray<?> requireArray() {
        if (current == null) throw new IllegalStateException("No array is open (use Create or Open)");
        return current;
    }
}
