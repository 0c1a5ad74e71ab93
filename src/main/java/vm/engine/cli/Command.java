package vm.engine.cli;

import java.util.List;

/**
 * One parsed shell command. Arguments are kept as raw strings; the processor converts them
 * once it knows the element kind of the open array.
 */
public record Command(Type type, List<String> args) {

    public enum Type {
        CREATE,  // Create <path> <type> <size>
        OPEN,    // Open <path>
        INPUT,   // Input <index> <value>
        PRINT,   // Print <index>
        FLUSH,
        STATS,
        EXIT
    }

    public Command {
        args = List.copyOf(args);
    }

    public String arg(int i) { return args.get(i); }
}
