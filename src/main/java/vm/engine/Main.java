package vm.engine;

import java.io.File;
import java.nio.file.Path;
import java.util.Scanner;

import vm.engine.catalog.ArrayCatalog;
import vm.engine.cli.CliConfig;
import vm.engine.cli.CommandParser;
import vm.engine.cli.CommandProcessor;

public class Main {
    public static void main(String[] args) {
        CliConfig cfg;
        try {
            cfg = CliConfig.load(Path.of(args.length > 0 ? args[0] : CliConfig.DEFAULT_FILE));
        } catch (Exception ex) {
            System.out.println("Error: " + ex.getMessage());
            return;
        }

        CommandParser parser = new CommandParser();
        ArrayCatalog catalog = new ArrayCatalog(new File(cfg.catalogFile()));
        CommandProcessor processor = new CommandProcessor(parser, catalog);

        try {
            System.out.println(processor.openArray(
                parser.parseCreation(cfg.swapFile(), cfg.elementType(), String.valueOf(cfg.arraySize()))));
        } catch (Exception ex) {
            // The shell still starts; the user can Create or Open another array
            System.out.println("Error: " + ex.getMessage());
        }

        try (Scanner scanner = new Scanner(System.in)) {
            while (!processor.isTerminated()) {
                System.out.print(cfg.prompt());
                if (!scanner.hasNextLine()) break;
                String line = scanner.nextLine();
                try {
                    String out = processor.execute(line);
                    if (out != null) System.out.println(out);
                } catch (Exception ex) {
                    System.out.println("Error: " + ex.getMessage());
                }
            }
        }

        // End of input without Exit still has to flush the open array
        try {
            processor.close();
        } catch (Exception ex) {
            System.out.println("Error: " + ex.getMessage());
        }
    }
}

/* -------------------------------------------------------------------------
 * Example session
 *
 * VM> Input 4999 42
 * VM> Input 0 7
 * VM> Print 4999            -> [4999] = 42
 * VM> Print 1               -> [1] = 0
 * VM> Create names.dat char(8) 1000
 * VM> Input 3 "Hello, world"
 * VM> Print 3               -> [3] = "Hello, w"
 * VM> Open swapfile.dat
 * VM> Stats
 * VM> Exit
 * ------------------------------------------------------------------------- */
