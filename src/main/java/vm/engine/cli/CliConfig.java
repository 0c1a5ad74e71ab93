package vm.engine.cli;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Startup settings for the interactive shell, read from an optional JSON file, e.g.
 * <pre>
 * { "swapFile": "data/ints.dat", "elementType": "int", "arraySize": 5000,
 *   "catalogFile": "catalog/arrays.json", "prompt": "VM> " }
 * </pre>
 * Missing keys keep their defaults.
 */
public class CliConfig {
    public static final String DEFAULT_FILE = "vm.json";

    private String swapFile = "swapfile.dat";
    private String elementType = "int";
    private long arraySize = 5000;
    private String catalogFile = "catalog/arrays.json";
    private String prompt = "VM> ";

    public static CliConfig defaults() { return new CliConfig(); }

    /** Load from path; a missing file yields the defaults. */
    public static CliConfig load(Path path) throws IOException {
        if (!Files.exists(path)) return defaults();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            CliConfig cfg = new Gson().fromJson(reader, CliConfig.class);
            return cfg != null ? cfg : defaults();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed config file " + path + ": " + e.getMessage(), e);
        }
    }

    public String swapFile() { return swapFile; }
    public String elementType() { return elementType; }
    public long arraySize() { return arraySize; }
    public String catalogFile() { return catalogFile; }
    public String prompt() { return prompt; }
}
