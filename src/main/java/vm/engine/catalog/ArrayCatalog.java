package vm.engine.catalog;

import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;

/**
 * Remembers how each swap file was created, so it can be reopened with the same kind and size.
 * Swap files carry no type information of their own.
 *
 * Entries are keyed by normalized absolute path and saved as JSON after every change.
 * A missing or unreadable catalog file is reported and treated as empty.
 */
public class ArrayCatalog {
    private final Map<String, ArraySpec> arrays = new LinkedHashMap<>();
    private final File catalogFile;

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public ArrayCatalog(File catalogFile) {
        this.catalogFile = catalogFile;
        loadCatalog();
    }

    public void register(ArraySpec spec) {
        arrays.put(key(spec.filePath()), spec);
        saveCatalog();
    }

    /** Spec recorded for the swap file at filePath, or null if unknown. */
    public ArraySpec lookup(String filePath) {
        return arrays.get(key(filePath));
    }

    public boolean remove(String filePath) {
        boolean removed = arrays.remove(key(filePath)) != null;
        if (removed) saveCatalog();
        return removed;
    }

    public Map<String, ArraySpec> allArrays() { return Collections.unmodifiableMap(arrays); }

    public File catalogFile() { return catalogFile; }

    private static String key(String filePath) {
        return Path.of(filePath).toAbsolutePath().normalize().toString();
    }

    private void loadCatalog() {
        if (!catalogFile.exists()) return;
        Type type = new TypeToken<Map<String, ArraySpec>>(){}.getType();
        try (FileReader reader = new FileReader(catalogFile)) {
            Map<String, ArraySpec> loaded = gson.fromJson(reader, type);
            if (loaded != null) {
                arrays.clear();
                arrays.putAll(loaded);
            }
        } catch (IOException | RuntimeException e) {
            // JsonParseException, or ArraySpec validation rethrown by Gson as a RuntimeException
            logError("Failed loading catalog file: " + catalogFile.getPath(), e);
        }
    }

    private void saveCatalog() {
        File parent = catalogFile.getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();
        try (FileWriter writer = new FileWriter(catalogFile)) {
            gson.toJson(arrays, writer);
        } catch (IOException e) {
            logError("Failed saving catalog file: " + catalogFile.getPath(), e);
        }
    }

    private void logError(String message, Exception e) {
        System.err.println("[ArrayCatalog] " + message);
        e.printStackTrace(System.err);
    }
}
