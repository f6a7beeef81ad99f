package com.schemkit.loader;

import com.schemkit.model.Document;
import com.schemkit.model.Instance;
import com.schemkit.model.Symbol;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds symbol files and loads them into documents.
 *
 * <p>A symbol reference is resolved by trying, in order: the reference itself when it is an
 * absolute path to an existing file, the directory of the referencing document, then every search
 * directory. Search directories are the caller supplied ones, followed by the default install
 * locations and the colon separated configured library path; only existing directories are kept and
 * each appears once.
 *
 * <p>Loaded symbols are cached by resolved path, so one library can serve many documents.
 */
public final class SymbolLibrary {
    private static final Logger LOGGER = Logger.getLogger(SymbolLibrary.class.getName());

    public static final List<String> DEFAULT_INSTALL_PATHS =
            List.of("/usr/share/xschem", "/usr/local/share/xschem", "~/.xschem");

    private final List<Path> searchPaths;
    private final Map<Path, Symbol> cache = new HashMap<>();
    private final SchematicReader reader;

    /** Library over {@code explicitPaths}, the default install locations and the configured path. */
    public SymbolLibrary(List<Path> explicitPaths) {
        this(explicitPaths, DEFAULT_INSTALL_PATHS, LoaderFlags.libraryPath(), new SchematicReader());
    }

    public SymbolLibrary(
            List<Path> explicitPaths, List<String> defaultPaths, String configuredPath, SchematicReader reader) {
        this.searchPaths = buildSearchPaths(explicitPaths, defaultPaths, configuredPath);
        this.reader = Objects.requireNonNull(reader, "reader");
        LOGGER.log(Level.FINE, "Symbol search paths: {0}", searchPaths);
    }

    public List<Path> getSearchPaths() {
        return Collections.unmodifiableList(searchPaths);
    }

    /**
     * Resolves a symbol reference to an existing file.
     *
     * @param documentDirectory directory of the referencing document, or null
     */
    public Optional<Path> resolve(String name, Path documentDirectory) {
        Objects.requireNonNull(name, "name");
        Path direct = Path.of(name);
        if (direct.isAbsolute() && Files.isRegularFile(direct)) {
            return Optional.of(direct);
        }
        if (documentDirectory != null) {
            Path candidate = documentDirectory.resolve(name);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate.toAbsolutePath().normalize());
            }
        }
        for (Path directory : searchPaths) {
            Path candidate = directory.resolve(name);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate.toAbsolutePath().normalize());
            }
        }
        return Optional.empty();
    }

    /**
     * Loads the symbol {@code name} into {@code document} unless a symbol of that name is already
     * registered there.
     *
     * @return the document's symbol, or empty when the reference cannot be resolved
     */
    public Optional<Symbol> load(String name, Document document) throws IOException, SchematicParseException {
        Symbol existing = document.getSymbol(name);
        if (existing != null) {
            return Optional.of(existing);
        }
        Optional<Path> resolved = resolve(name, document.getDirectory());
        if (resolved.isEmpty()) {
            LOGGER.log(Level.WARNING, "Symbol {0} not found in any search path", name);
            return Optional.empty();
        }
        Path path = resolved.get();
        Symbol cached = cache.get(path);
        if (cached == null) {
            Document symbolFile = reader.read(path);
            cached = Symbol.fromDocument(name, symbolFile);
            cache.put(path, cached);
            LOGGER.log(
                    Level.INFO,
                    "Loaded symbol {0} from {1} ({2} pins)",
                    new Object[] {name, path, cached.getPinCount()});
        }
        Symbol symbol = cached.getName().equals(name) ? cached : renamed(cached, name);
        document.addSymbol(symbol);
        return Optional.of(symbol);
    }

    /**
     * Resolves the symbol of every instance in {@code document}, links each instance to its symbol
     * index and computes instance bounding boxes. Embedded symbols are used for instances whose
     * reference cannot be resolved from disk.
     *
     * @return a warning per unresolved or unreadable reference
     */
    public List<LoaderMessage> resolveAll(Document document) {
        List<LoaderMessage> messages = new ArrayList<>();
        Set<String> reported = new LinkedHashSet<>();
        for (Instance instance : document.getInstances()) {
            String name = instance.getSymbolName();
            Symbol symbol = null;
            try {
                symbol = load(name, document).orElse(null);
            } catch (IOException | SchematicParseException ex) {
                if (reported.add(name)) {
                    LOGGER.log(Level.WARNING, "Failed to load symbol " + name, ex);
                    messages.add(new LoaderMessage(
                            LoaderMessage.Level.WARNING,
                            "Failed to load symbol " + name + ": " + ex.getMessage(),
                            document.getCurrentName(),
                            0));
                }
            }
            if (symbol == null && instance.getEmbeddedSymbol() != null) {
                symbol = instance.getEmbeddedSymbol();
                document.addSymbol(symbol);
            }
            if (symbol == null) {
                if (reported.add(name)) {
                    messages.add(new LoaderMessage(
                            LoaderMessage.Level.WARNING,
                            "Symbol " + name + " not found",
                            document.getCurrentName(),
                            0));
                }
                continue;
            }
            instance.setSymbolIndex(document.indexOfSymbol(symbol.getName()));
            instance.calculateBoundingBox(symbol);
        }
        return messages;
    }

    public void clearCache() {
        cache.clear();
    }

    private static Symbol renamed(Symbol source, String name) {
        Symbol copy = new Symbol(name);
        copy.getLines().addAll(source.getLines());
        copy.getRects().addAll(source.getRects());
        copy.getArcs().addAll(source.getArcs());
        copy.getPolygons().addAll(source.getPolygons());
        copy.getTexts().addAll(source.getTexts());
        copy.setProp(source.getProp());
        copy.calculateBoundingBox();
        return copy;
    }

    private static List<Path> buildSearchPaths(
            List<Path> explicitPaths, List<String> defaultPaths, String configuredPath) {
        Set<Path> result = new LinkedHashSet<>();
        if (explicitPaths != null) {
            for (Path path : explicitPaths) {
                addIfDirectory(result, path);
            }
        }
        for (String path : defaultPaths) {
            addIfDirectory(result, Path.of(expandHome(path)));
        }
        if (configuredPath != null && !configuredPath.isEmpty()) {
            for (String part : configuredPath.split(":")) {
                if (!part.isEmpty()) {
                    addIfDirectory(result, Path.of(expandHome(part)));
                }
            }
        }
        return new ArrayList<>(result);
    }

    private static void addIfDirectory(Set<Path> result, Path path) {
        if (Files.isDirectory(path)) {
            result.add(path.toAbsolutePath().normalize());
        }
    }

    private static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }
}
