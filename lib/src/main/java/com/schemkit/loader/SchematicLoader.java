package com.schemkit.loader;

import com.schemkit.model.Document;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Entry point for loading a schematic and resolving the symbols its instances reference. */
public final class SchematicLoader {
    private static final Logger LOGGER = Logger.getLogger(SchematicLoader.class.getName());

    private final SchematicReader reader;
    private final SymbolLibrary library;

    public SchematicLoader(SymbolLibrary library) {
        this(new SchematicReader(), library);
    }

    public SchematicLoader(SchematicReader reader, SymbolLibrary library) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.library = Objects.requireNonNull(library, "library");
    }

    public LoaderResult load(Path path) throws LoaderException {
        Objects.requireNonNull(path, "path");
        Document document;
        try {
            document = reader.read(path);
        } catch (IOException ex) {
            throw new LoaderException("Unable to read " + path, ex);
        } catch (SchematicParseException ex) {
            throw new LoaderException("Malformed schematic " + path + ": " + ex.getMessage(), ex);
        }
        List<LoaderMessage> messages = new ArrayList<>(reader.getMessages());
        messages.addAll(library.resolveAll(document));
        LOGGER.log(
                Level.INFO,
                "Loaded {0}: {1} instances, {2} symbols, {3} diagnostics",
                new Object[] {path, document.getInstances().size(), document.getSymbols().size(), messages.size()});
        return new LoaderResult(document, messages);
    }
}
