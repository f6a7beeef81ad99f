package com.schemkit.tools;

import com.schemkit.loader.LoaderException;
import com.schemkit.loader.LoaderMessage;
import com.schemkit.loader.LoaderResult;
import com.schemkit.loader.SchematicLoader;
import com.schemkit.loader.SchematicWriter;
import com.schemkit.loader.SymbolLibrary;
import com.schemkit.model.Document;
import com.schemkit.model.Instance;
import com.schemkit.model.Symbol;
import com.schemkit.netlist.CandidateStrategy;
import com.schemkit.netlist.ConnectivityAnalyzer;
import com.schemkit.netlist.NetMember;
import com.schemkit.netlist.NetlistResult;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads a schematic, resolves its symbols, extracts nets and prints one line per net.
 *
 * <pre>
 * NetlistCli &lt;schematic&gt; [--lib dir]... [--write out.sch] [--all-pairs]
 * </pre>
 */
public final class NetlistCli {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private static final String USAGE =
            "Usage: NetlistCli <schematic> [--lib dir]... [--write out.sch] [--all-pairs]";

    private NetlistCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path schematic = null;
        Path output = null;
        CandidateStrategy strategy = CandidateStrategy.SPATIAL_BUCKETS;
        List<Path> libraries = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--lib") || arg.equals("--write")) {
                if (i + 1 >= args.length) {
                    err.println("Missing value for " + arg);
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
                Path value = Path.of(args[++i]);
                if (arg.equals("--lib")) {
                    libraries.add(value);
                } else {
                    output = value;
                }
            } else if (arg.equals("--all-pairs")) {
                strategy = CandidateStrategy.ALL_PAIRS;
            } else if (arg.startsWith("--") || schematic != null) {
                err.println("Unexpected argument: " + arg);
                err.println(USAGE);
                return EXIT_USAGE;
            } else {
                schematic = Path.of(arg);
            }
        }
        if (schematic == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (!Files.isRegularFile(schematic)) {
            err.println("Schematic file not found: " + schematic);
            return EXIT_FAILURE;
        }

        LoaderResult result;
        try {
            result = new SchematicLoader(new SymbolLibrary(libraries)).load(schematic);
        } catch (LoaderException ex) {
            err.println(ex.getMessage());
            return EXIT_FAILURE;
        }
        for (LoaderMessage message : result.getMessages()) {
            err.println(message);
        }

        Document document = result.getDocument();
        NetlistResult nets = new ConnectivityAnalyzer(strategy).analyze(document);
        for (Map.Entry<String, List<NetMember>> net : nets.getNets().entrySet()) {
            out.println(net.getKey() + ": " + describe(document, net.getValue()));
        }

        if (output != null) {
            try {
                new SchematicWriter().write(document, output);
            } catch (IOException ex) {
                err.println("Unable to write " + output + ": " + ex.getMessage());
                return EXIT_FAILURE;
            }
        }
        return EXIT_OK;
    }

    private static String describe(Document document, List<NetMember> members) {
        List<String> parts = new ArrayList<>(members.size());
        for (NetMember member : members) {
            if (member.kind() == NetMember.Kind.WIRE) {
                parts.add("wire" + member.index());
                continue;
            }
            Instance instance = document.getInstances().get(member.index());
            String owner = instance.getInstanceName() != null
                    ? instance.getInstanceName()
                    : "#" + member.index();
            Symbol symbol = document.symbolOf(instance);
            if (symbol == null) {
                symbol = instance.getEmbeddedSymbol();
            }
            String pin = symbol != null ? symbol.getPinNames().get(member.pinIndex()) : "";
            parts.add(owner + "." + (pin.isEmpty() ? String.valueOf(member.pinIndex()) : pin));
        }
        return String.join(" ", parts);
    }
}
