package com.schemkit.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NetlistCliTest {

    private static final String RESISTOR = String.join("\n",
            "v {xschem version=3.4.5 file_version=1.2}",
            "K {type=primitive}",
            "B 5 -2.5 -32.5 2.5 -27.5 {name=P dir=inout}",
            "B 5 -2.5 27.5 2.5 32.5 {name=M dir=inout}",
            "");

    private static final String SCHEMATIC = String.join("\n",
            "v {xschem version=3.4.5 file_version=1.2}",
            "N 0 -200 0 -100 {lab=VIN}",
            "N 0 -40 0 40 {}",
            "N 0 100 0 200 {lab=GND}",
            "C {devices/res.sym} 0 -70 0 0 {name=R1}",
            "C {devices/res.sym} 0 70 0 0 {name=R2}",
            "");

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return NetlistCli.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static Path project(Path root) throws Exception {
        Path library = Files.createDirectories(root.resolve("lib/devices"));
        Files.writeString(library.resolve("res.sym"), RESISTOR);
        Path work = Files.createDirectories(root.resolve("work"));
        return Files.writeString(work.resolve("top.sch"), SCHEMATIC);
    }

    @Test
    void printsOneLinePerNet(@TempDir Path root) throws Exception {
        Path schematic = project(root);

        int code = run(schematic.toString(), "--lib", root.resolve("lib").toString());

        assertEquals(NetlistCli.EXIT_OK, code, err.toString(StandardCharsets.UTF_8));
        assertEquals(
                String.join(System.lineSeparator(),
                        "VIN: wire0 R1.P",
                        "#net0: wire1 R1.M R2.P",
                        "GND: wire2 R2.M",
                        ""),
                out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void allPairsStrategyGivesTheSameTable(@TempDir Path root) throws Exception {
        Path schematic = project(root);
        run(schematic.toString(), "--lib", root.resolve("lib").toString());
        String bucketed = out.toString(StandardCharsets.UTF_8);
        out.reset();

        run(schematic.toString(), "--all-pairs", "--lib", root.resolve("lib").toString());

        assertEquals(bucketed, out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void missingSymbolsAreReportedButNetsStillPrint(@TempDir Path root) throws Exception {
        Path schematic = project(root);

        int code = run(schematic.toString());

        assertEquals(NetlistCli.EXIT_OK, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Symbol devices/res.sym not found"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("VIN: wire0"));
    }

    @Test
    void writesTheAnalyzedDocument(@TempDir Path root) throws Exception {
        Path schematic = project(root);
        Path copy = root.resolve("copy.sch");

        int code = run(schematic.toString(), "--lib", root.resolve("lib").toString(), "--write", copy.toString());

        assertEquals(NetlistCli.EXIT_OK, code);
        String written = Files.readString(copy);
        assertTrue(written.contains("N 0 -200 0 -100 {lab=VIN}\n"));
        assertTrue(written.contains("C {devices/res.sym} 0 70 0 0 {name=R2}\n"));
    }

    @Test
    void usageErrors(@TempDir Path root) {
        assertEquals(NetlistCli.EXIT_USAGE, run());
        assertEquals(NetlistCli.EXIT_USAGE, run("a.sch", "--lib"));
        assertEquals(NetlistCli.EXIT_USAGE, run("a.sch", "--bogus"));
        assertEquals(NetlistCli.EXIT_FAILURE, run(root.resolve("absent.sch").toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage: NetlistCli"));
    }
}
