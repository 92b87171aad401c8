/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.cli;

import ai.evacortex.phrasaldb.cli.batch.BatchAnalyzer;
import ai.evacortex.phrasaldb.cli.batch.BatchOptions;
import ai.evacortex.phrasaldb.cli.batch.BatchResult;
import ai.evacortex.phrasaldb.cli.batch.PieceResult;
import ai.evacortex.phrasaldb.cli.report.CorpusReportPrinter;
import ai.evacortex.phrasaldb.cli.report.PieceReportPrinter;
import ai.evacortex.phrasaldb.cli.scan.MidiFileScanner;
import ai.evacortex.phrasaldb.core.metadata.CatalogStore;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "phrasal",
        mixinStandardHelpOptions = true,
        version = "phrasal 0.1.0",
        header = "Analyze MIDI files for measure-level rhythm and melodic patterns",
        description = "Finds repeated measures in each piece, prints its form and collects corpus-wide rhythm statistics.",
        exitCodeList = {"0: success", "1: invalid input directory or unreadable tree"})
public class PhrasalCommand implements Callable<Integer> {

    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Parameters(index = "0", description = "Directory to search for MIDI files")
    Path directory;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "List found files and log debug output")
    boolean verbose;

    @CommandLine.Option(names = {"-d", "--details"}, description = "Print per-measure melodic sequences")
    boolean details;

    @CommandLine.Option(names = {"-t", "--threads"}, description = "Worker threads (default: ${DEFAULT-VALUE})")
    int threads = BatchOptions.defaultOptions().threads();

    @CommandLine.Option(names = {"--track"}, description = "MIDI track to analyze (default: ${DEFAULT-VALUE})")
    int track = 0;

    @CommandLine.Option(names = {"--top"}, description = "Corpus patterns to list (default: ${DEFAULT-VALUE})")
    int top = 20;

    @CommandLine.Option(names = {"--no-metadata"}, description = "Do not write the per-piece JSON side-files")
    boolean noMetadata;

    @CommandLine.Option(names = {"--catalog"}, description = "Write the ranked corpus catalog as JSON to this file")
    Path catalogFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final PrintStream out;

    public PhrasalCommand() {
        this(System.out);
    }

    PhrasalCommand(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new PhrasalCommand()).execute(args));
    }

    @Override
    public Integer call() {
        if (verbose) {
            // slf4j-simple reads this once, when the first logger is created
            System.setProperty(LOG_LEVEL_PROPERTY, "debug");
        }
        if (threads < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--threads must be at least 1");
        }
        if (track < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--track must not be negative");
        }
        if (!Files.isDirectory(directory)) {
            out.println("Error: " + directory + " is not a valid directory");
            return 1;
        }
        List<Path> files;
        try {
            files = MidiFileScanner.scan(directory);
        } catch (IOException e) {
            out.println("Error: " + e.getMessage());
            return 1;
        }
        if (files.isEmpty()) {
            out.println("No MIDI files found in " + directory);
            return 0;
        }
        out.println("Found " + files.size() + " MIDI file(s)" + (verbose ? ":" : ""));
        if (verbose) {
            files.forEach(f -> out.println("  - " + f));
        }

        BatchOptions options = BatchOptions.defaultOptions()
                .withThreads(threads)
                .withTrackIndex(track)
                .withWriteMetadata(!noMetadata);

        BatchResult result;
        try (BatchAnalyzer batch = new BatchAnalyzer(options)) {
            result = batch.run(directory, files);
        }

        PieceReportPrinter pieces = new PieceReportPrinter(out, details);
        for (PieceResult piece : result.pieces()) {
            pieces.print(piece);
        }
        new CorpusReportPrinter(out).print(result.catalog(), top);

        if (catalogFile != null) {
            new CatalogStore().save(catalogFile, result.catalog());
            out.println("Catalog written to " + catalogFile);
        }
        return 0;
    }
}
