package com.solrange.analyzer;

import com.solrange.analyzer.ast.AstReader;
import com.solrange.analyzer.ast.SolAst.SourceUnit;
import com.solrange.analyzer.config.AnalyzerConfig;
import com.solrange.analyzer.config.ConfigReader;
import com.solrange.analyzer.report.BoundsReport;
import com.solrange.analyzer.report.ReportFormatter;
import com.solrange.analyzer.report.ReportWriter;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line driver.
 *
 * Usage:
 *   java -jar range-analyzer-java.jar analyze \
 *     --ast    <path-to-ast.json> \
 *     --output <output-dir> \
 *     [--config <path-to-analyzer.json>] \
 *     [--var <name>] \
 *     [--steps]
 *
 * Writes bounds.json and graph.json into the output directory and prints the text report
 * to stdout.
 */
public class AnalyzerMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[sol-range] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar range-analyzer-java.jar analyze " +
                               "--ast <file> --output <dir> [--config <file>] [--var <name>] [--steps]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[sol-range] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static List<BoundsReport> run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("analyze")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String astPath = null;
        String outputDir = null;
        String configPath = null;
        String variable = null;
        boolean steps = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--ast"    -> astPath    = requireNext(args, i++, "--ast");
                case "--output" -> outputDir  = requireNext(args, i++, "--output");
                case "--config" -> configPath = requireNext(args, i++, "--config");
                case "--var"    -> variable   = requireNext(args, i++, "--var");
                case "--steps"  -> steps = true;
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (astPath == null)   throw new UsageException("--ast is required");
        if (outputDir == null) throw new UsageException("--output is required");

        Path ast = Paths.get(astPath);
        Path output = Paths.get(outputDir);

        AnalyzerConfig config = AnalyzerConfig.defaults();
        if (configPath != null) {
            System.err.println("[sol-range] Reading config: " + configPath);
            config = new ConfigReader().read(Paths.get(configPath));
        }

        System.err.println("[sol-range] Reading AST: " + ast);
        SourceUnit unit = new AstReader().read(ast);

        Analyzer analyzer = new Analyzer(config, new Diagnostics());
        analyzer.analyze(unit, 0);

        List<BoundsReport> reports = analyzer.reportAll(variable);
        System.err.println("[sol-range] " + reports.size() + " reports over "
                + analyzer.entryContexts().size() + " functions");

        System.out.println(new ReportFormatter(steps).format(reports));

        System.err.println("[sol-range] Writing output to: " + output);
        new ReportWriter().write(reports, analyzer.graph(), config.isShowTmps(), output);

        System.err.println("[sol-range] Done.");
        return reports;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
