package com.solrange.analyzer.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;
import com.solrange.analyzer.graph.GraphExporter;
import com.solrange.analyzer.graph.SemanticGraph;
import com.solrange.analyzer.range.NarrowingStep;
import com.solrange.analyzer.range.Range;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Writes bounds reports to {@code bounds.json} and the graph dump to {@code graph.json}.
 * Reports are sorted by context handle, then variable name, so repeated runs produce
 * identical files.
 */
public class ReportWriter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static class WriterException extends RuntimeException {
        public WriterException(String msg, Throwable cause) { super(msg, cause); }
    }

    public static class BoundsFile {
        @SerializedName("report_count") public int reportCount;
        @SerializedName("reports")      public List<ReportEntry> reports;
    }

    public static class ReportEntry {
        @SerializedName("context")         public String context;
        @SerializedName("context_handle")  public int contextHandle;
        @SerializedName("context_kind")    public String contextKind;
        @SerializedName("variable")        public String variable;
        @SerializedName("version")         public int version;
        @SerializedName("type")            public String type;
        @SerializedName("origin")          public String origin;
        @SerializedName("range")           public RangeEntry range;
        @SerializedName("initial_range")   public RangeEntry initialRange;
        @SerializedName("derivation")      public String derivation;
        @SerializedName("temporary")       public boolean temporary;
        @SerializedName("steps")           public List<StepEntry> steps;
    }

    public static class RangeEntry {
        @SerializedName("text")             public String text;
        @SerializedName("min")              public String min;
        @SerializedName("max")              public String max;
        @SerializedName("domain")           public String domain;
        @SerializedName("overflow")         public boolean overflow;
        @SerializedName("underflow")        public boolean underflow;
        @SerializedName("division_by_zero") public boolean divisionByZero;
    }

    public static class StepEntry {
        @SerializedName("kind")       public String kind;
        @SerializedName("constraint") public String constraint;
        @SerializedName("after")      public String after;
        @SerializedName("location")   public String location;
    }

    public BoundsFile toBoundsFile(List<BoundsReport> reports) {
        List<BoundsReport> sorted = new ArrayList<>(reports);
        sorted.sort(Comparator.comparingInt(BoundsReport::context)
                .thenComparing(BoundsReport::variable));
        BoundsFile file = new BoundsFile();
        file.reportCount = sorted.size();
        file.reports = new ArrayList<>();
        for (BoundsReport r : sorted) {
            ReportEntry e = new ReportEntry();
            e.context = r.contextPath();
            e.contextHandle = r.context();
            e.contextKind = r.contextKind().name();
            e.variable = r.variable();
            e.version = r.version();
            e.type = r.type();
            e.origin = r.origin().name();
            e.range = rangeEntry(r.range());
            e.initialRange = rangeEntry(r.initialRange());
            e.derivation = r.derivation();
            e.temporary = r.temporary();
            e.steps = new ArrayList<>();
            for (NarrowingStep step : r.steps()) {
                StepEntry s = new StepEntry();
                s.kind = step.kind().name();
                s.constraint = step.constraint();
                s.after = step.after().describe();
                s.location = step.loc() != null ? step.loc().toString() : null;
                e.steps.add(s);
            }
            file.reports.add(e);
        }
        return file;
    }

    /**
     * Writes {@code outputDir/bounds.json} and, when a graph is given, {@code outputDir/graph.json}.
     *
     * @param outputDir directory to write into (created if absent)
     */
    public void write(List<BoundsReport> reports, SemanticGraph graph, boolean showTmps, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new WriterException("Could not create output directory: " + outputDir, e);
        }

        Path boundsPath = outputDir.resolve("bounds.json");
        try (Writer w = new FileWriter(boundsPath.toFile())) {
            GSON.toJson(toBoundsFile(reports), w);
        } catch (IOException e) {
            throw new WriterException("Failed to write bounds.json: " + e.getMessage(), e);
        }
        System.err.println("[sol-range] bounds.json written: " + boundsPath);

        if (graph == null) return;
        Path graphPath = outputDir.resolve("graph.json");
        try (Writer w = new FileWriter(graphPath.toFile())) {
            GSON.toJson(new GraphExporter().export(graph, showTmps), w);
        } catch (IOException e) {
            throw new WriterException("Failed to write graph.json: " + e.getMessage(), e);
        }
        System.err.println("[sol-range] graph.json written: " + graphPath);
    }

    private static RangeEntry rangeEntry(Range range) {
        if (range == null) return null;
        RangeEntry e = new RangeEntry();
        e.text = range.describe();
        e.min = range.min() != null ? range.min().toString() : null;
        e.max = range.max() != null ? range.max().toString() : null;
        e.domain = range.domain() != null ? range.domain().toString() : null;
        e.overflow = range.overflow();
        e.underflow = range.underflow();
        e.divisionByZero = range.divisionByZero();
        return e;
    }
}
