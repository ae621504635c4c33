package com.raditha.divergence.report;

import java.io.PrintStream;

/**
 * Terminal summary of a finished run.
 */
public class SummaryPrinter {

    private final PrintStream out;

    public SummaryPrinter(PrintStream out) {
        this.out = out;
    }

    public void print(DivergenceReport report) {
        DivergenceReport.Summary summary = report.summary();
        DivergenceReport.DivergenceAnalysis divergence = report.divergenceAnalysis();

        out.println();
        out.println("=".repeat(60));
        out.println("IR DIVERGENCE ANALYSIS RESULTS");
        out.println("=".repeat(60));
        out.println("SUMMARY:");
        out.printf("   Pipeline A passes:   %d%n", summary.totalPipelineAPasses());
        out.printf("   Pipeline B passes:   %d%n", summary.totalPipelineBPasses());
        out.printf("   Successfully mapped: %d%n", summary.successfullyMapped());
        out.printf("   Unmatched passes:    %d%n", summary.unmatchedPipelineAPasses());

        if (divergence.divergenceFound()) {
            out.println();
            out.println("FIRST DIVERGENCE FOUND:");
            printPair(divergence.firstDivergentPass());
            if (divergence.lastCommonPass() != null) {
                out.println();
                out.println("LAST COMMON PASS:");
                printPair(divergence.lastCommonPass());
            }
        } else {
            out.println();
            out.println("NO DIVERGENCE FOUND!");
            out.printf("   All %d compared passes have identical IR%n", divergence.totalComparedPasses());
        }

        DivergenceReport.OutputFiles files = report.outputFiles();
        if (files != null) {
            out.println();
            out.println("OUTPUT FILES:");
            out.println("   JSON Report:   " + files.jsonReport());
            if (files.diffFile() != null) {
                out.println("   Diff File:     " + files.diffFile());
            }
            out.println("   Mapping Info:  " + files.mappingFile());
            out.println("   Visualization: " + files.visualizationFile());
        }
        out.println("=".repeat(60));
        out.println();
    }

    private void printPair(DivergenceReport.PairInfo pair) {
        out.printf("   Position:        Pass pair #%d%n", pair.index());
        out.printf("   Pipeline A Pass: \"%s\" (#%d in pipeline A)%n", pair.pipelineAPass(), pair.pipelineAPosition());
        out.printf("   Pipeline B Pass: \"%s\" (#%d in pipeline B)%n", pair.pipelineBPass(), pair.pipelineBPosition());
    }
}
