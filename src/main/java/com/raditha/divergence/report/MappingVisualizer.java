package com.raditha.divergence.report;

import com.raditha.divergence.analyzer.AnalysisOutcome;
import com.raditha.divergence.model.AlignmentPair;
import com.raditha.divergence.model.DivergenceResult;
import com.raditha.divergence.model.PassRecord;

import java.util.List;

/**
 * Renders both pipelines side by side. Aligned pairs share a row; passes without a
 * partner sit alone on their side, between the pairs that surround them.
 */
public class MappingVisualizer {

    static final String MAPPED = " <---> ";
    static final String DIVERGENT = " <-D-> ";

    private static final int LEFT_WIDTH = 50;
    private static final int CONNECTOR_WIDTH = 7;
    private static final int RULE_WIDTH = 120;

    public String render(AnalysisOutcome outcome) {
        List<PassRecord> passesA = outcome.pipelineA();
        List<PassRecord> passesB = outcome.pipelineB();
        List<AlignmentPair> pairs = outcome.alignment().pairs();
        DivergenceResult divergence = outcome.divergence();

        StringBuilder sb = new StringBuilder();
        sb.append("IR PASS PIPELINE MAPPING VISUALIZATION\n");
        sb.append("=".repeat(RULE_WIDTH)).append("\n\n");
        sb.append(String.format("%-60s%s%n", "PIPELINE A PASSES (" + passesA.size() + " total)",
                "PIPELINE B PASSES (" + passesB.size() + " total)"));
        sb.append("=".repeat(60)).append("=".repeat(60)).append("\n\n");

        int nextA = 0;
        int nextB = 0;
        for (int i = 0; i < pairs.size(); i++) {
            AlignmentPair pair = pairs.get(i);
            int indexA = pair.a().sequenceIndex();
            int indexB = pair.b().sequenceIndex();
            for (; nextA < indexA; nextA++) {
                row(sb, entry(passesA.get(nextA)), "", "");
            }
            for (; nextB < indexB; nextB++) {
                row(sb, "", "", entry(passesB.get(nextB)));
            }
            boolean divergent = divergence.found() && divergence.index() == i;
            row(sb, entry(pair.a()), divergent ? DIVERGENT : MAPPED, entry(pair.b()));
            nextA = indexA + 1;
            nextB = indexB + 1;
        }
        for (; nextA < passesA.size(); nextA++) {
            row(sb, entry(passesA.get(nextA)), "", "");
        }
        for (; nextB < passesB.size(); nextB++) {
            row(sb, "", "", entry(passesB.get(nextB)));
        }

        sb.append("\n").append("=".repeat(RULE_WIDTH)).append("\n");
        sb.append("SUMMARY:\n");
        sb.append("  Total Pipeline A Passes: ").append(passesA.size()).append("\n");
        sb.append("  Total Pipeline B Passes: ").append(passesB.size()).append("\n");
        sb.append("  Successfully Mapped: ").append(pairs.size()).append("\n");
        sb.append("  Unmapped Pipeline A: ").append(passesA.size() - pairs.size()).append("\n");
        sb.append("  Unmapped Pipeline B: ").append(passesB.size() - pairs.size()).append("\n");

        if (divergence.found()) {
            sb.append("\nFIRST DIVERGENCE:\n");
            sb.append("  Pipeline A: ").append(divergence.pair().a().canonicalName())
                    .append(" (#").append(divergence.pair().a().sequenceIndex()).append(")\n");
            sb.append("  Pipeline B: ").append(divergence.pair().b().canonicalName())
                    .append(" (#").append(divergence.pair().b().sequenceIndex()).append(")\n");
            sb.append("  Marked with: <-D->\n");
        } else {
            sb.append("\nNO DIVERGENCE FOUND\n");
        }

        sb.append("\nLEGEND:\n");
        sb.append("  <--->  Mapped passes with identical IR\n");
        sb.append("  <-D->  First divergent pass pair\n");
        sb.append("  (no arrow)  Unmapped pass\n");
        return sb.toString();
    }

    static String entry(PassRecord pass) {
        return String.format("(#%3d) %s", pass.sequenceIndex(), pass.canonicalName());
    }

    private static void row(StringBuilder sb, String left, String connector, String right) {
        sb.append(String.format("%-" + LEFT_WIDTH + "s%-" + CONNECTOR_WIDTH + "s%s", left, connector, right)
                .stripTrailing()).append("\n");
    }
}
