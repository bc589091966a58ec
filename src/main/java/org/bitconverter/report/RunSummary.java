package org.bitconverter.report;

import lombok.Getter;
import org.bitconverter.simulation.Run;
import org.bitconverter.simulation.Verdict;

import java.util.List;

/**
 * 按结论统计的运行次数。
 */
@Getter
public final class RunSummary {

    private final int totalRuns;
    private final int accepted;
    private final int rejected;
    private final int stuck;

    private RunSummary(int totalRuns, int accepted, int rejected, int stuck) {
        this.totalRuns = totalRuns;
        this.accepted = accepted;
        this.rejected = rejected;
        this.stuck = stuck;
    }

    public static RunSummary of(List<Run> runs) {
        int accepted = 0;
        int rejected = 0;
        int stuck = 0;
        for (Run run : runs) {
            switch (run.getVerdict()) {
                case ACCEPTED -> accepted++;
                case REJECTED -> rejected++;
                case STUCK -> stuck++;
            }
        }
        return new RunSummary(runs.size(), accepted, rejected, stuck);
    }

    public int count(Verdict verdict) {
        return switch (verdict) {
            case ACCEPTED -> accepted;
            case REJECTED -> rejected;
            case STUCK -> stuck;
        };
    }

    @Override
    public String toString() {
        return String.format("RunSummary(total=%d, accepted=%d, rejected=%d, stuck=%d)",
                totalRuns, accepted, rejected, stuck);
    }
}
