package io.simconvert.standalone.convert;

import java.nio.file.Path;
import java.util.List;

/**
 * Summary of a converter run over a set of files.
 *
 * @param outcomes one entry per processed file, in processing order
 * @param dryRun   whether files were left unwritten
 */
public record ConversionReport(List<FileOutcome> outcomes, boolean dryRun) {

    public ConversionReport {
        outcomes = List.copyOf(outcomes);
    }

    public int total() {
        return outcomes.size();
    }

    public int converted() {
        return count(FileOutcome.Status.CONVERTED);
    }

    public int upToDate() {
        return count(FileOutcome.Status.UP_TO_DATE);
    }

    public int unsupported() {
        return count(FileOutcome.Status.UNSUPPORTED);
    }

    public int failed() {
        return count(FileOutcome.Status.FAILED);
    }

    public boolean hasFailures() {
        return failed() > 0;
    }

    /** Files that could not be processed, in processing order. */
    public List<Path> failedFiles() {
        return outcomes.stream()
                .filter(o -> o.status() == FileOutcome.Status.FAILED)
                .map(FileOutcome::file)
                .toList();
    }

    private int count(FileOutcome.Status status) {
        return (int) outcomes.stream().filter(o -> o.status() == status).count();
    }

    @Override
    public String toString() {
        return "ConversionReport{files=" + total() + ", converted=" + converted() + ", upToDate=" + upToDate()
                + ", unsupported=" + unsupported() + ", failed=" + failed() + ", dryRun=" + dryRun + "}";
    }
}
