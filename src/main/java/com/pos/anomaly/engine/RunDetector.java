package com.pos.anomaly.engine;

import com.pos.anomaly.config.DetectionConfig;
import com.pos.anomaly.model.RunFlag;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finds maximal runs of consecutive anomalous shifts within one store.
 *
 * A single forward scan tracks the start index and value of the current block;
 * a block closes where the flag changes or the sequence ends. Anomalous blocks of
 * at least minRunLength members mark every member as in an alert run.
 */
@Component
public class RunDetector {

    private final DetectionConfig config;

    public RunDetector(DetectionConfig config) {
        this.config = config;
    }

    public Set<Integer> findRuns(List<Boolean> flags) {
        return findRuns(flags, config.getMinRunLength());
    }

    /**
     * @return indices of the flags that belong to an alert run, ascending
     */
    public Set<Integer> findRuns(List<Boolean> flags, int minRunLength) {
        List<RunFlag> runFlags = scan(flags, minRunLength);
        Set<Integer> members = new LinkedHashSet<>();
        for (int i = 0; i < runFlags.size(); i++) {
            if (runFlags.get(i).isInAlertRun()) {
                members.add(i);
            }
        }
        return members;
    }

    /**
     * Run flags for one store's shifts. The input must already be ordered by
     * opening time, ties by shift id; anything else is a caller bug.
     *
     * @throws IllegalArgumentException when the sequence is out of order or repeats a shift
     */
    public List<RunFlag> detect(List<RunCandidate> ordered) {
        List<Boolean> flags = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            RunCandidate current = ordered.get(i);
            Objects.requireNonNull(current.getOpenedAt(), "openedAt");
            Objects.requireNonNull(current.getShiftId(), "shiftId");
            if (i > 0) {
                requireAfter(ordered.get(i - 1), current);
            }
            flags.add(current.isAnomalous());
        }
        return scan(flags, config.getMinRunLength());
    }

    List<RunFlag> scan(List<Boolean> flags, int minRunLength) {
        if (minRunLength < 1) {
            throw new IllegalArgumentException("minRunLength must be >= 1, got " + minRunLength);
        }

        int n = flags.size();
        RunFlag[] result = new RunFlag[n];
        int runStart = 0;
        boolean runValue = n > 0 && flags.get(0);

        for (int i = 1; i <= n; i++) {
            if (i < n && flags.get(i) == runValue) {
                continue;
            }
            int length = i - runStart;
            boolean alert = runValue && length >= minRunLength;
            for (int j = runStart; j < i; j++) {
                result[j] = new RunFlag(alert, runValue ? length : 0);
            }
            if (i < n) {
                runStart = i;
                runValue = flags.get(i);
            }
        }

        return List.of(result);
    }

    private void requireAfter(RunCandidate previous, RunCandidate current) {
        int byTime = previous.getOpenedAt().compareTo(current.getOpenedAt());
        if (byTime > 0) {
            throw new IllegalArgumentException(String.format(
                    "Shifts out of order: %s opened at %s precedes %s opened at %s",
                    previous.getShiftId(), previous.getOpenedAt(), current.getShiftId(), current.getOpenedAt()));
        }
        if (byTime == 0) {
            int byId = previous.getShiftId().compareTo(current.getShiftId());
            if (byId == 0) {
                throw new IllegalArgumentException("Duplicate shift in run sequence: " + current.getShiftId());
            }
            if (byId > 0) {
                throw new IllegalArgumentException(String.format(
                        "Shifts opened at %s not ordered by shift id: %s before %s",
                        current.getOpenedAt(), previous.getShiftId(), current.getShiftId()));
            }
        }
    }
}
