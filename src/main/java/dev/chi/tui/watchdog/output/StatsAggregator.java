package dev.chi.tui.watchdog.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 基于正则的增量计数器：只扫描上次之后新增的行，避免每次刷新都全量重扫几千行历史。
 * <p>
 * 任一缓冲在两次刷新之间被清空（clear/restart），则对全部缓冲整体重算一次。
 */
public class StatsAggregator {
    private static final Logger log = LoggerFactory.getLogger(StatsAggregator.class);

    private final List<String> labels = new ArrayList<>();
    private final List<Pattern> patterns = new ArrayList<>();
    private final long[] counts;
    private final long[] generations;
    private final long[] marks;

    public StatsAggregator(List<StatPattern> specs, int logCount) {
        if (specs != null) {
            for (StatPattern sp : specs) {
                if (sp == null || sp.getRegex() == null) continue;
                try {
                    patterns.add(Pattern.compile(sp.getRegex()));
                    labels.add(sp.getLabel() == null ? "" : sp.getLabel());
                } catch (PatternSyntaxException e) {
                    log.debug("stat pattern dropped: label={}, regex={}, error={}",
                            sp.getLabel(), sp.getRegex(), e.getDescription());
                }
            }
        }
        int n = Math.max(0, logCount);
        this.counts = new long[patterns.size()];
        this.generations = new long[n];
        this.marks = new long[n];
    }

    public synchronized void updateFromBuffers(List<RingBufferLog> buffers) {
        int n = Math.min(buffers.size(), marks.length);
        List<RingBufferLog.Slice> slices = new ArrayList<>(n);
        boolean reset = false;
        for (int i = 0; i < n; i++) {
            RingBufferLog.Slice slice = buffers.get(i).sliceSince(generations[i], marks[i]);
            slices.add(slice);
            reset |= slice.isReset();
        }
        if (reset) {
            Arrays.fill(counts, 0L);
            for (int i = 0; i < n; i++) {
                RingBufferLog.Slice slice = slices.get(i);
                if (!slice.isReset()) {
                    slice = buffers.get(i).sliceSince(-1L, 0L);
                }
                apply(i, slice);
            }
            return;
        }
        for (int i = 0; i < n; i++) {
            apply(i, slices.get(i));
        }
    }

    private void apply(int index, RingBufferLog.Slice slice) {
        for (String line : slice.getLines()) {
            countLine(line);
        }
        generations[index] = slice.getGeneration();
        marks[index] = slice.getPushedMark();
    }

    private void countLine(String line) {
        for (int p = 0; p < patterns.size(); p++) {
            Matcher m = patterns.get(p).matcher(line);
            while (m.find()) {
                counts[p]++;
            }
        }
    }

    public synchronized List<String> labels() {
        return List.copyOf(labels);
    }

    public synchronized List<Long> counts() {
        List<Long> out = new ArrayList<>(counts.length);
        for (long c : counts) out.add(c);
        return out;
    }

    public int size() {
        return patterns.size();
    }
}
