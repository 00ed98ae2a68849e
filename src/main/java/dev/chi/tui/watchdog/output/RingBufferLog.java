package dev.chi.tui.watchdog.output;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 有界行缓冲：按写入顺序保存输出行，超出容量时从最旧的一行开始淘汰。
 * <p>
 * 读写共用同一把锁：stdout/stderr 读线程、编排线程的状态行可以并发写入，渲染侧/统计侧读取快照。
 */
public class RingBufferLog {

    public static final int DEFAULT_CAPACITY = 5000;

    private final int capacity;
    private final Deque<String> lines = new ArrayDeque<>();

    // lines pushed since the last clear (not capped by capacity)
    private long pushed;
    // bumped on every clear
    private long generation;

    public RingBufferLog() {
        this(DEFAULT_CAPACITY);
    }

    public RingBufferLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void pushLine(String line) {
        synchronized (lines) {
            lines.addLast(line == null ? "" : line);
            pushed++;
            while (lines.size() > capacity) {
                lines.removeFirst();
            }
        }
    }

    public void clear() {
        synchronized (lines) {
            lines.clear();
            pushed = 0;
            generation++;
        }
    }

    public int size() {
        synchronized (lines) {
            return lines.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    public List<String> snapshot() {
        synchronized (lines) {
            return new ArrayList<>(lines);
        }
    }

    public List<String> tail(int count) {
        if (count <= 0) {
            return List.of();
        }
        synchronized (lines) {
            return lastLines(count);
        }
    }

    /**
     * Lines appended after the given mark, read atomically with the mark that follows them.
     * If the buffer was cleared since {@code generation} the slice is a reset carrying every
     * current line.
     */
    public Slice sliceSince(long generation, long pushedMark) {
        synchronized (lines) {
            if (generation != this.generation || pushedMark > pushed) {
                return new Slice(this.generation, pushed, true, new ArrayList<>(lines));
            }
            long fresh = pushed - pushedMark;
            int take = (int) Math.min(fresh, lines.size());
            return new Slice(this.generation, pushed, false, lastLines(take));
        }
    }

    private List<String> lastLines(int count) {
        int size = lines.size();
        int skip = Math.max(0, size - count);
        List<String> out = new ArrayList<>(size - skip);
        Iterator<String> it = lines.iterator();
        int i = 0;
        while (it.hasNext()) {
            String s = it.next();
            if (i++ >= skip) {
                out.add(s);
            }
        }
        return out;
    }

    public static final class Slice {
        private final long generation;
        private final long pushedMark;
        private final boolean reset;
        private final List<String> lines;

        Slice(long generation, long pushedMark, boolean reset, List<String> lines) {
            this.generation = generation;
            this.pushedMark = pushedMark;
            this.reset = reset;
            this.lines = lines;
        }

        public long getGeneration() {
            return generation;
        }

        public long getPushedMark() {
            return pushedMark;
        }

        public boolean isReset() {
            return reset;
        }

        public List<String> getLines() {
            return lines;
        }
    }
}
