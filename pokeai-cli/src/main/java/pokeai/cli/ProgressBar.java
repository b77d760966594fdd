package pokeai.cli;

import java.io.PrintWriter;

/**
 * In-place progress line for self-play runs, redrawn with a carriage return.
 */
public class ProgressBar {
    private static final int DEFAULT_WIDTH = 30;

    private final PrintWriter out;
    private final int total;
    private final int barWidth;
    private final long startTime;
    private int current;

    public ProgressBar(PrintWriter out, int total) {
        this(out, total, DEFAULT_WIDTH);
    }

    public ProgressBar(PrintWriter out, int total, int barWidth) {
        this.out = out;
        this.total = total;
        this.barWidth = barWidth;
        this.startTime = System.currentTimeMillis();
    }

    public synchronized void increment() {
        current++;
        render();
    }

    public synchronized int getCurrent() {
        return current;
    }

    private void render() {
        double fraction = total > 0 ? (double) current / total : 0;
        int filled = (int) (fraction * barWidth);

        StringBuilder bar = new StringBuilder(barWidth + 2).append('[');
        for (int i = 0; i < barWidth; i++) {
            bar.append(i < filled ? '#' : i == filled ? '>' : ' ');
        }
        bar.append(']');

        String eta = "--:--";
        if (current > 0) {
            long elapsed = System.currentTimeMillis() - startTime;
            eta = formatDuration((long) (elapsed * (total - current) / (double) current));
        }
        out.printf("\r%s %3.0f%% %d/%d  ETA: %s", bar, fraction * 100, current, total, eta);
        out.flush();
    }

    /**
     * Draws the completed bar and moves to the next line.
     */
    public synchronized void finish() {
        current = total;
        render();
        out.printf("  [%s]%n", formatDuration(System.currentTimeMillis() - startTime));
        out.flush();
    }

    static String formatDuration(long ms) {
        long secs = ms / 1000;
        if (secs < 60) {
            return String.format("0:%02d", secs);
        } else if (secs < 3600) {
            return String.format("%d:%02d", secs / 60, secs % 60);
        }
        return String.format("%d:%02d:%02d", secs / 3600, (secs % 3600) / 60, secs % 60);
    }
}
