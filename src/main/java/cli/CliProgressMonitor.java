package cli;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Progress and heartbeat logging for batch formatting.
 *
 * <p>The batch loop reports the row it is on (id and dialect) and the output
 * it produced; the heartbeat thread and the periodic progress line read those
 * counters.</p>
 */
public final class CliProgressMonitor {

    public static final long DEFAULT_HEARTBEAT_MS = 30_000L;

    private static final AtomicInteger currentIndex = new AtomicInteger(0);
    private static final AtomicInteger changedRows = new AtomicInteger(0);
    private static final AtomicLong formattedLines = new AtomicLong(0);
    private static volatile String currentId = "";
    private static volatile String currentLanguage = "";

    private CliProgressMonitor() {
    }

    /** 새 배치 시작 전에 카운터를 초기화한다. */
    public static void reset() {
        currentIndex.set(0);
        changedRows.set(0);
        formattedLines.set(0);
        currentId = "";
        currentLanguage = "";
    }

    public static void setCurrent(String sqlId, String languageTag, int index1Based) {
        currentId = (sqlId == null) ? "" : sqlId;
        currentLanguage = (languageTag == null) ? "" : languageTag;
        currentIndex.set(Math.max(0, index1Based));
    }

    /** Records one formatted row: its output line count and whether the text changed. */
    public static void recordFormatted(int outputLines, boolean changed) {
        formattedLines.addAndGet(Math.max(0, outputLines));
        if (changed) changedRows.incrementAndGet();
    }

    /** 하트비트 한 줄. 멈춘 지점(id, dialect)을 확인하는 용도. */
    public static String heartbeatLine(int total) {
        return "[HEARTBEAT] formatting " + currentIndex.get() + "/" + total
                + " id=" + currentId
                + " lang=" + currentLanguage
                + " changed=" + changedRows.get()
                + " lines=" + formattedLines.get();
    }

    /** intervalMs 마다 {@link #heartbeatLine(int)} 을 출력한다. 반환된 스레드를 interrupt 하면 종료. */
    public static Thread startHeartbeat(int total, long intervalMs) {
        long sleepMs = Math.max(1L, intervalMs);
        Thread t = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    Thread.sleep(sleepMs);
                    System.out.println(heartbeatLine(total));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "sqlfmt-heartbeat");
        t.setDaemon(true);
        t.start();
        return t;
    }

    public static String progressLine(int done, int total, int success, int skip, long loopStartNs) {
        long elapsed = (System.nanoTime() - loopStartNs) / 1_000_000L;
        long rowsPerSec = elapsed <= 0 ? done : done * 1000L / elapsed;

        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);

        return String.format("[PROGRESS] %d/%d success=%d skip=%d changed=%d lines=%d elapsed=%dms rate=%d/s heap=%dMB last=%s(%s)",
                done, total, success, skip, changedRows.get(), formattedLines.get(),
                elapsed, rowsPerSec, usedMb, currentId, currentLanguage);
    }

    public static void logProgress(int done, int total, int success, int skip, long loopStartNs) {
        System.out.println(progressLine(done, total, success, skip, loopStartNs));
    }
}
