package utilities;

/**
 * JOL measurement of an index: the printable report, the retained size in bytes and that size
 * divided by the number of indexed symbols (terminator included).
 */
public record MemoryUsageReport(String report, long totalBytes, double bytesPerSymbol) {

    public double totalMiB() {
        return totalBytes / (1024.0 * 1024.0);
    }
}
