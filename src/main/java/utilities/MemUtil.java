package utilities;

import automaton.AhoCorasick;
import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;

import java.util.Locale;

public class MemUtil {

    // Detailed JOL report for a trie, optionally including the class footprint table.
    public String jolMemoryReport(boolean includeFootprintTable, AhoCorasick ac) {
        StringBuilder sb = new StringBuilder(4_096);

        // VM details (useful to interpret alignment, header sizes, and compressed oops status)
        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');

        GraphLayout total = GraphLayout.parseInstance(ac);
        sb.append("\n=== AhoCorasick total ===\n");
        sb.append("Node slots        : ").append(ac.numberOfNodes())
                .append(" (active ").append(ac.numberOfActiveNodes()).append(")\n");
        sb.append("Total bytes       : ").append(total.totalSize()).append(" B\n");
        sb.append("Total bytes (MiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", total.totalSize() / (1024.0 * 1024.0)))
                .append(" MiB\n");
        sb.append("Bytes per slot    : ")
                .append(String.format(Locale.ROOT, "%.1f", total.totalSize() / (double) ac.numberOfNodes()))
                .append(" B\n");

        if (includeFootprintTable) {
            // Class-by-class histogram, the child hash maps usually dominate
            sb.append("\n--- Class footprint ---\n");
            sb.append(total.toFootprint()).append('\n');
        }
        return sb.toString();
    }

    public long totalBytes(AhoCorasick ac) {
        return GraphLayout.parseInstance(ac).totalSize();
    }
}
