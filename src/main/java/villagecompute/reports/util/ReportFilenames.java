package villagecompute.reports.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Builds PDF file names of the form {@code <schedule name>-yyyy-MM-dd-HHmmss.pdf}, spaces replaced by underscores.
 */
public final class ReportFilenames {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd-HHmmss")
            .withZone(ZoneOffset.UTC);

    private ReportFilenames() {
    }

    public static String pdfFilename(String scheduleName, Instant timestamp) {
        String base = scheduleName == null || scheduleName.isBlank() ? "report" : scheduleName.trim();
        return base.replace(' ', '_').replace('/', '_').replace('"', '_') + "-" + STAMP.format(timestamp) + ".pdf";
    }
}
