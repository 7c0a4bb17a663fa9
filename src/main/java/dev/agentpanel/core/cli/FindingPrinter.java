package dev.agentpanel.core.cli;

import dev.agentpanel.core.doctor.DoctorReport;
import java.io.PrintWriter;

final class FindingPrinter {
    private FindingPrinter() {}

    static void print(DoctorReport report, boolean json, PrintWriter out) {
        if (json) {
            out.println(report.toPrettyJson());
        } else {
            out.print(report.renderText());
        }
        out.flush();
    }
}
