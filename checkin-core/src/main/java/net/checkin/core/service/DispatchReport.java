package net.checkin.core.service;

import java.util.List;

public record DispatchReport(List<String> delivered, List<String> failed) {
    private static final DispatchReport NONE = new DispatchReport(List.of(), List.of());

    public DispatchReport {
        delivered = List.copyOf(delivered);
        failed = List.copyOf(failed);
    }

    public static DispatchReport none() { return NONE; }

    public boolean attempted() { return !delivered.isEmpty() || !failed.isEmpty(); }
}
