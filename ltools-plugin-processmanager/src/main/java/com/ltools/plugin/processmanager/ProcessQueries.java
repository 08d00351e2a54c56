package com.ltools.plugin.processmanager;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/** Filter, sort and page a sampled process list. */
final class ProcessQueries {

    private ProcessQueries() {
    }

    static ProcessPage query(List<ProcessInfo> source, ProcessListOptions options) {
        ProcessListOptions o = options != null ? options : ProcessListOptions.all();
        String term = o.searchTerm() != null ? o.searchTerm().trim() : "";
        List<ProcessInfo> matched = new ArrayList<>();
        for (ProcessInfo p : source) {
            if (!o.showSystem() && p.isSystem()) continue;
            if (!term.isEmpty() && !p.matches(term)) continue;
            matched.add(p);
        }
        Comparator<ProcessInfo> order = comparator(o.sortBy());
        matched.sort(o.sortDesc() ? order.reversed() : order);
        int total = matched.size();
        if (o.limit() <= 0) {
            return new ProcessPage(matched, total);
        }
        int from = Math.min(Math.max(0, o.offset()), total);
        int to = Math.min(from + o.limit(), total);
        return new ProcessPage(matched.subList(from, to), total);
    }

    static Comparator<ProcessInfo> comparator(String sortBy) {
        String key = sortBy != null ? sortBy.trim().toLowerCase(Locale.ROOT) : "";
        Comparator<ProcessInfo> byPid = Comparator.comparingLong(ProcessInfo::getPid);
        return switch (key) {
            case "name" -> Comparator.comparing((ProcessInfo p) -> p.getName().toLowerCase(Locale.ROOT)).thenComparing(byPid);
            case "cpu" -> Comparator.comparingLong(ProcessInfo::getCpuTimeMillis).thenComparing(byPid);
            default -> byPid;
        };
    }
}
