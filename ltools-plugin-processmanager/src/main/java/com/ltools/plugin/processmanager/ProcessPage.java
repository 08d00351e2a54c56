package com.ltools.plugin.processmanager;

import java.util.List;

/**
 * One page of a filtered, sorted process list.
 *
 * @param processes the page
 * @param total     matches before paging
 */
public record ProcessPage(List<ProcessInfo> processes, int total) {

    public ProcessPage {
        processes = List.copyOf(processes);
    }
}
