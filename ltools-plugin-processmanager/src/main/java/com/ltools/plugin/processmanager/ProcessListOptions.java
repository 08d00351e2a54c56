package com.ltools.plugin.processmanager;

/**
 * Filtering, sorting and paging of {@link ProcessManagerPlugin#getProcesses}.
 *
 * @param searchTerm substring matched against name, path, command line and pid; blank for all
 * @param sortBy     {@code pid} (default), {@code name} or {@code cpu}
 * @param sortDesc   descending order
 * @param showSystem include system processes
 * @param limit      page size; 0 or less for no paging
 * @param offset     page offset
 */
public record ProcessListOptions(String searchTerm, String sortBy, boolean sortDesc, boolean showSystem,
                                 int limit, int offset) {

    public static ProcessListOptions all() {
        return new ProcessListOptions("", "pid", false, true, 0, 0);
    }
}
