package io.swarmhive.export;

/**
 * @param dryRun       count what would change without appending events
 * @param skipExisting leave cells that already exist untouched
 */
public record ImportOptions(boolean dryRun, boolean skipExisting) {
    public static ImportOptions defaults() {
        return new ImportOptions(false, false);
    }
}
