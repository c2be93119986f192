package org.carball.motif.versioning;

import org.carball.motif.model.Solution;

import java.time.LocalDateTime;

/**
 * One step in a solution's lineage. The snapshot is owned by the version
 * manager and only ever handed out as a copy.
 */
public record VersionEntry(String version, String changesDescription, LocalDateTime createdAt, Solution snapshot) {

    VersionEntry copy() {
        return new VersionEntry(version, changesDescription, createdAt, snapshot.duplicate());
    }
}
