package tech.rbacweb.sdk.client;

import tech.rbacweb.sdk.dto.RbacSnapshot;

import java.util.Optional;

/**
 * Retrieves the RBAC snapshot from the authority.
 */
public interface SnapshotFetcher {

    /**
     * Fetch the current snapshot.
     *
     * @return the snapshot, or empty when the authority has no RBAC data (HTTP 404)
     * @throws tech.rbacweb.sdk.exception.RbacWebException on any other failure
     */
    Optional<RbacSnapshot> fetch();
}
