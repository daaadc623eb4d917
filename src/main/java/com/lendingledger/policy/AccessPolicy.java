package com.lendingledger.policy;

import com.lendingledger.common.exception.NotAuthorizedException;
import lombok.Value;

import java.util.Set;

/**
 * Role view of one caller against the current steward and curators.
 *
 * Privileged operations take one of these instead of reading roles from
 * ambient state, so authorization can be tested without a request context.
 */
@Value
public class AccessPolicy {

    String callerId;
    String stewardId;
    Set<String> curatorIds;

    public static AccessPolicy of(String callerId, String stewardId, Set<String> curatorIds) {
        return new AccessPolicy(callerId, stewardId, Set.copyOf(curatorIds));
    }

    public boolean isSteward() {
        return stewardId != null && stewardId.equals(callerId);
    }

    public boolean isCurator() {
        return callerId != null && curatorIds.contains(callerId);
    }

    public void requireSteward(String operation) {
        if (!isSteward()) {
            throw NotAuthorizedException.notSteward(callerId, operation);
        }
    }

    public void requireStewardOrCurator(String operation) {
        if (!isSteward() && !isCurator()) {
            throw NotAuthorizedException.notStewardOrCurator(callerId, operation);
        }
    }
}
