package com.planforge.core.model;

import java.io.Serializable;

/**
 * An isolated git worktree attached to a session.
 *
 * @param worktreePath path of the worktree checkout
 * @param branchName   branch created for the session
 * @param sourceBranch branch the worktree was created from, null when unknown
 * @param originalDir  directory the session was started in
 */
public record WorktreeState(
        String worktreePath,
        String branchName,
        String sourceBranch,
        String originalDir
) implements Serializable {
}
