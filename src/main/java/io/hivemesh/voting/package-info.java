/**
 * Voting sessions, tally algorithms, quorum checks and the hash-chained vote audit trail.
 */
package io.hivemesh.voting;
