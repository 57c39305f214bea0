package io.github.jaggr.executor;

import io.github.jaggr.function.AggrState;

/**
 * One group: its encoded key and one state per requested function, in request order.
 */
public class GroupEntry {
    private final byte[] key;
    private final AggrState[] states;

    // rows of the current batch, used by the hash executor to gather row ranges
    int batchStart;
    int batchCount;

    public GroupEntry(byte[] key, AggrState[] states) {
        this.key = key;
        this.states = states;
    }

    public byte[] getKey() {
        return key;
    }

    public AggrState[] getStates() {
        return states;
    }
}
