package com.umitunal.tempo.model;

import com.umitunal.tempo.core.ContinuationTrigger;

import java.nio.ByteBuffer;

import static com.umitunal.tempo.model.BinaryRecords.*;

/**
 * Edge from an antecedent job to a dependent created in
 * {@code AWAITING_CONTINUATION}. The dependent's payload lives on the
 * dependent job itself.
 */
public class ContinuationLink {
    private final String antecedentId;
    private final String dependentId;
    private final ContinuationTrigger trigger;
    private final long createdAt;

    public ContinuationLink(String antecedentId, String dependentId, ContinuationTrigger trigger, long createdAt) {
        this.antecedentId = antecedentId;
        this.dependentId = dependentId;
        this.trigger = trigger;
        this.createdAt = createdAt;
    }

    public String getAntecedentId() { return antecedentId; }
    public String getDependentId() { return dependentId; }
    public ContinuationTrigger getTrigger() { return trigger; }
    public long getCreatedAt() { return createdAt; }

    public byte[] serialize() {
        byte[] antecedent = utf8(antecedentId);
        byte[] dependent = utf8(dependentId);
        ByteBuffer buffer = ByteBuffer.allocate(sizeOf(antecedent) + sizeOf(dependent) + 4 + 8);
        put(buffer, antecedent);
        put(buffer, dependent);
        buffer.putInt(trigger.ordinal());
        buffer.putLong(createdAt);
        return buffer.array();
    }

    public static ContinuationLink deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        String antecedent = getString(buffer);
        String dependent = getString(buffer);
        ContinuationTrigger trigger = ContinuationTrigger.values()[buffer.getInt()];
        return new ContinuationLink(antecedent, dependent, trigger, buffer.getLong());
    }

    @Override
    public String toString() {
        return "ContinuationLink{" + antecedentId + " -> " + dependentId + ", " + trigger + "}";
    }
}
