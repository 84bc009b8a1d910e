package com.sketchsync.model.crdt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode
public final class OperationId {
    private final String site;
    private final long seq;

    @JsonCreator
    public OperationId(@JsonProperty("site") String site, @JsonProperty("seq") long seq) {
        this.site = site;
        this.seq = seq;
    }

    @Override
    public String toString() {
        return site + ":" + seq;
    }
}
