package io.jobrelay.supervisor;

import io.jobrelay.model.LogKind;

@FunctionalInterface
public interface LineSink {
    void accept(LogKind kind, String line);
}
