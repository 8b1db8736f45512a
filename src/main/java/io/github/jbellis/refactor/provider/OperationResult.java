package io.github.jbellis.refactor.provider;

import io.github.jbellis.refactor.ErrorKind;
import io.github.jbellis.refactor.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Fields every operation result carries. A failed result has {@code success == false}, an error kind, a
 * message and at least one suggestion; a successful one has neither error kind nor message.
 */
public interface OperationResult {
    boolean success();

    @Nullable
    ErrorKind errorKind();

    @Nullable
    String message();

    List<String> suggestions();

    default String toJson() {
        return Json.toJson(this);
    }
}
