package com.liquibot.mm.maker.orders;

import java.util.List;

public record ReconcileResult(
        boolean success,
        List<String> resolvedLive,
        List<String> resolvedCanceled,
        List<String> stillUnknown,
        String errorMessage
) {

    public ReconcileResult {
        resolvedLive = resolvedLive == null ? List.of() : List.copyOf(resolvedLive);
        resolvedCanceled = resolvedCanceled == null ? List.of() : List.copyOf(resolvedCanceled);
        stillUnknown = stillUnknown == null ? List.of() : List.copyOf(stillUnknown);
    }

    static ReconcileResult nothingToDo() {
        return new ReconcileResult(true, List.of(), List.of(), List.of(), null);
    }

    static ReconcileResult failed(List<String> unknown, String errorMessage) {
        return new ReconcileResult(false, List.of(), List.of(), unknown, errorMessage);
    }
}
