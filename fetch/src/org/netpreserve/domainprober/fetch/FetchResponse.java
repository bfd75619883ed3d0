package org.netpreserve.domainprober.fetch;

import org.jetbrains.annotations.NotNull;

public record FetchResponse(int status, @NotNull String body) {
    public FetchResponse {
        if (body == null) body = "";
    }
}
