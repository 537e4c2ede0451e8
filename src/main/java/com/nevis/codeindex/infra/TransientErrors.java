package com.nevis.codeindex.infra;

import com.nevis.codeindex.exception.TransientProviderException;
import dev.langchain4j.exception.RetriableException;

import java.io.IOException;
import java.util.List;

public final class TransientErrors {

    public static final List<Class<? extends Throwable>> TYPES =
        List.of(RetriableException.class, IOException.class, TransientProviderException.class);

    private TransientErrors() {
    }

    public static boolean isTransient(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            for (Class<? extends Throwable> type : TYPES) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
