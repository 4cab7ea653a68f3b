package com.eainde.research.gateway;

import com.eainde.research.model.ErrorKind;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.ModelNotFoundException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps collaborator failures onto {@link ErrorKind}.
 *
 * <p>Walks the whole cause chain. Explicit classifications win
 * ({@link ExternalCallException}), then exception types, then HTTP status codes,
 * then message keywords. Anything unrecognised is {@link ErrorKind#TRANSIENT}.</p>
 */
public class ErrorClassifier {

    private static final int MAX_CHAIN_DEPTH = 20;

    public ErrorKind classify(Throwable error) {
        List<Throwable> chain = causeChain(error);

        for (Throwable x : chain) {
            if (x instanceof ExternalCallException) {
                return ((ExternalCallException) x).getKind();
            }
        }

        for (Throwable x : chain) {
            if (x instanceof InterruptedException || x instanceof CancellationException) {
                return ErrorKind.TIMEOUT;
            }
            if (x instanceof TimeoutException || x instanceof dev.langchain4j.exception.TimeoutException) {
                return ErrorKind.TIMEOUT;
            }
            if (x instanceof ModelNotFoundException || x instanceof IllegalArgumentException) {
                return ErrorKind.INVALID_INPUT;
            }
            if (x instanceof InternalServerException) {
                return ErrorKind.TRANSIENT;
            }
            if (x instanceof ConnectException || x instanceof UnknownHostException) {
                return ErrorKind.UNAVAILABLE;
            }
        }

        for (Throwable x : chain) {
            if (x instanceof HttpException) {
                return classifyStatus(((HttpException) x).statusCode());
            }
        }

        String messages = lowerCaseMessages(chain);
        if (messages.contains("rate limit") || messages.contains("too many requests")) {
            return ErrorKind.RATE_LIMITED;
        }
        if (messages.contains("timed out") || messages.contains("timeout")) {
            return ErrorKind.TIMEOUT;
        }
        for (Throwable x : chain) {
            if (x instanceof IOException) {
                return ErrorKind.UNAVAILABLE;
            }
        }
        return ErrorKind.TRANSIENT;
    }

    ErrorKind classifyStatus(int statusCode) {
        if (statusCode == 429) {
            return ErrorKind.RATE_LIMITED;
        }
        if (statusCode == 408) {
            return ErrorKind.TIMEOUT;
        }
        if (statusCode == 502 || statusCode == 503) {
            return ErrorKind.UNAVAILABLE;
        }
        if (statusCode >= 500) {
            return ErrorKind.TRANSIENT;
        }
        if (statusCode >= 400) {
            return ErrorKind.INVALID_INPUT;
        }
        return ErrorKind.TRANSIENT;
    }

    private static List<Throwable> causeChain(Throwable error) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = error;
        while (current != null && chain.size() < MAX_CHAIN_DEPTH) {
            chain.add(current);
            Throwable next = current.getCause();
            if (next == current) {
                break;
            }
            current = next;
        }
        return chain;
    }

    private static String lowerCaseMessages(List<Throwable> chain) {
        StringBuilder sb = new StringBuilder();
        for (Throwable x : chain) {
            if (x.getMessage() != null) {
                sb.append(x.getMessage().toLowerCase(Locale.ROOT)).append(" | ");
            }
        }
        return sb.toString();
    }
}
