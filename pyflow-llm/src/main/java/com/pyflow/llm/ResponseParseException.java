package com.pyflow.llm;

import com.pyflow.model.ConversionException;

/** The model replied, but the reply holds no usable analysis JSON. Never retried. */
public final class ResponseParseException extends ConversionException {

    private final String snippet;

    public ResponseParseException(String message, String rawResponse) {
        this(message, rawResponse, null);
    }

    public ResponseParseException(String message, String rawResponse, Throwable cause) {
        super(String.format("%s | raw snippet=[%s]", message, ProviderException.abbreviate(rawResponse)), cause);
        this.snippet = ProviderException.abbreviate(rawResponse);
    }

    /** Start of the raw reply, truncated for logs. */
    public String getSnippet() {
        return snippet;
    }
}
