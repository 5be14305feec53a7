package com.skindx.infrastructure.ai.provider;

/**
 * A provider cannot be constructed (missing API key, disabled). Not a call failure.
 */
public class ProviderUnavailableException extends RuntimeException {

    public ProviderUnavailableException(String message) {
        super(message);
    }
}
