package com.skindx.infrastructure.ai.provider;

import java.util.function.Supplier;

/**
 * Builds the adapter for one provider kind.
 */
public interface AiProviderFactory {

    ProviderKind kind();

    /**
     * @throws ProviderUnavailableException when the provider lacks credentials or is switched off
     */
    AiProvider create();

    static AiProviderFactory of(ProviderKind kind, Supplier<AiProvider> supplier) {
        return new AiProviderFactory() {
            @Override
            public ProviderKind kind() {
                return kind;
            }

            @Override
            public AiProvider create() {
                return supplier.get();
            }
        };
    }
}
