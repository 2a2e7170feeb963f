package com.waqiti.bridge.chain;

import com.waqiti.bridge.exception.ValidationException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves the adapter for a chain id. Built by {@code BridgeEngineConfiguration} from adapter
 * beans and from one {@link LedgerChainAdapter} per {@link LedgerClient} bean.
 */
public class ChainAdapterRouter {

    private final Map<String, ChainAdapter> adaptersByChainId;

    // Fails fast if two adapters claim the same chain.
    public ChainAdapterRouter(List<ChainAdapter> adapters) {
        this.adaptersByChainId = adapters.stream()
                .collect(Collectors.toUnmodifiableMap(
                        ChainAdapter::chainId,
                        Function.identity(),
                        (left, right) -> {
                            throw new IllegalStateException("Multiple adapters found for chain: " + left.chainId());
                        }
                ));
    }

    public ChainAdapter resolve(String chainId) {
        return find(chainId)
                .orElseThrow(() -> new ValidationException("No adapter for chain: " + chainId));
    }

    public Optional<ChainAdapter> find(String chainId) {
        return Optional.ofNullable(chainId).map(adaptersByChainId::get);
    }

    public Collection<ChainAdapter> all() {
        return adaptersByChainId.values();
    }
}
