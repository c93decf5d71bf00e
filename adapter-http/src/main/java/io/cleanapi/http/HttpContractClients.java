package io.cleanapi.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cleanapi.core.config.ClientConfig;
import io.cleanapi.core.config.ConfigLoader;
import io.cleanapi.core.contract.Contract;
import io.cleanapi.core.engine.ContractClient;
import java.nio.file.Path;

/** Factory methods wiring a {@link ContractClient} to the JDK HTTP transport. */
public final class HttpContractClients {

    private HttpContractClients() {
        // utility class
    }

    /**
     * Loads a YAML config file (with environment overrides) and builds a client for it.
     *
     * @throws io.cleanapi.core.config.ConfigLoadException if the file cannot be loaded
     */
    public static ContractClient fromConfig(Contract contract, Path configPath) {
        return create(contract, ConfigLoader.load(configPath));
    }

    /** Builds a client using {@link JdkHttpTransport} and the network-interface probe. */
    public static ContractClient create(Contract contract, ClientConfig config) {
        ObjectMapper mapper = new ObjectMapper();
        return ContractClient.builder(contract)
                .transport(new JdkHttpTransport(config, mapper))
                .config(config)
                .connectivityProbe(new NetworkInterfaceConnectivityProbe())
                .objectMapper(mapper)
                .build();
    }
}
