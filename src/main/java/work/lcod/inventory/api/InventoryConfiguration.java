package work.lcod.inventory.api;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import work.lcod.inventory.fetch.FragmentFormat;

/**
 * Immutable settings for one invocation, resolved once at start-up.
 */
public record InventoryConfiguration(
    URI rootUri,
    Optional<String> environment,
    Optional<String> vaultPassword,
    FragmentFormat outputFormat,
    Duration timeout
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public InventoryConfiguration {
        Objects.requireNonNull(rootUri, "rootUri");
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(vaultPassword, "vaultPassword");
        Objects.requireNonNull(outputFormat, "outputFormat");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "InventoryConfiguration[rootUri=" + rootUri
            + ", environment=" + environment.orElse("<none>")
            + ", vaultPassword=" + (vaultPassword.isPresent() ? "<set>" : "<disabled>")
            + ", outputFormat=" + outputFormat
            + ", timeout=" + timeout + "]";
    }

    public static final class Builder {
        private URI rootUri;
        private Optional<String> environment = Optional.empty();
        private Optional<String> vaultPassword = Optional.empty();
        private FragmentFormat outputFormat = FragmentFormat.YAML;
        private Duration timeout = DEFAULT_TIMEOUT;

        public Builder rootUri(URI rootUri) {
            this.rootUri = rootUri;
            return this;
        }

        public Builder environment(Optional<String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder environment(String environment) {
            return environment(Optional.ofNullable(environment));
        }

        public Builder vaultPassword(Optional<String> vaultPassword) {
            this.vaultPassword = vaultPassword;
            return this;
        }

        public Builder outputFormat(FragmentFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public InventoryConfiguration build() {
            return new InventoryConfiguration(rootUri, environment, vaultPassword, outputFormat, timeout);
        }
    }
}
