package de.netcompliance.core.connector;

import de.netcompliance.core.exception.PermanentConnectorException;
import de.netcompliance.core.exception.TransientConnectorException;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.VendorType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static de.netcompliance.fixtures.Fixtures.device;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryingVendorConnectorTest {

    private final Device device = device("edge-01", VendorType.CISCO_XR);

    @Test
    void testTransientFetchFailureIsRetried() {
        // given
        final FlakyConnector flaky = new FlakyConnector(device, 2, false);
        final RetryingVendorConnector connector = new RetryingVendorConnector(flaky, 2, Duration.ofMillis(10));

        // when
        final FetchResult result = connector.fetch("/ssh", null);

        // then
        assertThat(result.getValue()).contains("v2");
        assertThat(flaky.attempts.get()).isEqualTo(3);
    }

    @Test
    void testRetriesAreBounded() {
        // given
        final FlakyConnector flaky = new FlakyConnector(device, 5, false);
        final RetryingVendorConnector connector = new RetryingVendorConnector(flaky, 1, Duration.ofMillis(10));

        // when / then
        assertThatThrownBy(() -> connector.fetch("/ssh", null)).isInstanceOf(TransientConnectorException.class);
        assertThat(flaky.attempts.get()).isEqualTo(2);
    }

    @Test
    void testPermanentFailureIsNotRetried() {
        // given
        final FlakyConnector flaky = new FlakyConnector(device, 5, true);
        final RetryingVendorConnector connector = new RetryingVendorConnector(flaky, 3, Duration.ofMillis(10));

        // when / then
        assertThatThrownBy(() -> connector.fetch("/ssh", null)).isInstanceOf(PermanentConnectorException.class);
        assertThat(flaky.attempts.get()).isEqualTo(1);
    }

    private static final class FlakyConnector implements VendorConnector {

        private final Device device;
        private final int failures;
        private final boolean permanent;
        private final AtomicInteger attempts = new AtomicInteger();

        private FlakyConnector(final Device device, final int failures, final boolean permanent) {
            this.device = device;
            this.failures = failures;
            this.permanent = permanent;
        }

        @Override
        public Device getDevice() {
            return device;
        }

        @Override
        public FetchResult fetch(final String path, final Object filter) {
            if (attempts.incrementAndGet() <= failures) {
                if (permanent) throw new PermanentConnectorException("authentication failed");
                throw new TransientConnectorException("connection reset");
            }
            return FetchResult.found("v2");
        }

        @Override
        public PushResult push(final PushRequest request) {
            throw new UnsupportedOperationException();
        }

        @Override
        public ConfigSnapshot snapshot(final PushRequest request) {
            throw new UnsupportedOperationException();
        }

        @Override
        public PushResult restore(final ConfigSnapshot snapshot) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void closeSession() {
        }
    }
}
