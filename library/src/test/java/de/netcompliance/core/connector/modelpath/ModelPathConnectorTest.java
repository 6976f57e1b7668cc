package de.netcompliance.core.connector.modelpath;

import de.netcompliance.core.connector.ConfigSnapshot;
import de.netcompliance.core.connector.FetchResult;
import de.netcompliance.core.connector.ModelPathTransport;
import de.netcompliance.core.connector.PathEdit;
import de.netcompliance.core.connector.PushRequest;
import de.netcompliance.core.connector.PushResult;
import de.netcompliance.core.exception.PermanentConnectorException;
import de.netcompliance.core.exception.TransientConnectorException;
import de.netcompliance.core.model.VendorType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static de.netcompliance.fixtures.Fixtures.device;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelPathConnectorTest {

    @Test
    void testFetchAppliesFilterToSubtree() {
        // given
        final InMemoryModelPathTransport transport = new InMemoryModelPathTransport();
        transport.tree.put("/configure/system/security/ssh", Map.of("server-admin-state", "enable", "preserve-key", "true"));
        final ModelPathConnector connector = new ModelPathConnector(device("core-01", VendorType.NOKIA_SROS), transport);

        // when
        final FetchResult whole = connector.fetch("/configure/system/security/ssh", null);
        final FetchResult narrowed = connector.fetch("/configure/system/security/ssh", Map.of("server-admin-state", ""));
        final FetchResult absent = connector.fetch("/configure/system/telnet", null);

        // then
        assertThat(whole.getValue()).contains(Map.of("server-admin-state", "enable", "preserve-key", "true"));
        assertThat(narrowed.getValue()).contains(Map.of("server-admin-state", "enable"));
        assertThat(absent.isFound()).isFalse();
    }

    @Test
    void testFetchRejectsXmlFilter() {
        // given
        final ModelPathConnector connector = new ModelPathConnector(device("core-01", VendorType.NOKIA_SROS),
                new InMemoryModelPathTransport());

        // when / then
        assertThatThrownBy(() -> connector.fetch("/configure", "<ssh/>"))
                .isInstanceOf(PermanentConnectorException.class);
    }

    @Test
    void testPushAppliesEditsAndCommits() {
        // given
        final InMemoryModelPathTransport transport = new InMemoryModelPathTransport();
        final ModelPathConnector connector = new ModelPathConnector(device("core-01", VendorType.NOKIA_SROS), transport);

        // when
        final PushResult result = connector.push(PushRequest.builder()
                .edits(List.of(PathEdit.update("/configure/system/name", "core-01")))
                .commitComment("rename")
                .build());

        // then
        assertThat(result.isCommitted()).isTrue();
        assertThat(transport.tree).containsEntry("/configure/system/name", "core-01");
        assertThat(transport.operations).containsExactly("apply", "commit rename");
    }

    @Test
    void testFailedCommitIsDiscarded() {
        // given
        final InMemoryModelPathTransport transport = new InMemoryModelPathTransport();
        transport.commitFailure = new TransientConnectorException("commit in progress");
        final ModelPathConnector connector = new ModelPathConnector(device("core-01", VendorType.NOKIA_SROS), transport);

        // when / then
        assertThatThrownBy(() -> connector.push(PushRequest.builder()
                .edits(List.of(PathEdit.delete("/configure/system/banner")))
                .build()))
                .isInstanceOf(TransientConnectorException.class);
        assertThat(transport.operations).containsExactly("apply", "commit", "discard");
    }

    @Test
    void testRestoreReplacesCapturedValuesAndDeletesNewPaths() {
        // given
        final InMemoryModelPathTransport transport = new InMemoryModelPathTransport();
        transport.tree.put("/configure/system/name", "old-name");
        final ModelPathConnector connector = new ModelPathConnector(device("core-01", VendorType.NOKIA_SROS), transport);
        final PushRequest request = PushRequest.builder()
                .edits(List.of(
                        PathEdit.update("/configure/system/name", "new-name"),
                        PathEdit.update("/configure/system/location", "lab")))
                .build();

        // when
        final ConfigSnapshot snapshot = connector.snapshot(request);
        connector.push(request);
        connector.restore(snapshot);

        // then
        assertThat(transport.tree).containsEntry("/configure/system/name", "old-name");
        assertThat(transport.tree).doesNotContainKey("/configure/system/location");
    }

    private static final class InMemoryModelPathTransport implements ModelPathTransport {

        private final Map<String, Object> tree = new LinkedHashMap<>();
        private final List<PathEdit> staged = new ArrayList<>();
        private final List<String> operations = new ArrayList<>();
        private TransientConnectorException commitFailure;

        @Override
        public Optional<Object> get(final String path) {
            return Optional.ofNullable(tree.get(path));
        }

        @Override
        public void apply(final List<PathEdit> edits) {
            operations.add("apply");
            staged.addAll(edits);
        }

        @Override
        public void commit(final String comment) {
            operations.add(Objects.isNull(comment) ? "commit" : "commit " + comment);
            if (Objects.nonNull(commitFailure)) throw commitFailure;
            staged.forEach(edit -> {
                if (edit.action() == PathEdit.Action.DELETE) {
                    tree.remove(edit.path());
                } else {
                    tree.put(edit.path(), edit.value());
                }
            });
            staged.clear();
        }

        @Override
        public void discard() {
            operations.add("discard");
            staged.clear();
        }

        @Override
        public void close() {
            operations.add("close");
        }
    }
}
