package ca.gc.cra.didagent.infrastructure.connection;

import ca.gc.cra.didagent.domain.connection.ConnectionRecord;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * In-memory connection records shared by every connection manager built from one context.
 */
public final class ConnectionStore {
  private final ConcurrentMap<String, ConnectionRecord> records = new ConcurrentHashMap<>();

  public void save(ConnectionRecord record) {
    records.put(Objects.requireNonNull(record, "record").connectionId(), record);
  }

  public Optional<ConnectionRecord> find(String connectionId) {
    return connectionId == null ? Optional.empty() : Optional.ofNullable(records.get(connectionId));
  }

  public Optional<ConnectionRecord> findFirst(Predicate<ConnectionRecord> filter) {
    return records.values().stream().filter(filter).findFirst();
  }

  public List<ConnectionRecord> all() {
    return List.copyOf(records.values());
  }

  public int size() {
    return records.size();
  }
}
