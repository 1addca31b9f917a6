package jmonroe.support;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import se.alipsa.jmonroe.StoreException;
import se.alipsa.jmonroe.store.RowSet;
import se.alipsa.jmonroe.store.TimeSeriesStore;

/**
 * In-memory store answering queries from a script of rules. The first rule whose predicate
 * matches a query answers it; unmatched queries return an empty result. Every executed query is
 * recorded.
 */
public final class ScriptedStore implements TimeSeriesStore {

  private final List<Rule> rules = new ArrayList<>();
  private final List<String> executed = Collections.synchronizedList(new ArrayList<>());
  private Duration timeout = Duration.ofSeconds(30);

  @FunctionalInterface
  public interface Answer {
    RowSet answer(String query) throws StoreException;
  }

  private record Rule(Predicate<String> matches, Answer answer) {
  }

  public ScriptedStore on(Predicate<String> matches, Answer answer) {
    rules.add(new Rule(matches, answer));
    return this;
  }

  public ScriptedStore onContaining(String fragment, RowSet result) {
    return on(q -> q.contains(fragment), q -> result);
  }

  public ScriptedStore failOnContaining(String fragment, String message) {
    return on(q -> q.contains(fragment), q -> {
      throw new StoreException(message);
    });
  }

  public ScriptedStore delayOnContaining(String fragment, long millis, RowSet result) {
    return on(q -> q.contains(fragment), q -> {
      try {
        Thread.sleep(millis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new StoreException("interrupted", e);
      }
      return result;
    });
  }

  public ScriptedStore timeout(Duration value) {
    this.timeout = value;
    return this;
  }

  @Override
  public RowSet executeQuery(String query) throws StoreException {
    executed.add(query);
    for (Rule rule : rules) {
      if (rule.matches().test(query)) {
        return rule.answer().answer(query);
      }
    }
    return RowSet.EMPTY;
  }

  @Override
  public Duration timeout() {
    return timeout;
  }

  public List<String> executed() {
    synchronized (executed) {
      return List.copyOf(executed);
    }
  }

  public List<String> executedContaining(String fragment) {
    List<String> matching = new ArrayList<>();
    for (String query : executed()) {
      if (query.contains(fragment)) {
        matching.add(query);
      }
    }
    return matching;
  }
}
