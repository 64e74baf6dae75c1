package se.alipsa.jrelate.engine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jrelate.Record;
import se.alipsa.jrelate.RecordSequence;

/**
 * Lazy implementation of {@code INNER}, {@code LEFT}, {@code RIGHT} and
 * {@code FULL} joins between two record sequences.
 *
 * <p>
 * The right side is materialized on the first {@link #read()}; the left side is
 * streamed. Matched pairs are merged with {@link Record#merge(Record, Record)}
 * (right values win on a name clash) and emitted in left-major, right-minor
 * order. Unmatched left records are emitted right after their scan for
 * {@code LEFT} joins. For {@code FULL} joins they are held back until every
 * pair has been produced, followed by the unmatched right records; {@code RIGHT}
 * joins only append the unmatched right records.
 * </p>
 *
 * <p>
 * With {@link JoinStrategy#HASH} the right side is indexed by
 * {@link KeyExtractor#extractKey(Record)} and each left record is only compared
 * with the right records of its bucket. Every candidate is verified with
 * {@link JoinPredicate#match(Record, Record)} regardless of the strategy, so
 * both strategies produce the same records in the same order.
 * </p>
 */
public final class JoinRecordReader implements RecordReader {

  private static final Logger log = LoggerFactory.getLogger(JoinRecordReader.class);

  private enum Phase {
    BUILD, MATCH, UNMATCHED_LEFT, UNMATCHED_RIGHT, DONE
  }

  private final RecordSequence leftSequence;
  private final RecordSequence rightSequence;
  private final JoinPredicate predicate;
  private final JoinType joinType;
  private final JoinStrategy strategy;

  private Phase phase = Phase.BUILD;
  private RecordReader left;
  private List<Record> rightRows;
  private boolean[] rightMatched;
  private List<Record> unmatchedLeft;
  private JoinCandidates candidates;
  private Record currentLeft;
  private int[] currentCandidates;
  private int candidatePosition;
  private boolean currentMatched;
  private int drainPosition;
  private boolean closed;

  /**
   * Create a reader joining {@code left} with {@code right}. Nothing is read
   * until the first call to {@link #read()}.
   *
   * @param left
   *          the left (streamed) sequence
   * @param right
   *          the right (materialized) sequence
   * @param predicate
   *          the join condition
   * @param joinType
   *          the join variant
   * @param strategy
   *          the requested strategy, resolved with
   *          {@link JoinStrategy#resolve(JoinPredicate)}
   */
  public JoinRecordReader(RecordSequence left, RecordSequence right, JoinPredicate predicate, JoinType joinType,
      JoinStrategy strategy) {
    this.leftSequence = Objects.requireNonNull(left, "left");
    this.rightSequence = Objects.requireNonNull(right, "right");
    this.predicate = Objects.requireNonNull(predicate, "predicate");
    this.joinType = Objects.requireNonNull(joinType, "joinType");
    this.strategy = Objects.requireNonNull(strategy, "strategy").resolve(predicate);
  }

  /**
   * The strategy this reader joins with.
   *
   * @return {@link JoinStrategy#HASH} or {@link JoinStrategy#NESTED_LOOP}
   */
  public JoinStrategy strategy() {
    return strategy;
  }

  @Override
  public Record read() throws IOException {
    while (!closed) {
      switch (phase) {
        case BUILD -> build();
        case MATCH -> {
          Record joined = nextMatch();
          if (joined != null) {
            return joined;
          }
        }
        case UNMATCHED_LEFT -> {
          if (drainPosition < unmatchedLeft.size()) {
            return unmatchedLeft.get(drainPosition++);
          }
          drainPosition = 0;
          phase = Phase.UNMATCHED_RIGHT;
        }
        case UNMATCHED_RIGHT -> {
          while (drainPosition < rightRows.size()) {
            int position = drainPosition++;
            if (!rightMatched[position]) {
              return rightRows.get(position);
            }
          }
          phase = Phase.DONE;
        }
        case DONE -> {
          release();
          return null;
        }
        default -> throw new IllegalStateException("Unexpected join phase " + phase);
      }
    }
    return null;
  }

  private void build() throws IOException {
    List<Record> rows = new ArrayList<>();
    try (RecordReader right = rightSequence.open()) {
      Record record;
      while ((record = right.read()) != null) {
        rows.add(record);
      }
    }
    rightRows = rows;
    if (joinType.preservesRight()) {
      rightMatched = new boolean[rows.size()];
    }
    if (joinType == JoinType.FULL) {
      unmatchedLeft = new ArrayList<>();
    }
    candidates = strategy == JoinStrategy.HASH
        ? JoinCandidates.hash(rows, (KeyExtractor) predicate)
        : JoinCandidates.nestedLoop(rows.size());
    if (log.isDebugEnabled()) {
      log.debug("{} join on {} using {} strategy: {} right rows, {} buckets", joinType, predicate, strategy,
          rows.size(), candidates.bucketCount());
    }
    if (rows.isEmpty() && !joinType.preservesLeft()) {
      // nothing can match and no left record is preserved
      phase = Phase.DONE;
      return;
    }
    left = leftSequence.open();
    phase = Phase.MATCH;
  }

  private Record nextMatch() throws IOException {
    while (true) {
      if (currentLeft == null) {
        Record next = left.read();
        if (next == null) {
          finishMatching();
          return null;
        }
        currentLeft = next;
        currentCandidates = candidates.candidatesFor(next);
        candidatePosition = 0;
        currentMatched = false;
      }
      while (candidatePosition < currentCandidates.length) {
        int rightPosition = currentCandidates[candidatePosition++];
        Record right = rightRows.get(rightPosition);
        if (predicate.match(currentLeft, right)) {
          currentMatched = true;
          if (rightMatched != null) {
            rightMatched[rightPosition] = true;
          }
          return Record.merge(currentLeft, right);
        }
      }
      Record scanned = currentLeft;
      currentLeft = null;
      currentCandidates = null;
      if (!currentMatched) {
        if (joinType == JoinType.LEFT) {
          return scanned;
        }
        if (joinType == JoinType.FULL) {
          unmatchedLeft.add(scanned);
        }
      }
    }
  }

  private void finishMatching() throws IOException {
    RecordReader exhausted = left;
    left = null;
    exhausted.close();
    candidates = null;
    drainPosition = 0;
    if (joinType == JoinType.FULL) {
      phase = Phase.UNMATCHED_LEFT;
    } else if (joinType == JoinType.RIGHT) {
      phase = Phase.UNMATCHED_RIGHT;
    } else {
      phase = Phase.DONE;
    }
  }

  private void release() {
    rightRows = null;
    rightMatched = null;
    unmatchedLeft = null;
    candidates = null;
    currentLeft = null;
    currentCandidates = null;
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    phase = Phase.DONE;
    release();
    if (left != null) {
      RecordReader open = left;
      left = null;
      open.close();
    }
  }
}
