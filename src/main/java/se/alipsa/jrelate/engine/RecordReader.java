package se.alipsa.jrelate.engine;

import java.io.Closeable;
import java.io.IOException;
import se.alipsa.jrelate.Record;

/**
 * Minimal abstraction for sequential, pull based access to {@link Record}
 * instances. Work happens only inside {@link #read()}; a consumer that is done
 * early simply stops reading and closes the reader.
 */
public interface RecordReader extends Closeable {

  /**
   * Read the next available record.
   *
   * @return the next {@link Record}, or {@code null} when exhausted or closed
   * @throws IOException
   *           if reading from an upstream source fails
   */
  Record read() throws IOException;

  /**
   * Release the reader and every upstream reader it still holds open. Reading
   * from a closed reader returns {@code null}.
   *
   * @throws IOException
   *           if an upstream reader fails to close
   */
  @Override
  void close() throws IOException;
}
