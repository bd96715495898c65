package db.columnar.exec;

import java.util.Arrays;

import db.columnar.storage.Relation;

/**
 * Pull contract for row identifiers: positions into one {@link Relation}.
 * Single pass; a stream that has been drained or closed cannot be restarted.
 */
public interface RowIdStream {
    int END = -1;

    void open();
    int next(); // returns next row position or END when exhausted
    void close();

    /** Relation the produced positions refer to. */
    Relation relation();

    /** Opens, drains and closes {@code stream}, returning the positions in stream order. */
    static int[] drain(RowIdStream stream) {
        int[] buf = new int[16];
        int n = 0;
        stream.open();
        int row;
        while ((row = stream.next()) != END) {
            if (n == buf.length) buf = Arrays.copyOf(buf, n * 2);
            buf[n++] = row;
        }
        stream.close();
        return Arrays.copyOf(buf, n);
    }
}
